package io.github.yok.sqlinsert.core;

import com.google.common.base.Preconditions;
import io.github.yok.sqlinsert.config.InsertConfig;
import io.github.yok.sqlinsert.db.InsertExecutor;
import io.github.yok.sqlinsert.record.InsertRecord;
import java.sql.SQLException;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point that builds {@link InsertStatement}s with an application-wide default
 * {@link InsertConfig}.
 *
 * <p>
 * The config is fixed at construction and handed to every statement, so concurrent callers always
 * render with the same settings. Callers needing a different placeholder style for one statement
 * pass a {@link io.github.yok.sqlinsert.token.TokenType} to that statement's methods.
 * </p>
 *
 * <pre>
 * SqlInserter inserter = new SqlInserter();
 * String sql = inserter.statement("candy", candy).sql(TokenType.ORDINAL_NUMBER);
 * inserter.insert("candy", candies, new ConnectionInsertExecutor(connection));
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class SqlInserter {

    private final InsertConfig config;

    /**
     * Creates an inserter with {@link InsertConfig#defaults()}.
     */
    public SqlInserter() {
        this(InsertConfig.defaults());
    }

    /**
     * Creates an inserter.
     *
     * @param config default settings for every statement
     */
    public SqlInserter(InsertConfig config) {
        this.config = Preconditions.checkNotNull(config, "config must not be null");
    }

    /**
     * Builds a statement for a request.
     *
     * @param request table and records
     * @return statement
     */
    public InsertStatement statement(InsertRequest request) {
        return new InsertStatement(request, config);
    }

    /**
     * Builds a statement for one or more records.
     *
     * @param table target table
     * @param records records in insertion order
     * @return statement
     */
    public InsertStatement statement(String table, InsertRecord... records) {
        return statement(InsertRequest.of(table, records));
    }

    /**
     * Builds a statement for a batch of records.
     *
     * @param table target table
     * @param records records in insertion order
     * @return statement
     */
    public InsertStatement statement(String table, List<? extends InsertRecord> records) {
        return statement(InsertRequest.of(table, records));
    }

    /**
     * Builds a statement for annotated beans using the configured annotation key.
     *
     * @param table target table
     * @param data a bean, an array of beans or an {@link Iterable} of beans
     * @return statement
     */
    public InsertStatement statementForBeans(String table, Object data) {
        return statement(InsertRequest.ofBeans(table, data, config.getAnnotationKey()));
    }

    /**
     * Builds and executes a statement for a batch of records.
     *
     * @param table target table
     * @param records records in insertion order
     * @param executor statement executor
     * @return affected row count
     * @throws SQLException as reported by the executor
     */
    public int insert(String table, List<? extends InsertRecord> records, InsertExecutor executor)
            throws SQLException {
        int inserted = statement(table, records).insert(executor);
        log.info("Inserted rows. table={}, count={}", table, inserted);
        return inserted;
    }

    /**
     * Builds and executes a statement for annotated beans.
     *
     * @param table target table
     * @param data a bean, an array of beans or an {@link Iterable} of beans
     * @param executor statement executor
     * @return affected row count
     * @throws SQLException as reported by the executor
     */
    public int insertBeans(String table, Object data, InsertExecutor executor)
            throws SQLException {
        int inserted = statementForBeans(table, data).insert(executor);
        log.info("Inserted rows. table={}, count={}", table, inserted);
        return inserted;
    }
}
