package io.github.yok.sqlinsert.core;

import com.google.common.base.Preconditions;
import io.github.yok.sqlinsert.config.InsertConfig;
import io.github.yok.sqlinsert.db.ExecutionContext;
import io.github.yok.sqlinsert.db.InsertExecutor;
import io.github.yok.sqlinsert.db.PreparedHandle;
import io.github.yok.sqlinsert.record.InsertRecord;
import io.github.yok.sqlinsert.record.RecordField;
import io.github.yok.sqlinsert.token.TokenFormat;
import io.github.yok.sqlinsert.token.TokenType;
import io.github.yok.sqlinsert.token.Tokenizer;
import io.github.yok.sqlinsert.util.BindArgLogUtil;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Inserter} for one {@link InsertRequest}.
 *
 * <p>
 * <strong>Shape:</strong> the column clause and the placeholder group are derived from the first
 * record only. The other records of a batch are assumed to expose the same fields in the same
 * order; this is not verified. A record with fewer fields than the first one makes {@link #args()}
 * fail with {@link IndexOutOfBoundsException}.
 * </p>
 *
 * <p>
 * <strong>Multi-row placeholders:</strong> for a batch of {@code n} records the placeholder group
 * is rendered once and repeated {@code n} times. With {@link TokenType#ORDINAL_NUMBER} every group
 * therefore reads {@code ($1, $2, ..., $k)} rather than continuing the numbering across rows.
 * Drivers that require unique ordinal placeholders across the whole statement will not bind such a
 * multi-row statement correctly; use {@link TokenType#QUESTION_MARK} or insert row by row for
 * them.
 * </p>
 *
 * <p>
 * No identifier is quoted or escaped. Table and column names appear in the SQL text exactly as
 * supplied.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class InsertStatement implements Inserter {

    private static final String INSERT_INTO = "INSERT INTO ";

    private static final String VALUES = " VALUES ";

    @Getter
    private final InsertRequest request;

    @Getter
    private final InsertConfig config;

    // Fields of the first record, read once
    private final List<RecordField> shape;

    /**
     * Creates a statement.
     *
     * @param request table and records
     * @param config rendering settings
     */
    public InsertStatement(InsertRequest request, InsertConfig config) {
        this.request = Preconditions.checkNotNull(request, "request must not be null");
        this.config = Preconditions.checkNotNull(config, "config must not be null");
        this.shape = Preconditions.checkNotNull(request.first().fields(),
                "fields of the first record must not be null");
    }

    /**
     * Creates a statement with {@link InsertConfig#defaults()}.
     *
     * @param request table and records
     * @return statement
     */
    public static InsertStatement of(InsertRequest request) {
        return new InsertStatement(request, InsertConfig.defaults());
    }

    @Override
    public String tokenize(TokenType tokenType) {
        return Tokenizer.tokenize(shape, tokenType, config.getFormat());
    }

    @Override
    public String columns() {
        return config.getFormat().wrap(tokenize(TokenType.COLUMN_NAME));
    }

    @Override
    public String params() {
        return params(config.getTokenType());
    }

    @Override
    public String params(TokenType tokenType) {
        TokenFormat format = config.getFormat();
        String group = format.wrap(tokenize(tokenType));
        int rows = request.size();
        if (rows == 1) {
            return group;
        }
        StringBuilder builder = new StringBuilder(group);
        for (int i = 1; i < rows; i++) {
            builder.append(format.getSeparator()).append(group);
        }
        return builder.toString();
    }

    @Override
    public String sql() {
        return sql(config.getTokenType());
    }

    @Override
    public String sql(TokenType tokenType) {
        return INSERT_INTO + request.getTable() + " " + columns() + VALUES + params(tokenType);
    }

    @Override
    public List<Object> args() {
        int width = shape.size();
        List<Object> args = new ArrayList<>(request.size() * width);
        boolean first = true;
        for (InsertRecord record : request.getRecords()) {
            List<RecordField> fields = first ? shape : record.fields();
            first = false;
            for (int i = 0; i < width; i++) {
                args.add(fields.get(i).getValue());
            }
        }
        return Collections.unmodifiableList(args);
    }

    @Override
    public int insert(InsertExecutor executor) throws SQLException {
        return insert(config.getTokenType(), executor);
    }

    @Override
    public int insert(TokenType tokenType, InsertExecutor executor) throws SQLException {
        Preconditions.checkNotNull(executor, "executor must not be null");
        String statementSql = sql(tokenType);
        List<Object> bindArgs = args();
        logStatement(statementSql, bindArgs);
        try (PreparedHandle handle = executor.prepare(statementSql)) {
            return handle.execute(bindArgs);
        } catch (SQLException e) {
            log.error("Insert failed. table={}, sql={}: {}", request.getTable(), statementSql,
                    e.getMessage());
            throw e;
        }
    }

    @Override
    public int insertWithContext(ExecutionContext context, InsertExecutor executor)
            throws SQLException {
        return insertWithContext(context, config.getTokenType(), executor);
    }

    @Override
    public int insertWithContext(ExecutionContext context, TokenType tokenType,
            InsertExecutor executor) throws SQLException {
        Preconditions.checkNotNull(context, "context must not be null");
        Preconditions.checkNotNull(executor, "executor must not be null");
        String statementSql = sql(tokenType);
        List<Object> bindArgs = args();
        logStatement(statementSql, bindArgs);
        try (PreparedHandle handle = executor.prepare(context, statementSql)) {
            return handle.execute(context, bindArgs);
        } catch (SQLException e) {
            log.error("Insert failed. table={}, sql={}, cancelled={}: {}", request.getTable(),
                    statementSql, context.isCancelled(), e.getMessage());
            throw e;
        }
    }

    private void logStatement(String statementSql, List<Object> bindArgs) {
        if (log.isDebugEnabled()) {
            log.debug("Executing insert. table={}, rows={}, sql={}, args={}", request.getTable(),
                    request.size(), statementSql, BindArgLogUtil.renderArgs(bindArgs));
        }
    }
}
