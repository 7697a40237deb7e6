package io.github.yok.sqlinsert.core;

import io.github.yok.sqlinsert.db.ExecutionContext;
import io.github.yok.sqlinsert.db.InsertExecutor;
import io.github.yok.sqlinsert.token.TokenType;
import java.sql.SQLException;
import java.util.List;

/**
 * Produces a parameterized {@code INSERT} statement with its bind arguments and optionally
 * executes it.
 *
 * <p>
 * Methods without a {@link TokenType} parameter use the token type of the configuration the
 * inserter was built with.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface Inserter {

    /**
     * Tokenizes the fields of the first record without wrapping.
     *
     * @param tokenType rendering style
     * @return joined tokens
     */
    String tokenize(TokenType tokenType);

    /**
     * Returns the wrapped column clause, e.g. {@code (id, weight)}.
     *
     * @return column clause
     */
    String columns();

    /**
     * Returns the placeholder clause with the configured token type.
     *
     * @return placeholder clause
     */
    String params();

    /**
     * Returns the placeholder clause, one wrapped group per record.
     *
     * @param tokenType placeholder style
     * @return placeholder clause
     */
    String params(TokenType tokenType);

    /**
     * Returns the full statement with the configured token type.
     *
     * @return SQL text
     */
    String sql();

    /**
     * Returns {@code INSERT INTO <table> <columns> VALUES <params>}.
     *
     * @param tokenType placeholder style
     * @return SQL text
     */
    String sql(TokenType tokenType);

    /**
     * Returns the values of all records in row-major order.
     *
     * @return bind arguments aligned with the placeholders
     */
    List<Object> args();

    /**
     * Prepares and executes the statement with the configured token type.
     *
     * @param executor statement executor
     * @return affected row count
     * @throws SQLException as reported by the executor
     */
    int insert(InsertExecutor executor) throws SQLException;

    /**
     * Prepares and executes the statement. The prepared handle is closed before returning.
     *
     * @param tokenType placeholder style
     * @param executor statement executor
     * @return affected row count
     * @throws SQLException as reported by the executor
     */
    int insert(TokenType tokenType, InsertExecutor executor) throws SQLException;

    /**
     * Prepares and executes the statement under a cancellation token with the configured token
     * type.
     *
     * @param context cancellation token
     * @param executor statement executor
     * @return affected row count
     * @throws SQLException as reported by the executor, or when cancelled
     */
    int insertWithContext(ExecutionContext context, InsertExecutor executor) throws SQLException;

    /**
     * Prepares and executes the statement under a cancellation token passed to both steps.
     *
     * @param context cancellation token
     * @param tokenType placeholder style
     * @param executor statement executor
     * @return affected row count
     * @throws SQLException as reported by the executor, or when cancelled
     */
    int insertWithContext(ExecutionContext context, TokenType tokenType, InsertExecutor executor)
            throws SQLException;
}
