package io.github.yok.sqlinsert.db;

import java.sql.SQLException;

/**
 * Collaborator that prepares SQL into executable statements.
 *
 * <p>
 * Implementations wrap a JDBC {@link java.sql.Connection}, a {@link javax.sql.DataSource}, or any
 * other driver able to prepare a statement and execute it with positional arguments. Errors are
 * reported as {@link SQLException} and are passed to the caller unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConnectionInsertExecutor
 * @see DataSourceInsertExecutor
 */
@FunctionalInterface
public interface InsertExecutor {

    /**
     * Prepares a statement.
     *
     * @param sql SQL text
     * @return prepared handle owned by the caller
     * @throws SQLException if preparation fails
     */
    PreparedHandle prepare(String sql) throws SQLException;

    /**
     * Prepares a statement under a cancellation token.
     *
     * <p>
     * The default implementation fails fast when the context is cancelled and otherwise delegates
     * to {@link #prepare(String)}.
     * </p>
     *
     * @param context cancellation token
     * @param sql SQL text
     * @return prepared handle owned by the caller
     * @throws SQLException if preparation fails or the context is cancelled
     */
    default PreparedHandle prepare(ExecutionContext context, String sql) throws SQLException {
        context.throwIfCancelled();
        return prepare(sql);
    }
}
