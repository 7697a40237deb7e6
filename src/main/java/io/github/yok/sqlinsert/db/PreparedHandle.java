package io.github.yok.sqlinsert.db;

import java.sql.SQLException;
import java.util.List;

/**
 * Prepared statement obtained from an {@link InsertExecutor}.
 *
 * <p>
 * A handle is owned by the insert call that prepared it and is closed before that call returns,
 * on success and on failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface PreparedHandle extends AutoCloseable {

    /**
     * Executes the statement with positional arguments.
     *
     * @param args arguments in placeholder order; elements may be {@code null}
     * @return affected row count
     * @throws SQLException if execution fails
     */
    int execute(List<Object> args) throws SQLException;

    /**
     * Executes the statement under a cancellation token.
     *
     * <p>
     * The default implementation fails fast when the context is cancelled and otherwise delegates
     * to {@link #execute(List)}.
     * </p>
     *
     * @param context cancellation token
     * @param args arguments in placeholder order
     * @return affected row count
     * @throws SQLException if execution fails or the context is cancelled
     */
    default int execute(ExecutionContext context, List<Object> args) throws SQLException {
        context.throwIfCancelled();
        return execute(args);
    }

    /**
     * Releases the statement.
     *
     * @throws SQLException if release fails
     */
    @Override
    void close() throws SQLException;
}
