package io.github.yok.sqlinsert.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link PreparedHandle} backed by a JDBC {@link PreparedStatement}.
 *
 * <p>
 * Arguments are bound by position with {@link PreparedStatement#setObject(int, Object)};
 * {@code null} is bound with {@link PreparedStatement#setNull(int, int)} and
 * {@link Types#NULL}. JDBC understands {@code ?} placeholders only, so statements rendered with
 * named or numbered placeholders must be sent through a driver that accepts them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
final class JdbcPreparedHandle implements PreparedHandle {

    private final PreparedStatement statement;

    // Cancel callback registration, null without context
    private final ExecutionContext.Registration registration;

    // Runs after the statement is closed, null when nothing else is owned
    private final Runnable onClose;

    private JdbcPreparedHandle(PreparedStatement statement,
            ExecutionContext.Registration registration, Runnable onClose) {
        this.statement = statement;
        this.registration = registration;
        this.onClose = onClose;
    }

    /**
     * Wraps a statement prepared without context.
     *
     * @param statement prepared statement
     * @param onClose action run after the statement is closed, may be {@code null}
     * @return handle
     */
    static JdbcPreparedHandle of(PreparedStatement statement, Runnable onClose) {
        return new JdbcPreparedHandle(statement, null, onClose);
    }

    /**
     * Wraps a statement prepared under a context. The context timeout is applied as query timeout
     * and {@link PreparedStatement#cancel()} is registered as cancel callback.
     *
     * @param statement prepared statement
     * @param context cancellation token
     * @param onClose action run after the statement is closed, may be {@code null}
     * @return handle
     * @throws SQLException if the timeout cannot be applied; the statement is closed
     */
    static JdbcPreparedHandle of(PreparedStatement statement, ExecutionContext context,
            Runnable onClose) throws SQLException {
        try {
            if (context.getTimeout().isPresent()) {
                statement.setQueryTimeout(toSeconds(context.getTimeout().get()));
            }
        } catch (SQLException e) {
            closeAfterFailure(statement, e);
            throw e;
        }
        ExecutionContext.Registration registration =
                context.onCancel(() -> cancelStatement(statement));
        return new JdbcPreparedHandle(statement, registration, onClose);
    }

    @Override
    public int execute(List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object value = args.get(i);
            if (value == null) {
                statement.setNull(i + 1, Types.NULL);
            } else {
                statement.setObject(i + 1, value);
            }
        }
        return statement.executeUpdate();
    }

    @Override
    public void close() throws SQLException {
        if (registration != null) {
            registration.close();
        }
        try {
            statement.close();
        } finally {
            if (onClose != null) {
                onClose.run();
            }
        }
    }

    /**
     * Converts a timeout into JDBC query-timeout seconds, rounding up.
     *
     * @param timeout positive timeout
     * @return seconds, at least 1
     */
    static int toSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    private static void cancelStatement(PreparedStatement statement) {
        try {
            statement.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel statement: {}", e.getMessage(), e);
        }
    }

    private static void closeAfterFailure(PreparedStatement statement, SQLException primary) {
        try {
            statement.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }
}
