package io.github.yok.sqlinsert.db;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link InsertExecutor} over a caller-owned JDBC {@link Connection}.
 *
 * <p>
 * The connection is neither closed nor committed; transaction boundaries stay with the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionInsertExecutor implements InsertExecutor {

    private final Connection connection;

    /**
     * Creates an executor.
     *
     * @param connection open JDBC connection
     */
    public ConnectionInsertExecutor(Connection connection) {
        this.connection = Preconditions.checkNotNull(connection, "connection must not be null");
    }

    @Override
    public PreparedHandle prepare(String sql) throws SQLException {
        log.debug("Preparing statement on connection. sql={}", sql);
        return JdbcPreparedHandle.of(connection.prepareStatement(sql), null);
    }

    @Override
    public PreparedHandle prepare(ExecutionContext context, String sql) throws SQLException {
        context.throwIfCancelled();
        log.debug("Preparing statement on connection with context. sql={}, timeout={}", sql,
                context.getTimeout().orElse(null));
        return JdbcPreparedHandle.of(connection.prepareStatement(sql), context, null);
    }
}
