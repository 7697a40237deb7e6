package io.github.yok.sqlinsert.db;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DataSourceUtils;

/**
 * {@link InsertExecutor} over a {@link DataSource}.
 *
 * <p>
 * Connections are obtained with {@link DataSourceUtils}, so an insert joins the Spring-managed
 * transaction bound to the current thread when there is one. The connection is released when the
 * prepared handle is closed; a transactional connection stays open until its transaction ends.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataSourceInsertExecutor implements InsertExecutor {

    private final DataSource dataSource;

    /**
     * Creates an executor.
     *
     * @param dataSource data source to obtain connections from
     */
    public DataSourceInsertExecutor(DataSource dataSource) {
        this.dataSource = Preconditions.checkNotNull(dataSource, "dataSource must not be null");
    }

    @Override
    public PreparedHandle prepare(String sql) throws SQLException {
        Connection connection = DataSourceUtils.doGetConnection(dataSource);
        PreparedStatement statement = prepareOrRelease(connection, sql);
        return JdbcPreparedHandle.of(statement, () -> release(connection));
    }

    @Override
    public PreparedHandle prepare(ExecutionContext context, String sql) throws SQLException {
        context.throwIfCancelled();
        Connection connection = DataSourceUtils.doGetConnection(dataSource);
        PreparedStatement statement = prepareOrRelease(connection, sql);
        try {
            return JdbcPreparedHandle.of(statement, context, () -> release(connection));
        } catch (SQLException e) {
            // the statement is already closed by the handle factory
            release(connection);
            throw e;
        }
    }

    private PreparedStatement prepareOrRelease(Connection connection, String sql)
            throws SQLException {
        try {
            log.debug("Preparing statement on data source connection. sql={}", sql);
            return connection.prepareStatement(sql);
        } catch (SQLException | RuntimeException e) {
            release(connection);
            throw e;
        }
    }

    private void release(Connection connection) {
        DataSourceUtils.releaseConnection(connection, dataSource);
    }
}
