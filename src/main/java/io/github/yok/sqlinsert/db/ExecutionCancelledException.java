package io.github.yok.sqlinsert.db;

import java.sql.SQLException;

/**
 * Thrown when an insert is attempted through an {@link ExecutionContext} that has already been
 * cancelled.
 *
 * @author Yasuharu.Okawauchi
 */
public class ExecutionCancelledException extends SQLException {

    private static final long serialVersionUID = 1L;

    // SQLSTATE class 57 "operator intervention", 57014 "query canceled"
    private static final String SQL_STATE_QUERY_CANCELED = "57014";

    /**
     * Creates the exception.
     *
     * @param message detail message
     */
    public ExecutionCancelledException(String message) {
        super(message, SQL_STATE_QUERY_CANCELED);
    }
}
