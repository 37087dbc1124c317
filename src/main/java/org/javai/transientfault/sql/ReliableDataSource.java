package org.javai.transientfault.sql;

import org.javai.transientfault.retry.RetryPolicy;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens connections and runs database work through retry policies.
 *
 * <p>Opening a connection is protected by the connection policy. {@link #execute(SqlWork)} opens
 * a fresh connection for each attempt, runs the work and closes the connection, protected by
 * the command policy; each attempt of the work therefore sees a new connection.</p>
 *
 * <pre>{@code
 * RetryManager manager = RetryManager.getInstance();
 * ReliableDataSource db = new ReliableDataSource(dataSource,
 *         manager.getDefaultSqlConnectionRetryPolicy(),
 *         manager.getDefaultSqlCommandRetryPolicy());
 *
 * int count = db.execute(connection -> {
 *     try (PreparedStatement statement = connection.prepareStatement("select count(*) from orders");
 *          ResultSet rows = statement.executeQuery()) {
 *         rows.next();
 *         return rows.getInt(1);
 *     }
 * });
 * }</pre>
 */
public class ReliableDataSource {

    private final DataSource dataSource;
    private final RetryPolicy connectionPolicy;
    private final RetryPolicy commandPolicy;

    /**
     * Creates a data source that does not retry.
     */
    public ReliableDataSource(DataSource dataSource) {
        this(dataSource, null, null);
    }

    /**
     * @param dataSource the underlying data source
     * @param connectionPolicy protects opening connections; null means no retry
     * @param commandPolicy protects units of work; null means no retry
     */
    public ReliableDataSource(DataSource dataSource, RetryPolicy connectionPolicy, RetryPolicy commandPolicy) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.connectionPolicy = connectionPolicy != null ? connectionPolicy : RetryPolicy.noRetry();
        this.commandPolicy = commandPolicy != null ? commandPolicy : RetryPolicy.noRetry();
    }

    public RetryPolicy connectionPolicy() {
        return connectionPolicy;
    }

    public RetryPolicy commandPolicy() {
        return commandPolicy;
    }

    /**
     * Opens a connection, retrying transient failures. The caller owns the connection.
     */
    public Connection getConnection() throws SQLException {
        return connectionPolicy.execute(dataSource::getConnection);
    }

    /**
     * Runs the work on a fresh connection, retrying transient failures of the whole unit.
     *
     * @return the result of the first successful attempt
     * @throws SQLException the failure of the last attempt
     */
    public <T> T execute(SqlWork<T> work) throws SQLException {
        Objects.requireNonNull(work, "work must not be null");
        return commandPolicy.execute(() -> {
            try (Connection connection = getConnection()) {
                return work.apply(connection);
            }
        });
    }
}
