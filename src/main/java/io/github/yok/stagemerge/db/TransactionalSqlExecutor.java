package io.github.yok.stagemerge.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Transactional executor bound to a single connection with auto-commit disabled.
 *
 * <p>
 * A rollback may be handed off to another thread and abandoned after a timeout (see
 * {@link #closeAfter(CompletableFuture)}). In that case the connection is returned to the pool
 * only once the abandoned rollback finishes, so the connection may still be busy after the
 * caller has moved on.
 * </p>
 */
@Slf4j
public class TransactionalSqlExecutor extends AbstractSqlExecutor implements AutoCloseable {

    private final Connection connection;

    private CompletableFuture<?> pendingRollback;

    private boolean closed;

    TransactionalSqlExecutor(Connection connection, ExecutorSettings settings) {
        super(settings);
        this.connection = connection;
    }

    /**
     * Borrows a connection and starts a transaction on it.
     *
     * @param dataSource connection pool
     * @param settings statement settings
     * @return executor owning the connection
     * @throws SQLException if the connection cannot be obtained or auto-commit cannot be disabled
     */
    public static TransactionalSqlExecutor begin(DataSource dataSource, ExecutorSettings settings)
            throws SQLException {
        Connection connection = dataSource.getConnection();
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            try {
                connection.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
        return new TransactionalSqlExecutor(connection, settings);
    }

    /**
     * Returns the connection owning the transaction, for dialect operations that need the raw
     * driver API (e.g. bulk copy).
     *
     * @return transaction connection
     */
    public Connection getConnection() {
        return connection;
    }

    public void commit() throws SQLException {
        connection.commit();
    }

    public void rollback() throws SQLException {
        connection.rollback();
    }

    /**
     * Defers closing the connection until the given rollback completes.
     *
     * @param rollback rollback that may still be running
     */
    public synchronized void closeAfter(CompletableFuture<?> rollback) {
        this.pendingRollback = rollback;
    }

    @Override
    protected <T> T withConnection(ConnectionCallback<T> callback) throws SQLException {
        return callback.doInConnection(connection);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pendingRollback != null && !pendingRollback.isDone()) {
            log.warn("Rollback still running; connection will be released once it finishes");
            pendingRollback.whenComplete((ignored, error) -> closeConnection());
            return;
        }
        closeConnection();
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to release transaction connection: {}", e.getMessage(), e);
        }
    }
}
