package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.db.PooledSqlExecutor;
import io.github.yok.stagemerge.db.SqlExecutor;
import io.github.yok.stagemerge.db.TransactionalSqlExecutor;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * The single transaction of one load attempt.
 *
 * <p>
 * Any failure inside the transaction goes through {@link #abort(LoadStage, Exception)}, which
 * rolls back under the {@link RollbackSupervisor} and produces the {@link LoadTableException} to
 * throw. Closing the transaction releases its connection, deferred until an abandoned rollback
 * completes.
 * </p>
 */
@Slf4j
class LoadTransaction implements AutoCloseable {

    private final TransactionalSqlExecutor executor;

    private final RollbackSupervisor rollbackSupervisor;

    private final Duration rollbackTimeout;

    private final LoadTags tags;

    private boolean finished;

    private LoadTransaction(TransactionalSqlExecutor executor,
            RollbackSupervisor rollbackSupervisor, Duration rollbackTimeout, LoadTags tags) {
        this.executor = executor;
        this.rollbackSupervisor = rollbackSupervisor;
        this.rollbackTimeout = rollbackTimeout;
        this.tags = tags;
    }

    /**
     * Opens a transaction on a fresh pooled connection.
     *
     * <p>
     * A positive {@code statementTimeout} is also set as the server-side
     * {@code statement_timeout} of the transaction, so that it bounds the bulk copy as well as
     * the JDBC statements.
     * </p>
     *
     * @param pool connection pool
     * @param rollbackSupervisor supervisor for rollbacks
     * @param rollbackTimeout rollback wait bound
     * @param statementTimeout per-statement deadline, zero for none
     * @param tags load tags
     * @return open transaction
     * @throws LoadTableException without a stage if no transaction can be started
     */
    static LoadTransaction open(PooledSqlExecutor pool, RollbackSupervisor rollbackSupervisor,
            Duration rollbackTimeout, Duration statementTimeout, LoadTags tags)
            throws LoadTableException {
        TransactionalSqlExecutor executor;
        try {
            executor = pool.beginTransaction();
        } catch (SQLException e) {
            log.error("[{}] Table[{}] Error beginning transaction: {}", tags.getNamespace(),
                    tags.getTableName(), e.getMessage());
            throw new LoadTableException(tags.getTableName(), null, e);
        }
        if (!statementTimeout.isZero() && !statementTimeout.isNegative()) {
            try {
                executor.execute("SET LOCAL statement_timeout = " + statementTimeout.toMillis());
            } catch (SQLException e) {
                log.error("[{}] Table[{}] Error setting statement timeout: {}",
                        tags.getNamespace(), tags.getTableName(), e.getMessage());
                executor.close();
                throw new LoadTableException(tags.getTableName(), null, e);
            }
        }
        return new LoadTransaction(executor, rollbackSupervisor, rollbackTimeout, tags);
    }

    SqlExecutor sql() {
        return executor;
    }

    Connection getConnection() {
        return executor.getConnection();
    }

    String getTableName() {
        return tags.getTableName();
    }

    /**
     * Commits; a commit failure is aborted at {@code stage}.
     *
     * @param stage stage reported if the commit fails
     * @throws LoadTableException if the commit fails
     */
    void commit(LoadStage stage) throws LoadTableException {
        try {
            executor.commit();
            finished = true;
        } catch (SQLException e) {
            throw abort(stage, e);
        }
    }

    /**
     * Rolls back with a bounded wait and builds the failure to report.
     *
     * @param stage failing stage
     * @param cause failure
     * @return exception for the caller to throw
     */
    LoadTableException abort(LoadStage stage, Exception cause) {
        log.error("[{}] Table[{}] Load failed at stage {}: {}", tags.getNamespace(),
                tags.getTableName(), stage.getTag(), cause.getMessage());
        if (!finished) {
            finished = true;
            CompletableFuture<Void> rollback = rollbackSupervisor
                    .runWithTimeout(executor::rollback, rollbackTimeout, tags.withStage(stage));
            executor.closeAfter(rollback);
        }
        return new LoadTableException(tags.getTableName(), stage, cause);
    }

    @Override
    public void close() {
        executor.close();
    }
}
