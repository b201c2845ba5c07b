package io.github.yok.stagemerge.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Races a transaction rollback against a timeout.
 *
 * <p>
 * The rollback runs on its own thread. The caller waits until the rollback finishes or the
 * timeout elapses, whichever comes first. On timeout the rollback is left running (it is never
 * joined or cancelled), a {@value #ROLLBACK_TIMEOUT_METRIC} counter is incremented with the load
 * tags, and the caller proceeds. Rollback failures are logged and never propagated.
 * </p>
 */
@Slf4j
public class RollbackSupervisor implements AutoCloseable {

    public static final String ROLLBACK_TIMEOUT_METRIC = "pg_rollback_timeout";

    /**
     * A rollback to supervise.
     */
    @FunctionalInterface
    public interface RollbackAction {
        void rollback() throws Exception;
    }

    private final MeterRegistry meterRegistry;

    private final ExecutorService executor;

    /**
     * Creates a supervisor running rollbacks on daemon threads.
     *
     * @param meterRegistry registry receiving the timeout counter
     */
    public RollbackSupervisor(MeterRegistry meterRegistry) {
        this(meterRegistry, Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("pg-rollback-%d").setDaemon(true).build()));
    }

    RollbackSupervisor(MeterRegistry meterRegistry, ExecutorService executor) {
        this.meterRegistry = meterRegistry;
        this.executor = executor;
    }

    /**
     * Starts the rollback and waits for it at most {@code timeout}.
     *
     * @param action rollback to run
     * @param timeout maximum wait
     * @param tags telemetry tags, including the failing stage
     * @return future completing when the rollback itself finishes, even after a timeout
     */
    public CompletableFuture<Void> runWithTimeout(RollbackAction action, Duration timeout,
            LoadTags tags) {
        CompletableFuture<Void> rollback = CompletableFuture.runAsync(() -> {
            try {
                action.rollback();
            } catch (Exception e) {
                log.error("[{}] Table[{}] Error in rolling back transaction: {}",
                        tags.getNamespace(), tags.getTableName(), e.getMessage(), e);
            }
        }, executor);

        try {
            rollback.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("[{}] Table[{}] Timed out rolling back transaction after {}",
                    tags.getNamespace(), tags.getTableName(), timeout);
            meterRegistry.counter(ROLLBACK_TIMEOUT_METRIC, tags.toMicrometerTags()).increment();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Table[{}] Interrupted while waiting for rollback",
                    tags.getNamespace(), tags.getTableName());
        } catch (ExecutionException e) {
            log.error("[{}] Table[{}] Rollback task failed: {}", tags.getNamespace(),
                    tags.getTableName(), e.getCause().getMessage(), e.getCause());
        }
        return rollback;
    }

    /**
     * Stops accepting rollbacks. Rollbacks still running are not interrupted.
     */
    @Override
    public void close() {
        executor.shutdown();
    }
}
