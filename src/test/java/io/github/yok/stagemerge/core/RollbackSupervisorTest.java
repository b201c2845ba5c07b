package io.github.yok.stagemerge.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.google.common.base.Stopwatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RollbackSupervisorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private final RollbackSupervisor supervisor = new RollbackSupervisor(registry);

    private final LoadTags tags = LoadTags.builder().workspaceId("ws").namespace("ns")
            .destinationId("dest").tableName("tracks").stage(LoadStage.DELETE_DEDUP).build();

    @AfterEach
    void tearDown() {
        supervisor.close();
    }

    @Test
    void runWithTimeout_正常ケース_即時に完了するロールバックを指定する_完了後に戻りカウンタが増えないこと()
            throws Exception {
        AtomicBoolean called = new AtomicBoolean();

        CompletableFuture<Void> result =
                supervisor.runWithTimeout(() -> called.set(true), Duration.ofSeconds(5), tags);

        assertTrue(called.get());
        assertTrue(result.isDone());
        assertNull(registry.find(RollbackSupervisor.ROLLBACK_TIMEOUT_METRIC).counter());
    }

    @Test
    void runWithTimeout_正常ケース_失敗するロールバックを指定する_例外が伝播しないこと() {
        CompletableFuture<Void> result = supervisor.runWithTimeout(() -> {
            throw new SQLException("connection reset");
        }, Duration.ofSeconds(5), tags);

        // 失敗はログ出力のみで、呼び出し元には伝播しない
        assertTrue(result.isDone());
        assertFalse(result.isCompletedExceptionally());
    }

    @Test
    void runWithTimeout_異常ケース_ハングするロールバックを指定する_タイムアウト後に戻りカウンタが増えること()
            throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        Stopwatch stopwatch = Stopwatch.createStarted();

        CompletableFuture<Void> result = supervisor.runWithTimeout(
                () -> release.await(30, TimeUnit.SECONDS), Duration.ofMillis(200), tags);

        // タイムアウト値付近で制御が戻ること
        assertTrue(stopwatch.elapsed().compareTo(Duration.ofSeconds(5)) < 0);
        assertFalse(result.isDone());
        Counter counter = registry.find(RollbackSupervisor.ROLLBACK_TIMEOUT_METRIC)
                .tag("tableName", "tracks").tag("stage", "dedup_deletion").counter();
        assertEquals(1.0, counter.count());

        // 放棄したロールバックは裏で完了できること
        release.countDown();
        result.get(5, TimeUnit.SECONDS);
        assertTrue(result.isDone());
    }
}
