package io.github.yok.stagemerge.db;

import java.time.Duration;
import lombok.NonNull;
import lombok.Value;

/**
 * Per-statement settings shared by both {@link SqlExecutor} variants.
 */
@Value
public class ExecutorSettings {

    public static final ExecutorSettings DEFAULT =
            new ExecutorSettings(Duration.ofMinutes(5), Duration.ZERO);

    // Statements running longer than this are logged at WARN
    @NonNull
    Duration slowQueryThreshold;

    // JDBC query timeout applied to every statement; zero disables it
    @NonNull
    Duration statementTimeout;
}
