package io.github.yok.stagemerge.config;

import io.github.yok.stagemerge.db.ExecutorSettings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables of the PostgreSQL load engine, bound from {@code warehouse.postgres.*}.
 *
 * <p>
 * Two switches exist both globally and per workspace: skipping the latest-traits computation for
 * users, and logging the execution plan of merge statements. A switch is on for a workspace when
 * the global flag is set or the workspace is listed.
 * </p>
 */
@Component
@ConfigurationProperties(prefix = "warehouse.postgres")
@Data
public class PostgresLoadProperties {

    // Load users directly instead of computing latest traits from identifies
    private boolean skipComputingUserLatestTraits = false;

    // Workspaces for which the latest-traits computation is skipped
    private List<String> skipComputingUserLatestTraitsWorkspaceIds = new ArrayList<>();

    // How long the caller waits for a rollback before abandoning it
    private Duration txnRollbackTimeout = Duration.ofSeconds(30);

    // Log EXPLAIN output before every merge statement
    private boolean enableSqlStatementExecutionPlan = false;

    // Workspaces for which EXPLAIN output is logged
    private List<String> enableSqlStatementExecutionPlanWorkspaceIds = new ArrayList<>();

    // Gate for the retention delete
    private boolean enableDeleteByJobs = false;

    // Statements slower than this are logged at WARN
    private Duration slowQueryThreshold = Duration.ofMinutes(5);

    // JDBC query timeout per statement; zero disables it
    private Duration statementTimeout = Duration.ZERO;

    // Column ordering row versions, most recent first
    private String recencyColumn = "received_at";

    // Maximum staging table identifier length
    private int tableNameLimit = 63;

    /**
     * Returns whether users are loaded without computing latest traits for a workspace.
     *
     * @param workspaceId workspace
     * @return {@code true} when skipped globally or for the workspace
     */
    public boolean isSkipComputingUserLatestTraitsFor(String workspaceId) {
        return skipComputingUserLatestTraits
                || skipComputingUserLatestTraitsWorkspaceIds.contains(workspaceId);
    }

    /**
     * Returns whether merge statements log their execution plan for a workspace.
     *
     * @param workspaceId workspace
     * @return {@code true} when enabled globally or for the workspace
     */
    public boolean isExecutionPlanEnabledFor(String workspaceId) {
        return enableSqlStatementExecutionPlan
                || enableSqlStatementExecutionPlanWorkspaceIds.contains(workspaceId);
    }

    /**
     * Builds the per-statement executor settings.
     *
     * @return executor settings
     */
    public ExecutorSettings toExecutorSettings() {
        return new ExecutorSettings(slowQueryThreshold, statementTimeout);
    }
}
