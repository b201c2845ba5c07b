package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.db.SqlExecutor;
import io.github.yok.stagemerge.db.WarehouseDialect;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Deletes rows written by earlier job runs of a source.
 *
 * <p>
 * Statements are only executed when the delete is enabled; otherwise they are logged and skipped.
 * A request without a source id applies to the source configured as {@code warehouse.source-id}.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class RetentionDeleter {

    private final SqlExecutor executor;

    private final WarehouseDialect dialect;

    private final String namespace;

    private final String defaultSourceId;

    private final String recencyColumn;

    private final boolean enabled;

    /**
     * Runs the delete for each table, stopping at the first failure.
     *
     * @param tables tables to clean
     * @param params row selection
     * @throws SQLException on the first failing table
     * @throws IllegalArgumentException if no source id is given or configured
     */
    public void deleteBy(List<String> tables, DeleteByParams params) throws SQLException {
        String sourceId = StringUtils.defaultIfBlank(params.getSourceId(), defaultSourceId);
        if (enabled && StringUtils.isBlank(sourceId)) {
            throw new IllegalArgumentException("No source id given and warehouse.source-id is "
                    + "not configured");
        }
        log.info("[{}] Cleaning up tables {} with {} (source {})", namespace, tables, params,
                sourceId);
        for (String table : tables) {
            String sql = buildDeleteSql(table);
            log.debug("[{}] Executing the statement {}", namespace, sql);
            if (!enabled) {
                continue;
            }
            int deleted = executor.update(sql, params.getJobRunId(), params.getTaskRunId(),
                    sourceId, Timestamp.from(params.getStartTime()));
            log.info("[{}] Table[{}] Deleted {} rows", namespace, table, deleted);
        }
    }

    String buildDeleteSql(String table) {
        return "DELETE FROM " + dialect.qualify(namespace, table)
                + " WHERE context_sources_job_run_id <> ? AND context_sources_task_run_id <> ?"
                + " AND context_source_id = ? AND " + dialect.quoteIdentifier(recencyColumn)
                + " < ?";
    }
}
