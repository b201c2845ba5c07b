package io.github.yok.stagemerge.db;

import io.github.yok.stagemerge.error.JobError;
import java.util.List;

/**
 * Aggregate interface for warehouse-dialect behavior.
 *
 * <p>
 * Composes naming rules, type mapping and bulk ingest, and exposes the dialect's ordered
 * failure-pattern table for {@link io.github.yok.stagemerge.error.ErrorClassifier}.
 * </p>
 */
public interface WarehouseDialect
        extends DialectSqlOperations, DialectTypeOperations, DialectBulkOperations {

    /**
     * Returns the dialect's failure patterns in evaluation order.
     *
     * @return ordered mapping table
     */
    List<JobError> getErrorMappings();
}
