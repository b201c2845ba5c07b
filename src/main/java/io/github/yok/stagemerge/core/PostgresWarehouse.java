package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.config.DedupKeyConfig;
import io.github.yok.stagemerge.config.PostgresLoadProperties;
import io.github.yok.stagemerge.config.WarehouseProperties;
import io.github.yok.stagemerge.db.PooledSqlExecutor;
import io.github.yok.stagemerge.db.WarehouseDialect;
import io.github.yok.stagemerge.error.JobError;
import io.github.yok.stagemerge.source.UploadSource;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the load engine for one destination namespace.
 *
 * <p>
 * Wires the components around a single connection pool:
 * </p>
 * <ul>
 * <li>{@link TableLoader}: stage, dedup-merge and commit one table</li>
 * <li>{@link IdentityResolutionMerger}: {@code identifies} followed by {@code users}</li>
 * <li>{@link StagingTableSweeper}: crash recovery</li>
 * <li>{@link SchemaManager}: additive DDL and schema fetch</li>
 * <li>{@link RetentionDeleter}: delete of rows from earlier job runs</li>
 * </ul>
 */
@Slf4j
public class PostgresWarehouse {

    private final PooledSqlExecutor pool;

    private final WarehouseDialect dialect;

    private final WarehouseProperties warehouse;

    private final TableLoader tableLoader;

    private final IdentityResolutionMerger identityResolutionMerger;

    private final StagingTableSweeper sweeper;

    private final SchemaManager schemaManager;

    private final RetentionDeleter retentionDeleter;

    /**
     * Creates the facade.
     *
     * @param dataSource connection pool of the destination
     * @param dialect warehouse dialect
     * @param rollbackSupervisor supervisor for rollbacks
     * @param warehouse destination identity
     * @param properties engine tunables
     * @param dedupKeys dedup keys per table
     * @param meterRegistry metrics registry
     */
    public PostgresWarehouse(DataSource dataSource, WarehouseDialect dialect,
            RollbackSupervisor rollbackSupervisor, WarehouseProperties warehouse,
            PostgresLoadProperties properties, DedupKeyConfig dedupKeys,
            MeterRegistry meterRegistry) {
        this.pool = new PooledSqlExecutor(dataSource, properties.toExecutorSettings());
        this.dialect = dialect;
        this.warehouse = warehouse;
        StagingTables stagingTables = new StagingTables(pool, dialect, warehouse.getNamespace(),
                properties.getTableNameLimit());
        this.tableLoader = new TableLoader(pool, dialect, rollbackSupervisor, warehouse,
                properties, dedupKeys, stagingTables);
        this.identityResolutionMerger = new IdentityResolutionMerger(pool, dialect,
                rollbackSupervisor, warehouse, properties, stagingTables, tableLoader);
        this.sweeper = new StagingTableSweeper(pool, stagingTables);
        this.schemaManager = new SchemaManager(pool, dialect, stagingTables, meterRegistry);
        this.retentionDeleter = new RetentionDeleter(pool, dialect, warehouse.getNamespace(),
                warehouse.getSourceId(), properties.getRecencyColumn(),
                properties.isEnableDeleteByJobs());
    }

    /**
     * Loads one table with the upload schema of {@code upload}.
     *
     * @param upload upload source
     * @param table destination table
     * @throws LoadTableException if the load fails
     */
    public void loadTable(UploadSource upload, String table) throws LoadTableException {
        tableLoader.loadTable(upload, table);
    }

    /**
     * Loads {@code identifies} and {@code users}.
     *
     * @param upload upload source
     * @return per-table outcome
     */
    public UserTablesLoadResult loadUserTables(UploadSource upload) {
        return identityResolutionMerger.loadUserTables(upload);
    }

    /**
     * Drops staging tables left by a crashed run. Call before any load starts.
     *
     * @return {@code true} if every dangling table was dropped
     */
    public boolean crashRecover() {
        return sweeper.dropDanglingStagingTables();
    }

    /**
     * Drops remaining staging tables at the end of a run.
     */
    public void cleanup() {
        if (!sweeper.dropDanglingStagingTables()) {
            log.warn("[{}] Some staging tables could not be dropped during cleanup",
                    warehouse.getNamespace());
        }
    }

    public void deleteBy(List<String> tables, DeleteByParams params) throws SQLException {
        retentionDeleter.deleteBy(tables, params);
    }

    public void createSchema() throws SQLException {
        schemaManager.createSchema();
    }

    public void createTable(String table, TableSchema schema) throws SQLException {
        schemaManager.createTable(table, schema);
    }

    public void addColumns(String table, TableSchema columns) throws SQLException {
        schemaManager.addColumns(table, columns);
    }

    public void dropTable(String table) throws SQLException {
        schemaManager.dropTable(table);
    }

    public FetchedSchema fetchSchema() throws SQLException {
        return schemaManager.fetchSchema();
    }

    public long getTotalCountInTable(String table) throws SQLException {
        return schemaManager.getTotalCountInTable(table);
    }

    /**
     * Verifies that a valid connection can be obtained.
     *
     * @throws SQLException if no connection can be obtained or it is not valid
     */
    public void testConnection() throws SQLException {
        try (Connection connection = pool.getDataSource().getConnection()) {
            if (!connection.isValid(5)) {
                throw new SQLException("Connection to " + warehouse.getNamespace()
                        + " is not valid");
            }
        }
    }

    /**
     * Returns the failure patterns of the dialect, in evaluation order.
     *
     * @return ordered mapping table
     */
    public List<JobError> errorMappings() {
        return dialect.getErrorMappings();
    }
}
