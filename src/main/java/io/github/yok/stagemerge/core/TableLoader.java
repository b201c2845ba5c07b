package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.config.DedupKeyConfig;
import io.github.yok.stagemerge.config.PostgresLoadProperties;
import io.github.yok.stagemerge.config.WarehouseProperties;
import io.github.yok.stagemerge.db.PooledSqlExecutor;
import io.github.yok.stagemerge.db.WarehouseDialect;
import io.github.yok.stagemerge.source.UploadSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * Loads one table of an upload: stage, merge, commit, clean up.
 *
 * <p>
 * Processing flow:
 * </p>
 * <ol>
 * <li>Select the working namespace.</li>
 * <li>Materialize the load files locally. They are deleted when the load ends, whatever the
 * outcome.</li>
 * <li>Open the load transaction, create the staging table and copy the files into it.</li>
 * <li>Merge the staging table into the destination table and commit.</li>
 * <li>Drop the staging table, unless the caller keeps it for a follow-up step.</li>
 * </ol>
 *
 * <p>
 * Failures before the transaction is opened are reported without a stage.
 * </p>
 */
@Slf4j
public class TableLoader {

    private final PooledSqlExecutor pool;

    private final WarehouseDialect dialect;

    private final RollbackSupervisor rollbackSupervisor;

    private final WarehouseProperties warehouse;

    private final PostgresLoadProperties properties;

    private final DedupKeyConfig dedupKeys;

    private final StagingTables stagingTables;

    private final StagingTableLoader stagingTableLoader;

    private final DedupMerger dedupMerger;

    /**
     * Creates a loader.
     *
     * @param pool non-transactional executor, also the source of transactions
     * @param dialect warehouse dialect
     * @param rollbackSupervisor supervisor for rollbacks
     * @param warehouse destination identity
     * @param properties engine tunables
     * @param dedupKeys dedup keys per table
     * @param stagingTables staging table naming and disposal
     */
    public TableLoader(PooledSqlExecutor pool, WarehouseDialect dialect,
            RollbackSupervisor rollbackSupervisor, WarehouseProperties warehouse,
            PostgresLoadProperties properties, DedupKeyConfig dedupKeys,
            StagingTables stagingTables) {
        this.pool = pool;
        this.dialect = dialect;
        this.rollbackSupervisor = rollbackSupervisor;
        this.warehouse = warehouse;
        this.properties = properties;
        this.dedupKeys = dedupKeys;
        this.stagingTables = stagingTables;
        this.stagingTableLoader = new StagingTableLoader(dialect, warehouse.getNamespace());
        this.dedupMerger =
                new DedupMerger(dialect, warehouse.getNamespace(), properties.getRecencyColumn());
    }

    /**
     * Loads a table and drops its staging table afterwards.
     *
     * @param upload upload source
     * @param table destination table
     * @throws LoadTableException if the load fails; the destination table is unchanged
     */
    public void loadTable(UploadSource upload, String table) throws LoadTableException {
        loadTable(upload, table, upload.getTableSchemaInUpload(table),
                stagingTables.newName(table), false);
    }

    /**
     * Loads a table into the destination using the given staging table name.
     *
     * @param upload upload source providing the load files
     * @param table destination table
     * @param uploadSchema schema of the load files; its sorted column names give the file layout
     * @param stagingTable staging table name to create
     * @param keepStagingTable {@code true} to leave the staging table for the caller to drop
     * @throws LoadTableException if the load fails; the destination table is unchanged
     */
    public void loadTable(UploadSource upload, String table, TableSchema uploadSchema,
            String stagingTable, boolean keepStagingTable) throws LoadTableException {
        String namespace = warehouse.getNamespace();
        String searchPath = "SET search_path TO " + dialect.quoteIdentifier(namespace);
        try {
            pool.execute(searchPath);
        } catch (SQLException e) {
            throw new LoadTableException(table, null, e);
        }
        log.info("[{}] Table[{}] Starting load", namespace, table);

        List<String> columns = uploadSchema.sortedColumnNames();
        List<Path> files = null;
        try {
            try {
                files = upload.downloadLoadFiles(table);
            } catch (IOException e) {
                log.error("[{}] Table[{}] Error materializing load files: {}", namespace, table,
                        e.getMessage());
                throw new LoadTableException(table, null, e);
            }
            runTransaction(table, stagingTable, columns, files, keepStagingTable);
        } finally {
            deleteLoadFiles(table, files);
        }
    }

    private void runTransaction(String table, String stagingTable, List<String> columns,
            List<Path> files, boolean keepStagingTable) throws LoadTableException {
        LoadTags tags = LoadTags.builder().workspaceId(warehouse.getWorkspaceId())
                .namespace(warehouse.getNamespace()).destinationId(warehouse.getDestinationId())
                .tableName(table).build();
        try (LoadTransaction txn = LoadTransaction.open(pool, rollbackSupervisor,
                properties.getTxnRollbackTimeout(), properties.getStatementTimeout(), tags)) {
            stagingTableLoader.createStagingTable(txn, table, stagingTable);
            try {
                stagingTableLoader.copyLoadFiles(txn, stagingTable, columns, files);
                dedupMerger.merge(txn, table, stagingTable, columns, dedupKeys.resolve(table),
                        properties.isExecutionPlanEnabledFor(warehouse.getWorkspaceId()));
            } finally {
                if (!keepStagingTable) {
                    stagingTables.drop(stagingTable);
                }
            }
        }
    }

    private void deleteLoadFiles(String table, List<Path> files) {
        if (files == null) {
            return;
        }
        for (Path file : files) {
            if (!FileUtils.deleteQuietly(file.toFile()) && Files.exists(file)) {
                log.warn("[{}] Table[{}] Could not delete load file {}", warehouse.getNamespace(),
                        table, file);
            }
        }
    }
}
