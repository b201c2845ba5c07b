package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.db.BulkCopyChannel;
import io.github.yok.stagemerge.db.WarehouseDialect;
import io.github.yok.stagemerge.parser.ColumnCountMismatchException;
import io.github.yok.stagemerge.parser.LoadFileRowReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.zip.GZIPInputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates a staging table shaped like the destination table and streams load files into it.
 *
 * <p>
 * Both steps run inside the load transaction. Files are processed one at a time, rows in file
 * order, through a single bulk-copy stream. The first failure aborts the transaction with the
 * stage at which it happened; the copy is cancelled before the rollback starts.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
class StagingTableLoader {

    private final WarehouseDialect dialect;

    private final String namespace;

    /**
     * Creates {@code stagingTable} with the structure of {@code table}.
     *
     * @param txn load transaction
     * @param table destination table
     * @param stagingTable staging table to create
     * @throws LoadTableException at stage {@link LoadStage#CREATE_STAGING_TABLE}
     */
    void createStagingTable(LoadTransaction txn, String table, String stagingTable)
            throws LoadTableException {
        String sql = "CREATE TABLE " + dialect.qualify(namespace, stagingTable) + " (LIKE "
                + dialect.qualify(namespace, table) + ")";
        log.debug("[{}] Table[{}] Creating staging table: {}", namespace, table, sql);
        try {
            txn.sql().execute(sql);
        } catch (SQLException e) {
            throw txn.abort(LoadStage.CREATE_STAGING_TABLE, e);
        }
    }

    /**
     * Copies all rows of all files into the staging table.
     *
     * @param txn load transaction
     * @param stagingTable staging table
     * @param columns column order of the files
     * @param files gzip CSV load files
     * @return rows copied
     * @throws LoadTableException at the stage of the first failure
     */
    long copyLoadFiles(LoadTransaction txn, String stagingTable, List<String> columns,
            List<Path> files) throws LoadTableException {
        try {
            long copied = copyAll(txn, stagingTable, columns, files);
            log.info("[{}] Table[{}] Copied {} rows from {} load files into {}", namespace,
                    txn.getTableName(), copied, files.size(), stagingTable);
            return copied;
        } catch (StageFailure failure) {
            throw txn.abort(failure.stage, failure.getCause());
        }
    }

    private long copyAll(LoadTransaction txn, String stagingTable, List<String> columns,
            List<Path> files) throws StageFailure {
        try (BulkCopyChannel channel = openChannel(txn, stagingTable, columns)) {
            for (Path file : files) {
                copyFile(channel, file, txn.getTableName(), columns.size());
            }
            try {
                return channel.finish();
            } catch (SQLException e) {
                throw new StageFailure(LoadStage.STAGING_TABLE_LOAD_STAGE, e);
            }
        } catch (SQLException e) {
            // cancelling the copy failed
            throw new StageFailure(LoadStage.LOAD_STAGING_TABLE, e);
        }
    }

    private BulkCopyChannel openChannel(LoadTransaction txn, String stagingTable,
            List<String> columns) throws StageFailure {
        try {
            return dialect.openBulkCopy(txn.getConnection(), namespace, stagingTable, columns);
        } catch (SQLException e) {
            throw new StageFailure(LoadStage.COPY_IN_SCHEMA_STAGING_TABLE, e);
        }
    }

    private void copyFile(BulkCopyChannel channel, Path file, String table, int columnCount)
            throws StageFailure {
        InputStream raw;
        try {
            raw = Files.newInputStream(file);
        } catch (IOException e) {
            log.error("[{}] Table[{}] Error opening load file {}", namespace, table, file);
            throw new StageFailure(LoadStage.OPEN_LOAD_FILES, e);
        }
        try (InputStream in = raw) {
            GZIPInputStream gzip;
            try {
                gzip = new GZIPInputStream(in);
            } catch (IOException e) {
                log.error("[{}] Table[{}] Error reading gzip load file {}", namespace, table, file);
                throw new StageFailure(LoadStage.READ_GZIP_LOAD_FILES, e);
            }
            try (LoadFileRowReader reader =
                    new LoadFileRowReader(new InputStreamReader(gzip, StandardCharsets.UTF_8),
                            String.valueOf(file.getFileName()), table, columnCount)) {
                List<String> row;
                while ((row = nextRow(reader)) != null) {
                    try {
                        channel.writeRow(row);
                    } catch (SQLException e) {
                        throw new StageFailure(LoadStage.LOAD_STAGING_TABLE, e);
                    }
                }
            }
        } catch (IOException e) {
            throw new StageFailure(LoadStage.READ_CSV_LOAD_FILES, e);
        }
    }

    private static List<String> nextRow(LoadFileRowReader reader) throws StageFailure {
        try {
            return reader.readRow();
        } catch (ColumnCountMismatchException e) {
            throw new StageFailure(LoadStage.CSV_COLUMN_COUNT_MISMATCH, e);
        } catch (IOException e) {
            throw new StageFailure(LoadStage.READ_CSV_LOAD_FILES, e);
        }
    }

    /**
     * Carries the failing stage out of the copy loop.
     */
    private static final class StageFailure extends Exception {

        private static final long serialVersionUID = 1L;

        private final LoadStage stage;

        StageFailure(LoadStage stage, Exception cause) {
            super(cause);
            this.stage = stage;
        }

        @Override
        public synchronized Exception getCause() {
            return (Exception) super.getCause();
        }
    }
}
