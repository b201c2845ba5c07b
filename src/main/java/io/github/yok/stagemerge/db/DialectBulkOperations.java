package io.github.yok.stagemerge.db;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Native bulk ingest for each warehouse dialect.
 */
public interface DialectBulkOperations {

    /**
     * Opens a bulk-copy channel into {@code namespace.table} on the given connection.
     *
     * @param connection connection owning the load transaction
     * @param namespace schema
     * @param table target table
     * @param columns column order of the rows that will be written
     * @return open channel
     * @throws SQLException if the copy cannot be started
     */
    BulkCopyChannel openBulkCopy(Connection connection, String namespace, String table,
            List<String> columns) throws SQLException;
}
