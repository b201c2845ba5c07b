package io.github.yok.stagemerge.db;

import java.sql.SQLException;
import java.util.List;

/**
 * Streaming ingest path into one table, distinct from row-by-row {@code INSERT}.
 *
 * <p>
 * Rows are written in the column order the channel was opened with. A {@code null} element is
 * stored as SQL {@code NULL}. Closing a channel that was not finished cancels the copy.
 * </p>
 */
public interface BulkCopyChannel extends AutoCloseable {

    /**
     * Sends one row.
     *
     * @param values column values in channel order; {@code null} means SQL {@code NULL}
     * @throws SQLException if the row cannot be sent
     */
    void writeRow(List<String> values) throws SQLException;

    /**
     * Completes the copy.
     *
     * @return number of rows the database reports as copied
     * @throws SQLException if the database rejects the copied data
     */
    long finish() throws SQLException;

    /**
     * Returns the number of rows sent so far.
     *
     * @return row count
     */
    long getRowsWritten();

    @Override
    void close() throws SQLException;
}
