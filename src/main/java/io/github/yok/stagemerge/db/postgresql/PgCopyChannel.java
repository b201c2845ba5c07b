package io.github.yok.stagemerge.db.postgresql;

import io.github.yok.stagemerge.db.BulkCopyChannel;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.postgresql.copy.CopyIn;

/**
 * {@link BulkCopyChannel} over a pgjdbc {@link CopyIn} operation in CSV format.
 *
 * <p>
 * Values are rendered with {@link CSVFormat#POSTGRESQL_CSV}: non-null values are quoted and
 * {@code null} becomes an unquoted empty field, which {@code COPY} reads as SQL {@code NULL}.
 * </p>
 */
@Slf4j
class PgCopyChannel implements BulkCopyChannel {

    private static final CSVFormat FORMAT = CSVFormat.POSTGRESQL_CSV;

    private final CopyIn copyIn;

    private final int columnCount;

    private long rowsWritten;

    PgCopyChannel(CopyIn copyIn, int columnCount) {
        this.copyIn = copyIn;
        this.columnCount = columnCount;
    }

    @Override
    public void writeRow(List<String> values) throws SQLException {
        if (values.size() != columnCount) {
            throw new SQLException("Row has " + values.size() + " values but the copy expects "
                    + columnCount + " columns");
        }
        byte[] line = (FORMAT.format(values.toArray()) + "\n").getBytes(StandardCharsets.UTF_8);
        copyIn.writeToCopy(line, 0, line.length);
        rowsWritten++;
    }

    @Override
    public long finish() throws SQLException {
        long copied = copyIn.endCopy();
        log.debug("Bulk copy finished: {} rows sent, {} rows copied", rowsWritten, copied);
        return copied;
    }

    @Override
    public long getRowsWritten() {
        return rowsWritten;
    }

    @Override
    public void close() throws SQLException {
        if (copyIn.isActive()) {
            log.debug("Cancelling unfinished bulk copy after {} rows", rowsWritten);
            copyIn.cancelCopy();
        }
    }
}
