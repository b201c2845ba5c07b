package io.github.yok.stagemerge.parser;

import java.io.IOException;
import lombok.Getter;

/**
 * Thrown when a load-file row does not have as many fields as the upload schema has columns.
 */
@Getter
public class ColumnCountMismatchException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String tableName;

    private final int foundColumns;

    private final int expectedColumns;

    // Rows successfully decoded from the same file before the offending one
    private final long rowsProcessed;

    /**
     * Creates an exception.
     *
     * @param tableName table being loaded
     * @param foundColumns fields in the offending row
     * @param expectedColumns columns in the upload schema
     * @param rowsProcessed rows decoded from the file before the mismatch
     */
    public ColumnCountMismatchException(String tableName, int foundColumns, int expectedColumns,
            long rowsProcessed) {
        super("load file CSV columns for a row mismatch number found in upload schema. "
                + "Columns in CSV row: " + foundColumns + ", Columns in upload schema of table-"
                + tableName + ": " + expectedColumns
                + ". Processed rows in csv file until mismatch: " + rowsProcessed);
        this.tableName = tableName;
        this.foundColumns = foundColumns;
        this.expectedColumns = expectedColumns;
        this.rowsProcessed = rowsProcessed;
    }
}
