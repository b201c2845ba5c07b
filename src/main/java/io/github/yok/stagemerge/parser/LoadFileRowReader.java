package io.github.yok.stagemerge.parser;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Decodes one header-less CSV load file into rows.
 *
 * <p>
 * Every row must have exactly {@code expectedColumns} fields, in the sorted column order of the
 * upload schema. A field that is empty or holds only Unicode white space is returned as
 * {@code null} so that it is stored as SQL {@code NULL}; any other field is returned verbatim.
 * </p>
 *
 * <p>
 * The reader does not decompress. Callers pass the already gunzipped character stream, so that
 * open, gzip and CSV failures can be told apart.
 * </p>
 */
@Slf4j
public class LoadFileRowReader implements Closeable {

    private final CSVParser parser;

    private final Iterator<CSVRecord> records;

    private final String fileName;

    private final String tableName;

    private final int expectedColumns;

    private long rowsProcessed;

    /**
     * Creates a reader.
     *
     * @param reader decompressed file content
     * @param fileName file name, for logging
     * @param tableName table being loaded, for error reporting
     * @param expectedColumns number of columns in the upload schema
     * @throws IOException if the CSV parser cannot be created
     */
    public LoadFileRowReader(Reader reader, String fileName, String tableName,
            int expectedColumns) throws IOException {
        this.parser = CSVFormat.DEFAULT.parse(reader);
        this.records = parser.iterator();
        this.fileName = fileName;
        this.tableName = tableName;
        this.expectedColumns = expectedColumns;
    }

    /**
     * Reads the next row.
     *
     * @return field values with blanks mapped to {@code null}, or {@code null} at end of file
     * @throws ColumnCountMismatchException if the row has the wrong number of fields
     * @throws IOException if the content is not valid CSV or cannot be read
     */
    public List<String> readRow() throws IOException {
        CSVRecord record;
        try {
            if (!records.hasNext()) {
                log.debug("Finished reading load file {} for table {}: {} rows", fileName,
                        tableName, rowsProcessed);
                return null;
            }
            record = records.next();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        if (record.size() != expectedColumns) {
            throw new ColumnCountMismatchException(tableName, record.size(), expectedColumns,
                    rowsProcessed);
        }
        List<String> values = new ArrayList<>(record.size());
        for (String value : record) {
            values.add(isBlank(value) ? null : value);
        }
        rowsProcessed++;
        return values;
    }

    /**
     * Tells whether a field holds nothing but white space.
     *
     * <p>
     * Covers every Unicode {@code White_Space} code point, including the no-break spaces
     * (U+00A0, U+2007, U+202F) and NEL (U+0085) that {@link Character#isWhitespace(int)} leaves
     * out.
     * </p>
     *
     * @param value field value
     * @return {@code true} if the field is empty or white space only
     */
    static boolean isBlank(String value) {
        return value == null || value.codePoints().allMatch(
                cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85);
    }

    /**
     * Returns the number of rows decoded so far.
     *
     * @return row count
     */
    public long getRowsProcessed() {
        return rowsProcessed;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
