package io.github.yok.stagemerge.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.UnsignedBytes;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;

/**
 * Ordered mapping from column name to {@link CanonicalType} for one table.
 *
 * <p>
 * Load files carry no header. Their column order is the UTF-8 byte order of the column names
 * returned by {@link #sortedColumnNames()}, which is the contract between the file producer and
 * the bulk-copy statement.
 * </p>
 */
@EqualsAndHashCode
public final class TableSchema {

    private static final TableSchema EMPTY = new TableSchema(ImmutableMap.of());

    // Differs from String#compareTo for supplementary characters against U+E000..U+FFFF
    private static final Comparator<String> UTF8_ORDER = Comparator.comparing(
            name -> name.getBytes(StandardCharsets.UTF_8),
            UnsignedBytes.lexicographicalComparator());

    private final ImmutableMap<String, CanonicalType> columns;

    private TableSchema(ImmutableMap<String, CanonicalType> columns) {
        this.columns = columns;
    }

    /**
     * Creates a schema preserving the iteration order of the given map.
     *
     * @param columns column name to type
     * @return schema
     */
    public static TableSchema of(Map<String, CanonicalType> columns) {
        return new TableSchema(ImmutableMap.copyOf(columns));
    }

    /**
     * Returns the empty schema.
     *
     * @return schema without columns
     */
    public static TableSchema empty() {
        return EMPTY;
    }

    /**
     * Starts a builder.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the columns in declaration order.
     *
     * @return immutable column map
     */
    public Map<String, CanonicalType> getColumns() {
        return columns;
    }

    /**
     * Returns the column names in declaration order.
     *
     * @return column names
     */
    public Set<String> columnNames() {
        return columns.keySet();
    }

    /**
     * Returns the column names sorted by their UTF-8 bytes, the order the file producer writes.
     *
     * @return sorted column names
     */
    public List<String> sortedColumnNames() {
        return ImmutableList.sortedCopyOf(UTF8_ORDER, columns.keySet());
    }

    /**
     * Returns the type of a column.
     *
     * @param column column name
     * @return type, or empty when the column is absent
     */
    public Optional<CanonicalType> typeOf(String column) {
        return Optional.ofNullable(columns.get(column));
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    @Override
    public String toString() {
        return columns.toString();
    }

    /**
     * Builder keeping insertion order.
     */
    public static final class Builder {

        private final ImmutableMap.Builder<String, CanonicalType> columns = ImmutableMap.builder();

        private Builder() {}

        /**
         * Adds a column.
         *
         * @param name column name
         * @param type canonical type
         * @return this builder
         */
        public Builder column(String name, CanonicalType type) {
            columns.put(name, type);
            return this;
        }

        /**
         * Builds the schema.
         *
         * @return schema
         * @throws IllegalArgumentException when a column name was added twice
         */
        public TableSchema build() {
            return new TableSchema(columns.buildOrThrow());
        }
    }
}
