package io.github.yok.stagemerge.core;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Value;

/**
 * Schema of a destination namespace as read from the catalog.
 *
 * <p>
 * Columns whose native type has no canonical counterpart are not part of {@link #getSchema()};
 * they are listed in {@link #getUnrecognized()} with the value {@value #MISSING_DATATYPE}.
 * </p>
 */
@Value
public class FetchedSchema {

    public static final String MISSING_DATATYPE = "<missing_datatype>";

    // Table name to recognized columns
    Map<String, TableSchema> schema;

    // Table name to column name to MISSING_DATATYPE
    Map<String, Map<String, String>> unrecognized;

    /**
     * Returns the recognized schema of one table.
     *
     * @param table table name
     * @return table schema, empty when the table is unknown
     */
    public TableSchema tableSchema(String table) {
        return schema.getOrDefault(table, TableSchema.empty());
    }

    public static FetchedSchema empty() {
        return new FetchedSchema(ImmutableMap.of(), ImmutableMap.of());
    }
}
