package io.github.yok.stagemerge.config;

import com.google.common.collect.ImmutableMap;
import io.github.yok.stagemerge.core.DedupKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-table dedup keys, bound from {@code warehouse.dedup.tables}.
 *
 * <pre>
 * warehouse:
 *   dedup:
 *     tables:
 *       rudder_discards:
 *         primary-key: row_id
 *         partition-keys: [row_id, column_name, table_name]
 * </pre>
 *
 * <p>
 * Configured entries override the built-in ones for {@code users}, {@code identifies} and
 * {@code rudder_discards}. Any other table uses {@link DedupKey#DEFAULT}.
 * </p>
 */
@Component
@ConfigurationProperties(prefix = "warehouse.dedup")
@Data
public class DedupKeyConfig {

    public static final String USERS_TABLE = "users";

    public static final String IDENTIFIES_TABLE = "identifies";

    public static final String DISCARDS_TABLE = "rudder_discards";

    private static final Map<String, DedupKey> BUILT_IN = ImmutableMap.of(USERS_TABLE,
            DedupKey.DEFAULT, IDENTIFIES_TABLE, DedupKey.DEFAULT, DISCARDS_TABLE,
            new DedupKey("row_id", List.of("row_id", "column_name", "table_name")));

    // Table name to key override
    private Map<String, Entry> tables = new LinkedHashMap<>();

    /**
     * Resolves the dedup key of a table.
     *
     * @param table destination table
     * @return configured key, built-in key, or the default {@code id}/{@code id}
     */
    public DedupKey resolve(String table) {
        Entry entry = tables.get(table);
        if (entry != null) {
            String primaryKey = StringUtils.defaultIfBlank(entry.getPrimaryKey(),
                    DedupKey.DEFAULT_KEY);
            List<String> partitionKeys =
                    entry.getPartitionKeys() == null ? List.of() : entry.getPartitionKeys();
            return new DedupKey(primaryKey, partitionKeys);
        }
        return BUILT_IN.getOrDefault(table, DedupKey.DEFAULT);
    }

    /**
     * Dedup key of one table.
     */
    @Data
    public static class Entry {
        // Join column for deleting superseded rows
        private String primaryKey;
        // Columns partitioning staging rows when picking the latest version
        private List<String> partitionKeys;
    }
}
