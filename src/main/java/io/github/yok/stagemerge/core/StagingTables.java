package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.db.SqlExecutor;
import io.github.yok.stagemerge.db.WarehouseDialect;
import java.sql.SQLException;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Naming and disposal of staging tables.
 *
 * <p>
 * A staging table name is {@code <prefix><table>_<32 hex digits>}. The random suffix makes
 * concurrent loads of the same table collide-free. When the name would exceed the identifier
 * limit, the table part is shortened; the prefix and the suffix are always kept intact, so every
 * staging table is still found by the crash-recovery sweep.
 * </p>
 */
@Slf4j
public class StagingTables {

    private final SqlExecutor executor;

    private final WarehouseDialect dialect;

    private final String namespace;

    private final int nameLimit;

    /**
     * Creates the helper.
     *
     * @param executor non-transactional executor used for drops
     * @param dialect warehouse dialect
     * @param namespace destination schema
     * @param nameLimit maximum identifier length
     */
    public StagingTables(SqlExecutor executor, WarehouseDialect dialect, String namespace,
            int nameLimit) {
        this.executor = executor;
        this.dialect = dialect;
        this.namespace = namespace;
        this.nameLimit = Math.min(nameLimit, dialect.getMaxIdentifierLength());
    }

    /**
     * Generates a fresh staging table name for a table.
     *
     * @param table destination table (or logical intermediate name)
     * @return unique staging table name
     */
    public String newName(String table) {
        String prefix = dialect.getStagingTablePrefix();
        String suffix = "_" + UUID.randomUUID().toString().replace("-", "");
        String base = dialect.toProviderCase(table);
        int room = Math.max(0, nameLimit - prefix.length() - suffix.length());
        if (base.length() > room) {
            base = base.substring(0, room);
        }
        return prefix + base + suffix;
    }

    /**
     * Returns the {@code LIKE} pattern matching every staging table, with {@code _} and
     * {@code %} in the prefix escaped.
     *
     * @return pattern
     */
    public String likePattern() {
        String prefix = dialect.getStagingTablePrefix();
        return prefix.replace("\\", "\\\\").replace("_", "\\_").replace("%", "\\%") + "%";
    }

    /**
     * Drops a staging table if it exists. Failures are logged, never thrown.
     *
     * @param stagingTable staging table
     * @return {@code true} if the drop succeeded
     */
    public boolean drop(String stagingTable) {
        String sql = "DROP TABLE IF EXISTS " + dialect.qualify(namespace, stagingTable);
        log.info("[{}] Dropping staging table {}", namespace, stagingTable);
        try {
            executor.execute(sql);
            return true;
        } catch (SQLException e) {
            log.error("[{}] Error dropping staging table {}: {}", namespace, stagingTable,
                    e.getMessage(), e);
            return false;
        }
    }

    public String getNamespace() {
        return namespace;
    }
}
