package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.db.SqlExecutor;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Drops staging tables left behind in the destination schema by a crashed load.
 *
 * <p>
 * Meant to run when no load is in progress for the schema, at startup and at cleanup. Running it
 * next to a live load would drop that load's staging table.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class StagingTableSweeper {

    private static final String LIST_SQL = "SELECT table_name FROM information_schema.tables"
            + " WHERE table_schema = ? AND table_name LIKE ?";

    private final SqlExecutor executor;

    private final StagingTables stagingTables;

    /**
     * Drops every table in the namespace whose name starts with the staging prefix.
     *
     * @return {@code true} if listing and every drop succeeded
     */
    public boolean dropDanglingStagingTables() {
        String namespace = stagingTables.getNamespace();
        List<String> dangling;
        try {
            dangling = executor.queryForStrings(LIST_SQL, namespace, stagingTables.likePattern());
        } catch (SQLException e) {
            log.error("[{}] Error listing dangling staging tables: {}", namespace, e.getMessage(),
                    e);
            return false;
        }
        log.info("[{}] Dropping dangling staging tables: {} {}", namespace, dangling.size(),
                dangling);
        boolean allDropped = true;
        for (String stagingTable : dangling) {
            allDropped &= stagingTables.drop(stagingTable);
        }
        return allDropped;
    }
}
