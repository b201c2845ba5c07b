package io.github.yok.stagemerge.core;

import io.github.yok.stagemerge.db.WarehouseDialect;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Merges a loaded staging table into its destination table and commits.
 *
 * <p>
 * Destination rows sharing the dedup key with any staging row are deleted; then, per partition of
 * the staging rows, only the row with the greatest recency value is inserted. Both statements run
 * in the load transaction, so readers see either the old or the new version of every key. Ties
 * on the recency value are broken arbitrarily by the database.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
class DedupMerger {

    static final String SOURCE_ALIAS = "_source";

    static final String ROW_NUMBER_ALIAS = "_rudder_staging_row_number";

    private final WarehouseDialect dialect;

    private final String namespace;

    private final String recencyColumn;

    /**
     * Deletes superseded rows, inserts the latest staged rows and commits.
     *
     * @param txn load transaction
     * @param table destination table
     * @param stagingTable loaded staging table
     * @param columns columns to insert
     * @param key dedup key of the table
     * @param withQueryPlan whether to log execution plans first
     * @throws LoadTableException at {@link LoadStage#DELETE_DEDUP}, {@link LoadStage#INSERT_DEDUP}
     *         or {@link LoadStage#DEDUP_STAGE}
     */
    void merge(LoadTransaction txn, String table, String stagingTable, List<String> columns,
            DedupKey key, boolean withQueryPlan) throws LoadTableException {
        String deleteSql = buildDeleteSql(table, stagingTable, key);
        log.info("[{}] Table[{}] Deduplicating records using staging table: {}", namespace, table,
                deleteSql);
        try {
            txn.sql().execute(deleteSql, withQueryPlan);
        } catch (SQLException e) {
            throw txn.abort(LoadStage.DELETE_DEDUP, e);
        }

        String insertSql = buildInsertSql(table, stagingTable, columns, key);
        log.info("[{}] Table[{}] Inserting records using staging table: {}", namespace, table,
                insertSql);
        try {
            txn.sql().execute(insertSql, withQueryPlan);
        } catch (SQLException e) {
            throw txn.abort(LoadStage.INSERT_DEDUP, e);
        }

        txn.commit(LoadStage.DEDUP_STAGE);
        log.info("[{}] Table[{}] Complete load", namespace, table);
    }

    String buildDeleteSql(String table, String stagingTable, DedupKey key) {
        String target = dialect.qualify(namespace, table);
        StringBuilder condition = new StringBuilder();
        condition.append(joinCondition(target, key.getPrimaryKey()));
        for (String column : key.additionalJoinColumns()) {
            condition.append(" AND ").append(joinCondition(target, column));
        }
        return "DELETE FROM " + target + " USING " + dialect.qualify(namespace, stagingTable)
                + " AS " + SOURCE_ALIAS + " WHERE (" + condition + ")";
    }

    String buildInsertSql(String table, String stagingTable, List<String> columns, DedupKey key) {
        String columnList = quoteAll(columns);
        return "INSERT INTO " + dialect.qualify(namespace, table) + " (" + columnList + ")"
                + " SELECT " + columnList + " FROM ("
                + "SELECT *, row_number() OVER (PARTITION BY " + quoteAll(key.getPartitionKeys())
                + " ORDER BY " + dialect.quoteIdentifier(recencyColumn) + " DESC) AS "
                + ROW_NUMBER_ALIAS + " FROM " + dialect.qualify(namespace, stagingTable)
                + ") AS _ WHERE " + ROW_NUMBER_ALIAS + " = 1";
    }

    private String joinCondition(String target, String column) {
        String quoted = dialect.quoteIdentifier(column);
        return SOURCE_ALIAS + "." + quoted + " = " + target + "." + quoted;
    }

    private String quoteAll(List<String> columns) {
        return columns.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
