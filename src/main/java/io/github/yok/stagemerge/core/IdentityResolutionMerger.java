package io.github.yok.stagemerge.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.stagemerge.config.DedupKeyConfig;
import io.github.yok.stagemerge.config.PostgresLoadProperties;
import io.github.yok.stagemerge.config.WarehouseProperties;
import io.github.yok.stagemerge.db.PooledSqlExecutor;
import io.github.yok.stagemerge.db.WarehouseDialect;
import io.github.yok.stagemerge.source.UploadSource;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads {@code identifies} and then merges {@code users} with per-attribute latest values.
 *
 * <p>
 * For every user id seen in the identifies batch, each attribute column of {@code users} gets the
 * most recent non-null value found across the new identify rows and the user's existing row.
 * Columns are resolved independently: a user's {@code email} may come from one row and
 * {@code name} from another.
 * </p>
 *
 * <p>
 * Intermediate tables:
 * </p>
 * <ul>
 * <li>the identifies staging table, kept after the identifies load and dropped when this step
 * ends</li>
 * <li>the union of the affected existing users and the identify rows that carry a user id</li>
 * <li>the computed users table, one row per user id</li>
 * </ul>
 *
 * <p>
 * When computing latest traits is switched off, {@code users} is loaded like any other table.
 * </p>
 */
@Slf4j
public class IdentityResolutionMerger {

    static final String USERS = DedupKeyConfig.USERS_TABLE;

    static final String IDENTIFIES = DedupKeyConfig.IDENTIFIES_TABLE;

    static final String UNION_TABLE = "users_identifies_union";

    static final String ID = "id";

    static final String USER_ID = "user_id";

    private final PooledSqlExecutor pool;

    private final WarehouseDialect dialect;

    private final RollbackSupervisor rollbackSupervisor;

    private final WarehouseProperties warehouse;

    private final PostgresLoadProperties properties;

    private final StagingTables stagingTables;

    private final TableLoader tableLoader;

    /**
     * Creates a merger.
     *
     * @param pool non-transactional executor, also the source of transactions
     * @param dialect warehouse dialect
     * @param rollbackSupervisor supervisor for rollbacks
     * @param warehouse destination identity
     * @param properties engine tunables
     * @param stagingTables staging table naming and disposal
     * @param tableLoader loader used for {@code identifies} (and {@code users} when traits are
     *        not computed)
     */
    public IdentityResolutionMerger(PooledSqlExecutor pool, WarehouseDialect dialect,
            RollbackSupervisor rollbackSupervisor, WarehouseProperties warehouse,
            PostgresLoadProperties properties, StagingTables stagingTables,
            TableLoader tableLoader) {
        this.pool = pool;
        this.dialect = dialect;
        this.rollbackSupervisor = rollbackSupervisor;
        this.warehouse = warehouse;
        this.properties = properties;
        this.stagingTables = stagingTables;
        this.tableLoader = tableLoader;
    }

    /**
     * Loads {@code identifies}, then {@code users}.
     *
     * @param upload upload source
     * @return per-table outcome; {@code users} is absent when identifies failed or the upload has
     *         no users data
     */
    public UserTablesLoadResult loadUserTables(UploadSource upload) {
        String namespace = warehouse.getNamespace();
        UserTablesLoadResult result = new UserTablesLoadResult();
        result.attempted(IDENTIFIES);
        log.info("[{}] Starting load for identifies and users tables", namespace);

        String identifiesStaging = stagingTables.newName(IDENTIFIES);
        try {
            try {
                tableLoader.loadTable(upload, IDENTIFIES, upload.getTableSchemaInUpload(IDENTIFIES),
                        identifiesStaging, true);
            } catch (LoadTableException e) {
                result.failed(e);
                return result;
            }

            if (upload.getTableSchemaInUpload(USERS).isEmpty()) {
                log.info("[{}] No users in upload, skipping users table", namespace);
                return result;
            }
            result.attempted(USERS);

            try {
                if (properties.isSkipComputingUserLatestTraitsFor(warehouse.getWorkspaceId())) {
                    log.info("[{}] Skipping latest traits computation for users", namespace);
                    tableLoader.loadTable(upload, USERS);
                } else {
                    mergeUsers(upload, identifiesStaging);
                }
            } catch (LoadTableException e) {
                result.failed(e);
            }
            return result;
        } finally {
            stagingTables.drop(identifiesStaging);
        }
    }

    private void mergeUsers(UploadSource upload, String identifiesStaging)
            throws LoadTableException {
        String unionStaging = stagingTables.newName(UNION_TABLE);
        String usersStaging = stagingTables.newName(USERS);
        List<String> attributes = upload.getTableSchemaInWarehouse(USERS).sortedColumnNames()
                .stream().filter(column -> !ID.equals(column)).collect(Collectors.toList());
        try {
            String unionSql = buildUnionSql(identifiesStaging, unionStaging, attributes);
            log.info("[{}] Creating union of users table with identifies staging table: {}",
                    warehouse.getNamespace(), unionSql);
            try {
                pool.execute(unionSql);
            } catch (SQLException e) {
                throw new LoadTableException(USERS, LoadStage.USERS_UNION_CREATION, e);
            }

            String computeSql = buildLatestTraitsSql(unionStaging, usersStaging, attributes);
            log.debug("[{}] Creating staging table for users: {}", warehouse.getNamespace(),
                    computeSql);
            try {
                pool.execute(computeSql);
            } catch (SQLException e) {
                throw new LoadTableException(USERS, LoadStage.USERS_STAGING_CREATION, e);
            }

            replaceUsers(usersStaging, attributes);
        } finally {
            stagingTables.drop(usersStaging);
            stagingTables.drop(unionStaging);
        }
    }

    private void replaceUsers(String usersStaging, List<String> attributes)
            throws LoadTableException {
        LoadTags tags = LoadTags.builder().workspaceId(warehouse.getWorkspaceId())
                .namespace(warehouse.getNamespace()).destinationId(warehouse.getDestinationId())
                .tableName(USERS).build();
        boolean withQueryPlan = properties.isExecutionPlanEnabledFor(warehouse.getWorkspaceId());
        try (LoadTransaction txn = LoadTransaction.open(pool, rollbackSupervisor,
                properties.getTxnRollbackTimeout(), properties.getStatementTimeout(), tags)) {
            String deleteSql = "DELETE FROM " + users() + " USING "
                    + dialect.qualify(warehouse.getNamespace(), usersStaging) + " AS _source WHERE "
                    + "(_source." + quote(ID) + " = " + users() + "." + quote(ID) + ")";
            log.info("[{}] Deduplicating records for users using staging table: {}",
                    warehouse.getNamespace(), deleteSql);
            try {
                txn.sql().execute(deleteSql, withQueryPlan);
            } catch (SQLException e) {
                throw txn.abort(LoadStage.DELETE_DEDUP, e);
            }

            String columns = quoteAll(ImmutableList.<String>builder().add(ID)
                    .addAll(attributes).build());
            String insertSql = "INSERT INTO " + users() + " (" + columns + ") SELECT " + columns
                    + " FROM " + dialect.qualify(warehouse.getNamespace(), usersStaging);
            log.info("[{}] Inserting records for users using staging table: {}",
                    warehouse.getNamespace(), insertSql);
            try {
                txn.sql().execute(insertSql, withQueryPlan);
            } catch (SQLException e) {
                throw txn.abort(LoadStage.INSERT_DEDUP, e);
            }

            txn.commit(LoadStage.DEDUP_STAGE);
            log.info("[{}] Table[{}] Complete load", warehouse.getNamespace(), USERS);
        }
    }

    /**
     * Builds the union of existing users whose id appears as a user id in the identifies batch
     * with the identify rows that carry a user id.
     */
    String buildUnionSql(String identifiesStaging, String unionStaging, List<String> attributes) {
        String identifies = dialect.qualify(warehouse.getNamespace(), identifiesStaging);
        String attributeList = attributes.isEmpty() ? "" : ", " + quoteAll(attributes);
        return "CREATE TABLE " + dialect.qualify(warehouse.getNamespace(), unionStaging)
                + " AS ((SELECT " + quote(ID) + attributeList + " FROM " + users() + " WHERE "
                + quote(ID) + " IN (SELECT " + quote(USER_ID) + " FROM " + identifies
                + " WHERE " + quote(USER_ID) + " IS NOT NULL)) UNION (SELECT " + quote(USER_ID)
                + attributeList + " FROM " + identifies + " WHERE " + quote(USER_ID)
                + " IS NOT NULL))";
    }

    /**
     * Builds the computed users table: one row per id, each attribute resolved by its own
     * correlated subquery picking the most recent non-null value.
     */
    String buildLatestTraitsSql(String unionStaging, String usersStaging,
            List<String> attributes) {
        String union = dialect.qualify(warehouse.getNamespace(), unionStaging);
        String recency = quote(properties.getRecencyColumn());
        StringBuilder select = new StringBuilder("x.").append(quote(ID));
        for (String attribute : attributes) {
            String column = quote(attribute);
            select.append(", (SELECT ").append(column).append(" FROM ").append(union)
                    .append(" AS staging_table WHERE x.").append(quote(ID))
                    .append(" = staging_table.").append(quote(ID)).append(" AND ")
                    .append(column).append(" IS NOT NULL ORDER BY ").append(recency)
                    .append(" DESC LIMIT 1) AS ").append(column);
        }
        return "CREATE TABLE " + dialect.qualify(warehouse.getNamespace(), usersStaging)
                + " AS (SELECT DISTINCT * FROM (SELECT " + select + " FROM " + union
                + " AS x) AS xyz)";
    }

    private String users() {
        return dialect.qualify(warehouse.getNamespace(), USERS);
    }

    private String quote(String identifier) {
        return dialect.quoteIdentifier(identifier);
    }

    private String quoteAll(List<String> columns) {
        return columns.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
