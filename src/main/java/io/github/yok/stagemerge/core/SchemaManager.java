package io.github.yok.stagemerge.core;

import com.google.common.collect.ImmutableMap;
import io.github.yok.stagemerge.db.SqlExecutor;
import io.github.yok.stagemerge.db.WarehouseDialect;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * DDL and catalog reads on the destination namespace.
 *
 * <p>
 * Only additive changes are supported: schemas, tables and columns are created when missing.
 * Column type changes are not performed.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaManager {

    public static final String MISSING_DATATYPE_METRIC = "warehouse_missing_datatype";

    private static final String COLUMNS_SQL = "SELECT table_name, column_name, data_type"
            + " FROM information_schema.columns WHERE table_schema = ? AND table_name NOT LIKE ?"
            + " ORDER BY table_name, ordinal_position";

    private final SqlExecutor executor;

    private final WarehouseDialect dialect;

    private final StagingTables stagingTables;

    private final MeterRegistry meterRegistry;

    /**
     * Creates the namespace unless it already exists.
     *
     * @throws SQLException on database error
     */
    public void createSchema() throws SQLException {
        String namespace = stagingTables.getNamespace();
        boolean exists = executor.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM pg_catalog.pg_namespace WHERE nspname = ?)",
                rs -> rs.getBoolean(1), namespace);
        if (exists) {
            log.info("[{}] Skipping creating schema since it already exists", namespace);
            return;
        }
        String sql = "CREATE SCHEMA IF NOT EXISTS " + dialect.quoteIdentifier(namespace);
        log.info("[{}] Creating schema: {}", namespace, sql);
        executor.execute(sql);
    }

    /**
     * Creates a table with native column types, unless it exists.
     *
     * @param table table name
     * @param schema columns
     * @throws SQLException on database error
     */
    public void createTable(String table, TableSchema schema) throws SQLException {
        String columns = schema.getColumns().entrySet().stream()
                .map(e -> dialect.quoteIdentifier(e.getKey()) + " "
                        + dialect.toNativeType(e.getValue()))
                .collect(Collectors.joining(", "));
        String sql = "CREATE TABLE IF NOT EXISTS " + qualify(table) + " ( " + columns + " )";
        log.info("[{}] Creating table: {}", stagingTables.getNamespace(), sql);
        executor.execute(sql);
    }

    /**
     * Adds columns that do not exist yet.
     *
     * @param table table name
     * @param columns columns to add
     * @throws SQLException on database error
     */
    public void addColumns(String table, TableSchema columns) throws SQLException {
        if (columns.isEmpty()) {
            return;
        }
        String additions = columns.getColumns().entrySet().stream()
                .map(e -> "ADD COLUMN IF NOT EXISTS " + dialect.quoteIdentifier(e.getKey()) + " "
                        + dialect.toNativeType(e.getValue()))
                .collect(Collectors.joining(", "));
        String sql = "ALTER TABLE " + qualify(table) + " " + additions;
        log.info("[{}] Table[{}] Adding columns: {}", stagingTables.getNamespace(), table, sql);
        executor.execute(sql);
    }

    /**
     * Drops a table.
     *
     * @param table table name
     * @throws SQLException on database error, including a missing table
     */
    public void dropTable(String table) throws SQLException {
        String sql = "DROP TABLE " + qualify(table);
        log.info("[{}] Dropping table: {}", stagingTables.getNamespace(), sql);
        executor.execute(sql);
    }

    /**
     * Reads the schema of every non-staging table in the namespace.
     *
     * <p>
     * Each unmapped native type increments {@value #MISSING_DATATYPE_METRIC} tagged with the type.
     * </p>
     *
     * @return recognized and unrecognized columns per table
     * @throws SQLException on database error
     */
    public FetchedSchema fetchSchema() throws SQLException {
        List<String[]> rows = executor.query(COLUMNS_SQL,
                rs -> new String[] {rs.getString(1), rs.getString(2), rs.getString(3)},
                stagingTables.getNamespace(), stagingTables.likePattern());

        Map<String, TableSchema.Builder> schema = new LinkedHashMap<>();
        Map<String, Map<String, String>> unrecognized = new LinkedHashMap<>();
        for (String[] row : rows) {
            String table = row[0];
            String column = row[1];
            String nativeType = row[2];
            TableSchema.Builder builder = schema.computeIfAbsent(table, t -> TableSchema.builder());
            Optional<CanonicalType> type = dialect.toCanonicalType(nativeType);
            if (type.isPresent()) {
                builder.column(column, type.get());
            } else {
                unrecognized.computeIfAbsent(table, t -> new LinkedHashMap<>()).put(column,
                        FetchedSchema.MISSING_DATATYPE);
                meterRegistry.counter(MISSING_DATATYPE_METRIC, "datatype", nativeType).increment();
            }
        }

        ImmutableMap.Builder<String, TableSchema> tables = ImmutableMap.builder();
        schema.forEach((table, builder) -> tables.put(table, builder.build()));
        ImmutableMap.Builder<String, Map<String, String>> missing = ImmutableMap.builder();
        unrecognized.forEach((table, columns) -> missing.put(table, ImmutableMap.copyOf(columns)));
        return new FetchedSchema(tables.build(), missing.build());
    }

    /**
     * Counts the rows of a table.
     *
     * @param table table name
     * @return row count
     * @throws SQLException on database error
     */
    public long getTotalCountInTable(String table) throws SQLException {
        return executor.queryForObject("SELECT count(*) FROM " + qualify(table),
                rs -> rs.getLong(1));
    }

    private String qualify(String table) {
        return dialect.qualify(stagingTables.getNamespace(), table);
    }
}
