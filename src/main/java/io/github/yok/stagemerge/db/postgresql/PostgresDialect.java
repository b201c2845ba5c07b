package io.github.yok.stagemerge.db.postgresql;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.stagemerge.core.CanonicalType;
import io.github.yok.stagemerge.db.BulkCopyChannel;
import io.github.yok.stagemerge.db.WarehouseDialect;
import io.github.yok.stagemerge.error.JobError;
import io.github.yok.stagemerge.error.JobErrorType;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyManager;

/**
 * PostgreSQL implementation of {@link WarehouseDialect}.
 *
 * <p>
 * Canonical types map to {@code bigint}, {@code numeric}, {@code text}, {@code timestamptz},
 * {@code boolean} and {@code jsonb}. The reverse map also accepts the other spellings the catalog
 * reports for compatible columns (e.g. {@code integer}, {@code character varying},
 * {@code timestamp with time zone}).
 * </p>
 *
 * <p>
 * Bulk ingest uses the {@code COPY ... FROM STDIN} protocol of the PostgreSQL JDBC driver.
 * </p>
 */
@Slf4j
public class PostgresDialect implements WarehouseDialect {

    public static final String PROVIDER = "POSTGRES";

    public static final String STAGING_TABLE_PREFIX = "rudder_staging_";

    // NAMEDATALEN - 1
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final Map<CanonicalType, String> TO_NATIVE =
            ImmutableMap.<CanonicalType, String>builder().put(CanonicalType.INT, "bigint")
                    .put(CanonicalType.FLOAT, "numeric").put(CanonicalType.STRING, "text")
                    .put(CanonicalType.DATETIME, "timestamptz")
                    .put(CanonicalType.BOOLEAN, "boolean").put(CanonicalType.JSON, "jsonb")
                    .build();

    private static final Map<String, CanonicalType> FROM_NATIVE =
            ImmutableMap.<String, CanonicalType>builder().put("integer", CanonicalType.INT)
                    .put("smallint", CanonicalType.INT).put("bigint", CanonicalType.INT)
                    .put("double precision", CanonicalType.FLOAT)
                    .put("numeric", CanonicalType.FLOAT).put("real", CanonicalType.FLOAT)
                    .put("text", CanonicalType.STRING).put("varchar", CanonicalType.STRING)
                    .put("char", CanonicalType.STRING)
                    .put("character varying", CanonicalType.STRING)
                    .put("character", CanonicalType.STRING)
                    .put("timestamptz", CanonicalType.DATETIME)
                    .put("timestamp with time zone", CanonicalType.DATETIME)
                    .put("timestamp", CanonicalType.DATETIME)
                    .put("timestamp without time zone", CanonicalType.DATETIME)
                    .put("boolean", CanonicalType.BOOLEAN).put("jsonb", CanonicalType.JSON)
                    .build();

    // Evaluated in order; the generic relation pattern comes after the resource-state patterns
    private static final List<JobError> ERROR_MAPPINGS = ImmutableList.of(
            JobError.of(JobErrorType.RESOURCE_NOT_FOUND, "UnknownHostException"),
            JobError.of(JobErrorType.PERMISSION, "Connection to .* refused"),
            JobError.of(JobErrorType.RESOURCE_NOT_FOUND, "database \".*\" does not exist"),
            JobError.of(JobErrorType.RESOURCE_NOT_FOUND, "the database system is starting up"),
            JobError.of(JobErrorType.RESOURCE_NOT_FOUND, "the database system is shutting down"),
            JobError.of(JobErrorType.RESOURCE_NOT_FOUND, "relation \".*\" does not exist"),
            JobError.of(JobErrorType.RESOURCE_NOT_FOUND,
                    "cannot set transaction read-write mode during recovery"),
            JobError.of(JobErrorType.COLUMN_COUNT, "tables can have at most 1600 columns"),
            JobError.of(JobErrorType.PERMISSION, "password authentication failed for user"),
            JobError.of(JobErrorType.PERMISSION, "permission denied"));

    @Override
    public String getProvider() {
        return PROVIDER;
    }

    /**
     * Quotes an identifier with double quotes, doubling embedded quotes.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    @Override
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String toProviderCase(String identifier) {
        return identifier.toLowerCase(Locale.ROOT);
    }

    @Override
    public String getStagingTablePrefix() {
        return STAGING_TABLE_PREFIX;
    }

    @Override
    public int getMaxIdentifierLength() {
        return MAX_IDENTIFIER_LENGTH;
    }

    @Override
    public String toNativeType(CanonicalType type) {
        return TO_NATIVE.get(type);
    }

    @Override
    public Optional<CanonicalType> toCanonicalType(String nativeType) {
        if (nativeType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(FROM_NATIVE.get(nativeType.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Starts {@code COPY "ns"."table" ("c1", ...) FROM STDIN WITH (FORMAT csv)} on the connection.
     *
     * @param connection connection owning the load transaction; must wrap a pgjdbc connection
     * @param namespace schema
     * @param table staging table
     * @param columns column order of the written rows
     * @return open channel
     * @throws SQLException if the driver rejects the copy
     */
    @Override
    public BulkCopyChannel openBulkCopy(Connection connection, String namespace, String table,
            List<String> columns) throws SQLException {
        String columnList =
                columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String sql = "COPY " + qualify(namespace, table) + " (" + columnList
                + ") FROM STDIN WITH (FORMAT csv)";
        log.debug("Opening bulk copy: {}", sql);
        CopyManager copyManager = connection.unwrap(PGConnection.class).getCopyAPI();
        return new PgCopyChannel(copyManager.copyIn(sql), columns.size());
    }

    @Override
    public List<JobError> getErrorMappings() {
        return ERROR_MAPPINGS;
    }
}
