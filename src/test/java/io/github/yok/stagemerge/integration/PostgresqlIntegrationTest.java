package io.github.yok.stagemerge.integration;

import static io.github.yok.stagemerge.integration.PostgresqlIntegrationSupport.NAMESPACE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.stagemerge.config.PostgresLoadProperties;
import io.github.yok.stagemerge.core.CanonicalType;
import io.github.yok.stagemerge.core.DeleteByParams;
import io.github.yok.stagemerge.core.FetchedSchema;
import io.github.yok.stagemerge.core.LoadStage;
import io.github.yok.stagemerge.core.LoadTableException;
import io.github.yok.stagemerge.core.PostgresWarehouse;
import io.github.yok.stagemerge.core.TableSchema;
import io.github.yok.stagemerge.core.UserTablesLoadResult;
import io.github.yok.stagemerge.source.LocalUploadSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Integration tests for the load engine against a PostgreSQL container.
 *
 * <p>
 * Covers: table load with dedup merge, rollback on failure, identity resolution for users, crash
 * recovery, schema management and the retention delete.
 * </p>
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresqlIntegrationTest {

    // tracks のロードファイル列順:
    // context_source_id, context_sources_job_run_id, context_sources_task_run_id, event, id,
    // received_at

    @TempDir
    Path tempDir;

    @Container
    private static final PostgreSQLContainer<?> postgres = createPostgres();

    private static PostgreSQLContainer<?> createPostgres() {
        PostgreSQLContainer<?> container = new PostgreSQLContainer<>("postgres:16-alpine");
        container.withDatabaseName("testdb").withUsername("test").withPassword("test");
        return container;
    }

    private PostgresqlIntegrationSupport.Runtime runtime;

    @BeforeEach
    void setup_正常ケース_PostgreSQLコンテナに対してFlywayを実行する_マイグレーションが完了すること() {
        PostgresqlIntegrationSupport.prepareDatabase(postgres);
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    private PostgresWarehouse warehouse(PostgresLoadProperties properties) {
        runtime = PostgresqlIntegrationSupport.prepareRuntime(postgres, tempDir.resolve("data"),
                properties);
        return runtime.warehouse();
    }

    private void writeLoadFile(String table, String fileName, String... lines) throws Exception {
        PostgresqlIntegrationSupport.writeLoadFile(runtime.pathsConfig(), table, fileName, lines);
    }

    private LocalUploadSource upload(PostgresWarehouse warehouse) throws Exception {
        return new LocalUploadSource(runtime.pathsConfig(), warehouse.fetchSchema());
    }

    @Test
    void loadTable_正常ケース_重複を含むロードファイルを指定する_キーごとに最新行のみが残ること()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres, "INSERT INTO " + NAMESPACE
                + ".tracks (id, event, received_at) VALUES ('1', 'old', '2024-01-01T00:00:00Z')");
        writeLoadFile("tracks", "a.csv.gz", ",,,new,1,2024-01-02T00:00:00Z",
                ",,,newer,1,2024-01-03T00:00:00Z");
        writeLoadFile("tracks", "b.csv.gz", "src-1,job-1,task-1,first,2,2024-01-01T00:00:00Z");

        try (LocalUploadSource upload = upload(warehouse)) {
            warehouse.loadTable(upload, "tracks");
        }

        ITable tracks = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT id, event, context_source_id FROM " + NAMESPACE + ".tracks ORDER BY id");
        assertEquals(2, tracks.getRowCount(), "キーごとに 1 行となること");
        assertEquals("1", tracks.getValue(0, "id"));
        assertEquals("newer", tracks.getValue(0, "event"));
        assertNull(tracks.getValue(0, "context_source_id"), "空値は NULL で格納されること");
        assertEquals("first", tracks.getValue(1, "event"));
        assertEquals("src-1", tracks.getValue(1, "context_source_id"));
        assertEquals(0, PostgresqlIntegrationSupport.countStagingTables(postgres));
        assertTrue(Files.exists(runtime.pathsConfig().getTableLoadDir("tracks").resolve("a.csv.gz")),
                "元のロードファイルは残ること");
    }

    @Test
    void loadTable_正常ケース_ロードファイルなし_宛先が変更されないこと() throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres, "INSERT INTO " + NAMESPACE
                + ".tracks (id, event, received_at) VALUES ('1', 'old', '2024-01-01T00:00:00Z')");

        try (LocalUploadSource upload = upload(warehouse)) {
            warehouse.loadTable(upload, "tracks");
        }

        assertEquals(1L, warehouse.getTotalCountInTable("tracks"));
        assertEquals(0, PostgresqlIntegrationSupport.countStagingTables(postgres));
    }

    @Test
    void loadTable_異常ケース_列数不一致の行を含む_ロールバックされ宛先が変更されないこと()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres, "INSERT INTO " + NAMESPACE
                + ".tracks (id, event, received_at) VALUES ('1', 'old', '2024-01-01T00:00:00Z')");
        writeLoadFile("tracks", "a.csv.gz", ",,,new,1,2024-01-02T00:00:00Z",
                ",,,broken,2");

        LoadTableException e;
        try (LocalUploadSource upload = upload(warehouse)) {
            e = assertThrows(LoadTableException.class, () -> warehouse.loadTable(upload, "tracks"));
        }

        assertEquals(LoadStage.CSV_COLUMN_COUNT_MISMATCH, e.getStage());
        assertEquals("tracks", e.getTableName());
        ITable tracks = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT id, event FROM " + NAMESPACE + ".tracks");
        assertEquals(1, tracks.getRowCount());
        assertEquals("old", tracks.getValue(0, "event"));
        assertEquals(0, PostgresqlIntegrationSupport.countStagingTables(postgres));
    }

    @Test
    void loadTable_異常ケース_型変換できない値を含む_コピー段階で失敗し宛先が変更されないこと()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        writeLoadFile("tracks", "a.csv.gz", ",,,bad,1,not-a-timestamp");

        LoadTableException e;
        try (LocalUploadSource upload = upload(warehouse)) {
            e = assertThrows(LoadTableException.class, () -> warehouse.loadTable(upload, "tracks"));
        }

        // サーバ側のエラーは送信中または完了時に検出される
        assertTrue(Set.of(LoadStage.LOAD_STAGING_TABLE, LoadStage.STAGING_TABLE_LOAD_STAGE)
                .contains(e.getStage()), "stage=" + e.getStage());
        assertEquals(0L, warehouse.getTotalCountInTable("tracks"));
        assertEquals(0, PostgresqlIntegrationSupport.countStagingTables(postgres));
    }

    @Test
    void loadTable_正常ケース_discardsテーブルを指定する_複合キーで重複排除されること() throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres,
                "INSERT INTO " + NAMESPACE + ".rudder_discards VALUES"
                        + " ('r1', 'c1', 't1', 'old', '2024-01-01T00:00:00Z'),"
                        + " ('r1', 'c2', 't1', 'keep', '2024-01-01T00:00:00Z')");
        // 列順: column_name, column_value, received_at, row_id, table_name
        writeLoadFile("rudder_discards", "a.csv.gz", "c1,new,2024-01-02T00:00:00Z,r1,t1");

        try (LocalUploadSource upload = upload(warehouse)) {
            warehouse.loadTable(upload, "rudder_discards");
        }

        ITable discards = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT column_name, column_value FROM " + NAMESPACE
                        + ".rudder_discards ORDER BY column_name");
        assertEquals(2, discards.getRowCount(), "別列の破棄行は残ること");
        assertEquals("new", discards.getValue(0, "column_value"));
        assertEquals("keep", discards.getValue(1, "column_value"));
    }

    @Test
    void loadUserTables_正常ケース_identifiesを指定する_列ごとに最新の非null値でusersが更新されること()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres, "INSERT INTO " + NAMESPACE
                + ".users VALUES ('u1', 'old@example.com', 'Old', '2024-01-01T00:00:00Z')");
        // 列順: email, id, name, received_at, user_id
        writeLoadFile("identifies", "a.csv.gz",
                "new@example.com,i1,,2024-01-02T00:00:00Z,u1",
                ",i2,New,2024-01-03T00:00:00Z,u1",
                "e2@example.com,i3,,2024-01-02T00:00:00Z,u2",
                "anon@example.com,i4,,2024-01-02T00:00:00Z,");

        UserTablesLoadResult result;
        try (LocalUploadSource upload = upload(warehouse)) {
            result = warehouse.loadUserTables(upload);
        }

        assertTrue(result.isSuccessful(), result.toString());
        assertEquals(List.of("identifies", "users"), List.copyOf(result.getTables()));
        assertEquals(4L, warehouse.getTotalCountInTable("identifies"));
        ITable users = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT id, email, name, received_at = TIMESTAMPTZ '2024-01-03 00:00:00+00'"
                        + " AS latest FROM " + NAMESPACE + ".users ORDER BY id");
        assertEquals(2, users.getRowCount(), "user_id を持たない identify は反映されないこと");
        assertEquals("u1", users.getValue(0, "id"));
        assertEquals("new@example.com", users.getValue(0, "email"));
        assertEquals("New", users.getValue(0, "name"));
        assertEquals(Boolean.TRUE, users.getValue(0, "latest"));
        assertEquals("u2", users.getValue(1, "id"));
        assertEquals("e2@example.com", users.getValue(1, "email"));
        assertNull(users.getValue(1, "name"));
        assertEquals(0, PostgresqlIntegrationSupport.countStagingTables(postgres));
    }

    @Test
    void loadUserTables_正常ケース_最新属性の計算をスキップする_usersがロードファイルで置換されること()
            throws Exception {
        PostgresLoadProperties properties = new PostgresLoadProperties();
        properties.setSkipComputingUserLatestTraits(true);
        PostgresWarehouse warehouse = warehouse(properties);
        PostgresqlIntegrationSupport.executeSql(postgres, "INSERT INTO " + NAMESPACE
                + ".users VALUES ('u1', 'old@example.com', 'Old', '2024-01-01T00:00:00Z')");
        // 列順: email, id, name, received_at
        writeLoadFile("users", "a.csv.gz", "only@example.com,u1,,2024-01-05T00:00:00Z");

        UserTablesLoadResult result;
        try (LocalUploadSource upload = upload(warehouse)) {
            result = warehouse.loadUserTables(upload);
        }

        assertTrue(result.isSuccessful(), result.toString());
        ITable users = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT email, name FROM " + NAMESPACE + ".users");
        assertEquals(1, users.getRowCount());
        assertEquals("only@example.com", users.getValue(0, "email"));
        assertNull(users.getValue(0, "name"), "行全体が置換されること");
    }

    @Test
    void loadUserTables_異常ケース_identifiesのロードが失敗する_usersは変更されないこと()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres, "INSERT INTO " + NAMESPACE
                + ".users VALUES ('u1', 'old@example.com', 'Old', '2024-01-01T00:00:00Z')");
        writeLoadFile("identifies", "a.csv.gz", "new@example.com,i1");

        UserTablesLoadResult result;
        try (LocalUploadSource upload = upload(warehouse)) {
            result = warehouse.loadUserTables(upload);
        }

        assertFalse(result.isSuccessful());
        assertEquals(Set.of("identifies"), result.getTables());
        assertEquals(LoadStage.CSV_COLUMN_COUNT_MISMATCH,
                result.errorFor("identifies").orElseThrow().getStage());
        ITable users = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT email FROM " + NAMESPACE + ".users");
        assertEquals("old@example.com", users.getValue(0, "email"));
        assertEquals(0, PostgresqlIntegrationSupport.countStagingTables(postgres));
    }

    @Test
    void crashRecover_正常ケース_残存ステージングテーブルあり_接頭辞に一致するテーブルのみ削除されること()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres,
                "CREATE TABLE " + NAMESPACE + ".rudder_staging_tracks_0123456789abcdef (id text)",
                "CREATE TABLE " + NAMESPACE + ".rudder_staging_identifies_x (id text)",
                "CREATE TABLE " + NAMESPACE + ".rudderxstagingxkeep (id text)");

        assertTrue(warehouse.crashRecover());

        assertEquals(0, PostgresqlIntegrationSupport.countStagingTables(postgres));
        ITable kept = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT table_name FROM information_schema.tables WHERE table_schema = '"
                        + NAMESPACE + "' AND table_name = 'rudderxstagingxkeep'");
        assertEquals(1, kept.getRowCount(), "_ をワイルドカードとして扱わないこと");
    }

    @Test
    void fetchSchema_正常ケース_未対応型とステージングを含む_未認識列が分離されステージングは除外されること()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());
        PostgresqlIntegrationSupport.executeSql(postgres,
                "CREATE TABLE " + NAMESPACE + ".rudder_staging_tracks_x (id text)");

        FetchedSchema schema = warehouse.fetchSchema();

        assertEquals(Map.of("location", FetchedSchema.MISSING_DATATYPE),
                schema.getUnrecognized().get("geo_events"));
        assertEquals(Optional.of(CanonicalType.STRING),
                schema.tableSchema("geo_events").typeOf("id"));
        assertEquals(List.of("context_source_id", "context_sources_job_run_id",
                "context_sources_task_run_id", "event", "id", "received_at"),
                schema.tableSchema("tracks").sortedColumnNames());
        assertEquals(Optional.of(CanonicalType.DATETIME),
                schema.tableSchema("tracks").typeOf("received_at"));
        assertFalse(schema.getSchema().containsKey("rudder_staging_tracks_x"));
        assertEquals(1.0, runtime.registry().get("warehouse_missing_datatype")
                .tag("datatype", "point").counter().count());
    }

    @Test
    void createTable_正常ケース_テーブル作成と列追加と削除を行う_カタログに反映されること()
            throws Exception {
        PostgresWarehouse warehouse = warehouse(new PostgresLoadProperties());

        warehouse.createSchema();
        warehouse.createTable("orders", TableSchema.builder().column("id", CanonicalType.STRING)
                .column("amount", CanonicalType.FLOAT).build());
        warehouse.addColumns("orders", TableSchema.builder()
                .column("paid", CanonicalType.BOOLEAN).column("meta", CanonicalType.JSON).build());
        // 既存列の再追加はエラーにならない
        warehouse.addColumns("orders",
                TableSchema.builder().column("paid", CanonicalType.BOOLEAN).build());

        TableSchema orders = warehouse.fetchSchema().tableSchema("orders");
        assertEquals(Map.of("id", CanonicalType.STRING, "amount", CanonicalType.FLOAT, "paid",
                CanonicalType.BOOLEAN, "meta", CanonicalType.JSON), orders.getColumns());
        assertEquals(0L, warehouse.getTotalCountInTable("orders"));

        warehouse.dropTable("orders");
        assertTrue(warehouse.fetchSchema().tableSchema("orders").isEmpty());
    }

    @Test
    void deleteBy_正常ケース_有効化されている_過去ジョブの古い行のみ削除されること() throws Exception {
        PostgresLoadProperties properties = new PostgresLoadProperties();
        properties.setEnableDeleteByJobs(true);
        PostgresWarehouse warehouse = warehouse(properties);
        PostgresqlIntegrationSupport.executeSql(postgres, "INSERT INTO " + NAMESPACE
                + ".tracks (id, received_at, context_sources_job_run_id,"
                + " context_sources_task_run_id, context_source_id) VALUES"
                + " ('old', '2024-01-01T00:00:00Z', 'job-1', 'task-1', 'src-1'),"
                + " ('current', '2024-01-01T00:00:00Z', 'job-2', 'task-2', 'src-1'),"
                + " ('other', '2024-01-01T00:00:00Z', 'job-1', 'task-1', 'src-9'),"
                + " ('recent', '2024-03-01T00:00:00Z', 'job-1', 'task-1', 'src-1')");

        warehouse.deleteBy(List.of("tracks"), DeleteByParams.builder().jobRunId("job-2")
                .taskRunId("task-2").sourceId("src-1")
                .startTime(Instant.parse("2024-02-01T00:00:00Z")).build());

        ITable tracks = PostgresqlIntegrationSupport.queryTable(postgres,
                "SELECT id FROM " + NAMESPACE + ".tracks ORDER BY id");
        assertEquals(3, tracks.getRowCount());
        assertEquals("current", tracks.getValue(0, "id"));
        assertEquals("other", tracks.getValue(1, "id"));
        assertEquals("recent", tracks.getValue(2, "id"));
    }

    @Test
    void testConnection_正常ケース_起動中のコンテナを指定する_例外が送出されないこと() throws Exception {
        warehouse(new PostgresLoadProperties()).testConnection();
    }
}
