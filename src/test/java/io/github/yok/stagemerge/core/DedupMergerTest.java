package io.github.yok.stagemerge.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.stagemerge.db.PooledSqlExecutor;
import io.github.yok.stagemerge.db.TransactionalSqlExecutor;
import io.github.yok.stagemerge.db.postgresql.PostgresDialect;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class DedupMergerTest {

    private final DedupMerger merger =
            new DedupMerger(new PostgresDialect(), "rudder", "received_at");

    private final RollbackSupervisor supervisor =
            new RollbackSupervisor(new SimpleMeterRegistry());

    private TransactionalSqlExecutor txExecutor;

    private LoadTransaction txn;

    @BeforeEach
    void setup() throws Exception {
        PooledSqlExecutor pool = mock(PooledSqlExecutor.class);
        txExecutor = mock(TransactionalSqlExecutor.class);
        when(pool.beginTransaction()).thenReturn(txExecutor);
        txn = LoadTransaction.open(pool, supervisor, Duration.ofSeconds(5), Duration.ZERO,
                LoadTags.builder().namespace("rudder").tableName("tracks").build());
    }

    @AfterEach
    void tearDown() {
        supervisor.close();
    }

    @Test
    void buildDeleteSql_正常ケース_既定キーを指定する_主キーのみで結合するDELETE文となること() {
        String sql = merger.buildDeleteSql("tracks", "rudder_staging_tracks_x", DedupKey.DEFAULT);

        assertEquals("DELETE FROM \"rudder\".\"tracks\" USING \"rudder\".\"rudder_staging_tracks_x\""
                + " AS _source WHERE (_source.\"id\" = \"rudder\".\"tracks\".\"id\")", sql);
    }

    @Test
    void buildDeleteSql_正常ケース_複合キーを指定する_パーティション列も結合条件に含まれること() {
        DedupKey key = new DedupKey("row_id", List.of("row_id", "column_name", "table_name"));

        String sql = merger.buildDeleteSql("rudder_discards", "stg", key);

        assertEquals("DELETE FROM \"rudder\".\"rudder_discards\" USING \"rudder\".\"stg\" AS _source"
                + " WHERE (_source.\"row_id\" = \"rudder\".\"rudder_discards\".\"row_id\""
                + " AND _source.\"column_name\" = \"rudder\".\"rudder_discards\".\"column_name\""
                + " AND _source.\"table_name\" = \"rudder\".\"rudder_discards\".\"table_name\")",
                sql);
    }

    @Test
    void buildInsertSql_正常ケース_既定キーを指定する_最新行のみを挿入するINSERT文となること() {
        String sql = merger.buildInsertSql("tracks", "stg", List.of("id", "received_at", "val"),
                DedupKey.DEFAULT);

        assertEquals("INSERT INTO \"rudder\".\"tracks\" (\"id\", \"received_at\", \"val\")"
                + " SELECT \"id\", \"received_at\", \"val\" FROM (SELECT *, row_number() OVER"
                + " (PARTITION BY \"id\" ORDER BY \"received_at\" DESC)"
                + " AS _rudder_staging_row_number FROM \"rudder\".\"stg\") AS _"
                + " WHERE _rudder_staging_row_number = 1", sql);
    }

    @Test
    void merge_正常ケース_削除と挿入を実行する_順に実行されコミットされること() throws Exception {
        merger.merge(txn, "tracks", "stg", List.of("id", "received_at"), DedupKey.DEFAULT, true);

        InOrder order = inOrder(txExecutor);
        order.verify(txExecutor).execute(startsWith("DELETE FROM"), eq(true));
        order.verify(txExecutor).execute(startsWith("INSERT INTO"), eq(true));
        order.verify(txExecutor).commit();
        verify(txExecutor, never()).rollback();
    }

    @Test
    void merge_異常ケース_削除が失敗する_DELETE_DEDUPで中断しロールバックされること() throws Exception {
        doThrow(new SQLException("deadlock detected")).when(txExecutor)
                .execute(startsWith("DELETE FROM"), anyBoolean());

        LoadTableException e = assertThrows(LoadTableException.class, () -> merger.merge(txn,
                "tracks", "stg", List.of("id"), DedupKey.DEFAULT, false));

        assertEquals(LoadStage.DELETE_DEDUP, e.getStage());
        assertEquals("tracks", e.getTableName());
        verify(txExecutor).rollback();
        verify(txExecutor, never()).execute(startsWith("INSERT INTO"), anyBoolean());
        verify(txExecutor, never()).commit();
    }

    @Test
    void merge_異常ケース_挿入が失敗する_INSERT_DEDUPで中断すること() throws Exception {
        doThrow(new SQLException("value too long")).when(txExecutor)
                .execute(startsWith("INSERT INTO"), anyBoolean());

        LoadTableException e = assertThrows(LoadTableException.class, () -> merger.merge(txn,
                "tracks", "stg", List.of("id"), DedupKey.DEFAULT, false));

        assertEquals(LoadStage.INSERT_DEDUP, e.getStage());
        verify(txExecutor).rollback();
    }

    @Test
    void merge_異常ケース_コミットが失敗する_DEDUP_STAGEで中断すること() throws Exception {
        doThrow(new SQLException("could not serialize access")).when(txExecutor).commit();

        LoadTableException e = assertThrows(LoadTableException.class, () -> merger.merge(txn,
                "tracks", "stg", List.of("id"), DedupKey.DEFAULT, false));

        assertEquals(LoadStage.DEDUP_STAGE, e.getStage());
        verify(txExecutor).rollback();
    }
}
