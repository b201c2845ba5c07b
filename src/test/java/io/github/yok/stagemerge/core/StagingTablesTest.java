package io.github.yok.stagemerge.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import io.github.yok.stagemerge.db.SqlExecutor;
import io.github.yok.stagemerge.db.postgresql.PostgresDialect;
import java.sql.SQLException;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

class StagingTablesTest {

    private final SqlExecutor executor = mock(SqlExecutor.class);

    private final StagingTables stagingTables =
            new StagingTables(executor, new PostgresDialect(), "rudder", 127);

    @Test
    void newName_正常ケース_短いテーブル名を指定する_接頭辞とテーブル名と32桁の接尾辞で構成されること() {
        String name = stagingTables.newName("Tracks");

        assertTrue(name.matches("rudder_staging_tracks_[0-9a-f]{32}"), name);
    }

    @Test
    void newName_正常ケース_同じテーブル名で2回生成する_異なる名前となること() {
        assertNotEquals(stagingTables.newName("tracks"), stagingTables.newName("tracks"));
    }

    @Test
    void newName_正常ケース_長いテーブル名を指定する_上限内に収まり接尾辞が保持されること() {
        String name = stagingTables.newName(StringUtils.repeat("a", 80));

        // 上限は方言の識別子長(63)に丸められる
        assertEquals(63, name.length());
        assertTrue(name.startsWith("rudder_staging_"), name);
        assertTrue(name.matches(".*_[0-9a-f]{32}"), name);
    }

    @Test
    void likePattern_正常ケース_接頭辞を指定する_アンダースコアがエスケープされること() {
        assertEquals("rudder\\_staging\\_%", stagingTables.likePattern());
    }

    @Test
    void drop_正常ケース_DROP文を実行する_trueが返ること() throws Exception {
        assertTrue(stagingTables.drop("rudder_staging_tracks_x"));

        verify(executor).execute("DROP TABLE IF EXISTS \"rudder\".\"rudder_staging_tracks_x\"");
    }

    @Test
    void drop_異常ケース_DROP文が失敗する_例外を送出せずfalseが返ること() throws Exception {
        doThrow(new SQLException("permission denied")).when(executor)
                .execute("DROP TABLE IF EXISTS \"rudder\".\"rudder_staging_tracks_x\"");

        assertFalse(stagingTables.drop("rudder_staging_tracks_x"));
    }
}
