package io.github.yok.stagemerge.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.stagemerge.core.LoadStage;
import io.github.yok.stagemerge.core.LoadTableException;
import io.github.yok.stagemerge.error.JobErrorType;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @AfterEach
    void restore() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    @Test
    void describe_正常ケース_ステージ付きのロード失敗を指定する_分類とテーブルとステージが含まれること() {
        LoadTableException failure = new LoadTableException("tracks", LoadStage.DELETE_DEDUP,
                new SQLException("permission denied for table tracks"));

        assertEquals("Table load failed [PERMISSION] table=tracks stage=dedup_deletion: "
                + "SQLException: permission denied for table tracks",
                ErrorHandler.describe("Table load failed", failure, JobErrorType.PERMISSION));
    }

    @Test
    void describe_正常ケース_ラップされたステージなしのロード失敗を指定する_テーブルのみが含まれること() {
        IllegalStateException wrapper = new IllegalStateException("run failed",
                new LoadTableException("users", null, new UnknownHostException("pg.internal")));

        assertEquals("Fatal error [RESOURCE_NOT_FOUND] table=users: "
                + "UnknownHostException: pg.internal",
                ErrorHandler.describe("Fatal error", wrapper, JobErrorType.RESOURCE_NOT_FOUND));
    }

    @Test
    void describe_正常ケース_ロード以外の失敗を指定する_分類と根本原因のみとなること() {
        SQLException failure = new SQLException("FATAL: password authentication failed");

        assertEquals("Fatal error [PERMISSION]: SQLException: FATAL: password authentication "
                + "failed", ErrorHandler.describe("Fatal error", failure, JobErrorType.PERMISSION));
    }

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_報告内容でIllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        LoadTableException cause = new LoadTableException("identifies",
                LoadStage.CSV_COLUMN_COUNT_MISMATCH, new SQLException("column mismatch"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ErrorHandler.errorAndExit("Fatal error", cause, JobErrorType.UNKNOWN));

        assertEquals("Fatal error [UNKNOWN] table=identifies stage=csv_column_count_mismatch: "
                + "SQLException: column mismatch", ex.getMessage());
        assertSame(cause, ex.getCause());

        IllegalStateException summary = assertThrows(IllegalStateException.class,
                () -> ErrorHandler.errorAndExit("Load failed for tables [tracks]"));
        assertEquals("Load failed for tables [tracks]", summary.getMessage());
    }

    @Test
    void errorAndExit_正常ケース_exit有効を指定する_報告が標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            ErrorHandler.errorAndExit("Fatal error",
                    new IllegalStateException("wrapper", new SQLException("connection refused")),
                    JobErrorType.PERMISSION);
            ErrorHandler.errorAndExit("Load failed for tables [pages]");
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString(StandardCharsets.UTF_8);
        assertTrue(message.contains("ERROR: Fatal error [PERMISSION]: SQLException: connection "
                + "refused"), "分類と根本原因が出力されること");
        assertTrue(message.contains("ERROR: Load failed for tables [pages]"),
                "集約メッセージが出力されること");
    }
}
