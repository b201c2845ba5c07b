package io.github.yok.stagemerge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.stagemerge.db.ExecutorSettings;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class PostgresLoadPropertiesTest {

    @Test
    void isSkipComputingUserLatestTraitsFor_正常ケース_既定値を使用する_falseが返ること() {
        PostgresLoadProperties properties = new PostgresLoadProperties();

        assertFalse(properties.isSkipComputingUserLatestTraitsFor("ws-1"));
        assertFalse(properties.isExecutionPlanEnabledFor("ws-1"));
    }

    @Test
    void isSkipComputingUserLatestTraitsFor_正常ケース_ワークスペース指定のみ_該当ワークスペースのみtrueとなること() {
        PostgresLoadProperties properties = new PostgresLoadProperties();
        properties.setSkipComputingUserLatestTraitsWorkspaceIds(List.of("ws-1"));
        properties.setEnableSqlStatementExecutionPlanWorkspaceIds(List.of("ws-2"));

        assertTrue(properties.isSkipComputingUserLatestTraitsFor("ws-1"));
        assertFalse(properties.isSkipComputingUserLatestTraitsFor("ws-2"));
        assertTrue(properties.isExecutionPlanEnabledFor("ws-2"));
        assertFalse(properties.isExecutionPlanEnabledFor("ws-1"));
    }

    @Test
    void isSkipComputingUserLatestTraitsFor_正常ケース_グローバル指定_全ワークスペースでtrueとなること() {
        PostgresLoadProperties properties = new PostgresLoadProperties();
        properties.setSkipComputingUserLatestTraits(true);
        properties.setEnableSqlStatementExecutionPlan(true);

        assertTrue(properties.isSkipComputingUserLatestTraitsFor("any"));
        assertTrue(properties.isExecutionPlanEnabledFor("any"));
    }

    @Test
    void toExecutorSettings_正常ケース_しきい値を指定する_設定値が引き継がれること() {
        PostgresLoadProperties properties = new PostgresLoadProperties();
        properties.setSlowQueryThreshold(Duration.ofSeconds(10));
        properties.setStatementTimeout(Duration.ofMinutes(2));

        ExecutorSettings settings = properties.toExecutorSettings();

        assertEquals(Duration.ofSeconds(10), settings.getSlowQueryThreshold());
        assertEquals(Duration.ofMinutes(2), settings.getStatementTimeout());
        assertEquals(Duration.ofSeconds(30), properties.getTxnRollbackTimeout());
        assertEquals("received_at", properties.getRecencyColumn());
    }
}
