package io.github.yok.stagemerge.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.stagemerge.core.PostgresWarehouse;
import io.github.yok.stagemerge.core.RollbackSupervisor;
import io.github.yok.stagemerge.db.WarehouseDialect;
import io.github.yok.stagemerge.db.WarehouseDialectFactory;
import io.github.yok.stagemerge.error.ErrorClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bean wiring of the load engine.
 */
@Slf4j
@Configuration
public class StageMergeConfiguration {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Creates the connection pool of the destination warehouse.
     *
     * @param connection connection settings
     * @return pooled data source
     */
    @Bean(destroyMethod = "close")
    public HikariDataSource warehouseDataSource(ConnectionConfig connection) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(connection.getUrl());
        hikariConfig.setUsername(connection.getUser());
        hikariConfig.setPassword(connection.getPassword());
        if (StringUtils.isNotBlank(connection.getDriverClass())) {
            hikariConfig.setDriverClassName(connection.getDriverClass());
        }
        hikariConfig.setMaximumPoolSize(connection.getMaximumPoolSize());
        hikariConfig.setPoolName("stagemerge-warehouse");
        log.info("Connection pool for {} (max {} connections)", connection.getUrl(),
                connection.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }

    @Bean
    public WarehouseDialect warehouseDialect(WarehouseDialectFactory factory,
            ConnectionConfig connection) {
        return factory.create(connection);
    }

    @Bean(destroyMethod = "close")
    public RollbackSupervisor rollbackSupervisor(MeterRegistry meterRegistry) {
        return new RollbackSupervisor(meterRegistry);
    }

    @Bean
    public ErrorClassifier errorClassifier(WarehouseDialect dialect) {
        return new ErrorClassifier(dialect.getErrorMappings());
    }

    @Bean
    public PostgresWarehouse postgresWarehouse(DataSource warehouseDataSource,
            WarehouseDialect dialect, RollbackSupervisor rollbackSupervisor,
            WarehouseProperties warehouse, PostgresLoadProperties properties,
            DedupKeyConfig dedupKeys, MeterRegistry meterRegistry) {
        return new PostgresWarehouse(warehouseDataSource, dialect, rollbackSupervisor, warehouse,
                properties, dedupKeys, meterRegistry);
    }
}
