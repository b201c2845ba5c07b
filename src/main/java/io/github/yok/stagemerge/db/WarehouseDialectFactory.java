package io.github.yok.stagemerge.db;

import io.github.yok.stagemerge.config.ConnectionConfig;
import io.github.yok.stagemerge.config.WarehouseProvider;
import io.github.yok.stagemerge.db.postgresql.PostgresDialect;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link WarehouseDialect} according to the configured connection.
 *
 * <p>
 * The provider is resolved from the JDBC driver class when present, otherwise from the JDBC URL
 * scheme. Currently only {@link WarehouseProvider#POSTGRES} is supported.
 * </p>
 */
@Slf4j
@Component
public class WarehouseDialectFactory {

    private static final String POSTGRES_DRIVER = "org.postgresql.Driver";

    private static final String POSTGRES_URL_PREFIX = "jdbc:postgresql:";

    /**
     * Creates the dialect for a connection.
     *
     * @param connection connection settings
     * @return dialect
     * @throws IllegalArgumentException if the provider cannot be resolved
     */
    public WarehouseDialect create(ConnectionConfig connection) {
        WarehouseProvider provider = resolveProvider(connection);
        switch (provider) {
            case POSTGRES:
                return new PostgresDialect();
            default:
                String msg = "Unsupported warehouse provider: " + provider;
                log.error(msg);
                throw new IllegalArgumentException(msg);
        }
    }

    /**
     * Resolves the provider of a connection.
     *
     * @param connection connection settings
     * @return provider
     * @throws IllegalArgumentException if neither the driver class nor the URL is recognized
     */
    public WarehouseProvider resolveProvider(ConnectionConfig connection) {
        String driverClass = connection.getDriverClass();
        if (StringUtils.isNotBlank(driverClass)) {
            if (POSTGRES_DRIVER.equals(driverClass.trim())) {
                return WarehouseProvider.POSTGRES;
            }
            String msg = "Unsupported JDBC driver class: " + driverClass;
            log.error(msg);
            throw new IllegalArgumentException(msg);
        }
        if (StringUtils.startsWithIgnoreCase(connection.getUrl(), POSTGRES_URL_PREFIX)) {
            return WarehouseProvider.POSTGRES;
        }
        String msg = "Cannot resolve warehouse provider from JDBC URL: " + connection.getUrl();
        log.error(msg);
        throw new IllegalArgumentException(msg);
    }
}
