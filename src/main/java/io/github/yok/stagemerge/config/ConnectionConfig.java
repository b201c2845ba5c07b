package io.github.yok.stagemerge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the JDBC connection of the destination warehouse.
 *
 * <pre>
 * warehouse:
 *   connection:
 *     url: jdbc:postgresql://localhost:5432/warehouse
 *     user: rudder
 *     password: password
 *     driver-class: org.postgresql.Driver
 *     maximum-pool-size: 4
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "warehouse.connection")
@Data
public class ConnectionConfig {
    // JDBC connection URL (e.g., jdbc:postgresql://localhost:5432/warehouse)
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name (e.g., org.postgresql.Driver)
    private String driverClass;
    // Upper bound of pooled connections; abandoned rollbacks may hold one each until they finish
    private int maximumPoolSize = 4;
}
