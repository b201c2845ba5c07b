package io.github.yok.stagemerge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Identity of the destination the engine loads into.
 *
 * <p>
 * {@code namespace} is the destination schema. {@code sourceId} is the default source of the
 * retention delete. The other identifiers are telemetry dimensions and switches for
 * per-workspace settings.
 * </p>
 */
@Component
@ConfigurationProperties(prefix = "warehouse")
@Data
public class WarehouseProperties {
    // Destination schema
    private String namespace;
    // Workspace owning the destination
    private String workspaceId;
    // Destination identifier
    private String destinationId;
    // Source whose rows the retention delete removes when a request names none
    private String sourceId;
}
