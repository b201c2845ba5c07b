package io.github.yok.stagemerge.core;

import io.micrometer.core.instrument.Tags;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.apache.commons.lang3.StringUtils;

/**
 * Telemetry dimensions attached to a load attempt. Not used for correctness.
 */
@Value
@Builder
public class LoadTags {

    String workspaceId;

    String namespace;

    String destinationId;

    String tableName;

    @With
    LoadStage stage;

    /**
     * Converts to Micrometer tags. Missing values are reported as empty strings.
     *
     * @return tags
     */
    public Tags toMicrometerTags() {
        Tags tags = Tags.of("workspaceId", StringUtils.defaultString(workspaceId), "namespace",
                StringUtils.defaultString(namespace), "destinationId",
                StringUtils.defaultString(destinationId), "tableName",
                StringUtils.defaultString(tableName));
        return stage == null ? tags : tags.and("stage", stage.getTag());
    }
}
