package io.github.yok.stagemerge.core;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Selects rows removed by a retention delete: rows of {@code sourceId} received before
 * {@code startTime} by a job run and task run other than the given ones. A {@code null}
 * {@code sourceId} selects the configured source.
 */
@Value
@Builder
public class DeleteByParams {

    String jobRunId;

    String taskRunId;

    String sourceId;

    Instant startTime;
}
