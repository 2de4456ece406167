package com.purchasingpower.brain.cluster;

import com.purchasingpower.brain.core.TimeWindow;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ClusterBuildRequest {

    String tenantId;
    String projectKey;

    @Builder.Default
    TimeWindow window = TimeWindow.UNBOUNDED;

    /** Null uses the configured default; clamped to 1..200. */
    Integer maxSeeds;

    /** Null uses the configured default; never below 2. */
    Integer maxClusterSize;
}
