package com.purchasingpower.brain.episode;

import com.purchasingpower.brain.core.TimeWindow;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EpisodeListRequest {

    String tenantId;
    String projectKey;

    @Builder.Default
    TimeWindow window = TimeWindow.UNBOUNDED;

    /** Negative values read as 0. */
    Integer offset;

    /** Null returns every remaining episode. */
    Integer limit;

    String actorId;
}
