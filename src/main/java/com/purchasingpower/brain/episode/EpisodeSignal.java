package com.purchasingpower.brain.episode;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EpisodeSignal {

    public static final String DEFAULT_SEVERITY = "INFO";
    public static final String DEFAULT_STATUS = "OPEN";

    String id;
    String severity;
    String status;
    String summary;
    String definitionSlug;
}
