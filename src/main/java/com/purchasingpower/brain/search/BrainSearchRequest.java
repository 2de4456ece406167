package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BrainSearchRequest {

    String queryText;
    BrainSearchFilter filter;

    @Builder.Default
    BrainSearchOptions options = BrainSearchOptions.DEFAULTS;

    /** Authenticated principal; required unless {@code filter.secured} is false. */
    String actorId;
}
