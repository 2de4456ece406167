package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BrainSearchHit {
    String nodeId;
    String nodeType;
    String profileId;
    String profileKind;
    double score;
    String title;
    String url;
}
