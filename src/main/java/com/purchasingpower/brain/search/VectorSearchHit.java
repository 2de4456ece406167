package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class VectorSearchHit {
    String nodeId;
    double score;
    String profileId;
    String profileKind;
    String projectKey;
    String sourceSystem;
    String tenantId;
}
