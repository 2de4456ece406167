package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VectorSearchRequest {

    String profileId;
    String queryText;
    int topK;
    String tenantId;

    @Builder.Default
    List<String> projectKeyIn = List.of();

    @Builder.Default
    List<String> profileKindIn = List.of();
}
