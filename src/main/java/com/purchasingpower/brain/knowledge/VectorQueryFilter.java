package com.purchasingpower.brain.knowledge;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class VectorQueryFilter {

    String tenantId;

    /** Empty means no project restriction. */
    @Builder.Default
    List<String> projectKeyIn = List.of();

    @Builder.Default
    List<String> profileKindIn = List.of();
}
