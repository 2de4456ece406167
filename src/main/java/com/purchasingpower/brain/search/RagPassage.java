package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RagPassage {
    String sourceNodeId;
    String sourceKind;
    String text;
    String url;
}
