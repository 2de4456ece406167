package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class GraphNodeView {
    String nodeId;
    String nodeType;
    String label;
    Map<String, Object> properties;
}
