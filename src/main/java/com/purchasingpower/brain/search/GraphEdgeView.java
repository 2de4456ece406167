package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.Map;

@Value
@Builder
public class GraphEdgeView {

    public static final Comparator<GraphEdgeView> CANONICAL_ORDER = Comparator
            .comparing(GraphEdgeView::getEdgeType, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(GraphEdgeView::getFromNodeId, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(GraphEdgeView::getToNodeId, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    String edgeType;
    String fromNodeId;
    String toNodeId;
    Map<String, Object> properties;
}
