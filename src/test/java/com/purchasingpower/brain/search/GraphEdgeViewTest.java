package com.purchasingpower.brain.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphEdgeViewTest {

    private static GraphEdgeView edge(String type, String from, String to) {
        return GraphEdgeView.builder().edgeType(type).fromNodeId(from).toNodeId(to).build();
    }

    @Test
    @DisplayName("Should order by type, then source, then target, with untyped edges first")
    void canonicalOrderToleratesMissingType() {
        // Given
        List<GraphEdgeView> edges = new ArrayList<>(List.of(
                edge("IN_CLUSTER", "b", "c"),
                edge("HAS_SIGNAL", "a", "s"),
                edge(null, "z", "y"),
                edge("IN_CLUSTER", "a", "d"),
                edge("IN_CLUSTER", "a", "c")));

        // When
        edges.sort(GraphEdgeView.CANONICAL_ORDER);

        // Then
        assertEquals(List.of("null:z>y", "HAS_SIGNAL:a>s", "IN_CLUSTER:a>c", "IN_CLUSTER:a>d", "IN_CLUSTER:b>c"),
                edges.stream().map(e -> e.getEdgeType() + ":" + e.getFromNodeId() + ">" + e.getToNodeId()).toList());
    }
}
