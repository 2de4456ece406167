package com.purchasingpower.brain.cluster;

import java.util.List;

public record ClusterSummary(String clusterNodeId, String clusterKind, List<String> memberNodeIds) {

    public ClusterSummary {
        memberNodeIds = List.copyOf(memberNodeIds);
    }
}
