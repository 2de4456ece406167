package com.purchasingpower.brain.cluster;

import com.purchasingpower.brain.core.TimeWindow;

import java.util.List;

public interface ClusterRead {

    /**
     * Clusters of the project whose timestamp falls inside {@code window}, with sorted member ids.
     */
    List<ClusterSummary> listClustersForProject(String tenantId, String projectKey, TimeWindow window);
}
