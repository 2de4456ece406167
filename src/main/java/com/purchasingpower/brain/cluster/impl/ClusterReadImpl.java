package com.purchasingpower.brain.cluster.impl;

import com.purchasingpower.brain.cluster.ClusterRead;
import com.purchasingpower.brain.cluster.ClusterSummary;
import com.purchasingpower.brain.core.EntityKind;
import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.core.TimeWindow;
import com.purchasingpower.brain.knowledge.EdgeFilter;
import com.purchasingpower.brain.knowledge.EntityFilter;
import com.purchasingpower.brain.knowledge.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterReadImpl implements ClusterRead {

    static final String UNKNOWN_KIND = "unknown";

    private final GraphStore graphStore;

    @Override
    public List<ClusterSummary> listClustersForProject(String tenantId, String projectKey, TimeWindow window) {
        TenantScope scope = TenantScope.of(tenantId, projectKey);
        List<ClusterSummary> summaries = new ArrayList<>();
        for (GraphEntity cluster : graphStore.listEntities(EntityFilter.ofTypes(EntityKind.CLUSTER.getEntityType()), scope)) {
            if (!cluster.belongsToProject(projectKey) || !cluster.isWithin(window)) {
                continue;
            }
            List<GraphEdge> edges = graphStore.listEdges(EdgeFilter.builder()
                    .edgeType(GraphEdge.IN_CLUSTER)
                    .targetEntityId(cluster.getId())
                    .build(), scope);
            TreeSet<String> members = new TreeSet<>();
            edges.forEach(edge -> members.add(edge.getSourceEntityId()));
            summaries.add(new ClusterSummary(
                    cluster.getId(),
                    cluster.props().string("clusterKind").orElse(UNKNOWN_KIND),
                    new ArrayList<>(members)));
        }
        log.debug("Listed {} clusters for {}/{}", summaries.size(), tenantId, projectKey);
        return summaries;
    }
}
