package com.purchasingpower.brain.search.impl;

import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.knowledge.EdgeFilter;
import com.purchasingpower.brain.knowledge.GraphStore;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Breadth-first neighbourhood of the search hits, bounded by depth and node count.
 *
 * <p>Expansion stops as soon as {@code maxNodes} entities are admitted. An
 * edge is kept only when both of its ends are admitted, so the returned
 * subgraph never references an entity the caller may not see.
 */
@Slf4j
@RequiredArgsConstructor
class BoundedGraphExpander {

    static final int MIN_EDGE_FETCH = 10;
    static final int MAX_EDGE_FETCH = 500;

    private final GraphStore graphStore;

    Expansion expand(List<GraphEntity> seeds, ExpansionLimits limits) {
        Map<String, GraphEntity> nodes = new LinkedHashMap<>();
        Map<String, GraphEdge> edges = new LinkedHashMap<>();
        Queue<String> queue = new LinkedList<>();
        Map<String, Integer> depths = new HashMap<>();

        for (GraphEntity seed : seeds) {
            if (nodes.size() >= limits.getMaxNodes()) {
                break;
            }
            if (nodes.putIfAbsent(seed.getId(), seed) == null) {
                queue.add(seed.getId());
                depths.put(seed.getId(), 0);
            }
        }

        while (!queue.isEmpty() && nodes.size() < limits.getMaxNodes()) {
            String current = queue.poll();
            int currentDepth = depths.get(current);
            if (currentDepth >= limits.getDepth()) {
                continue;
            }
            for (GraphEdge edge : collectEdges(current, limits.getScope(), limits.getMaxNodes() - nodes.size())) {
                if (!limits.isIncludeSignals() && GraphEdge.HAS_SIGNAL.equals(edge.getEdgeType())) {
                    continue;
                }
                if (!limits.isIncludeClusters() && GraphEdge.IN_CLUSTER.equals(edge.getEdgeType())) {
                    continue;
                }
                String neighbour = edge.otherEnd(current);
                if (!nodes.containsKey(neighbour)) {
                    if (nodes.size() >= limits.getMaxNodes() || !admit(neighbour, limits, nodes)) {
                        continue;
                    }
                    queue.add(neighbour);
                    depths.put(neighbour, currentDepth + 1);
                }
                edges.putIfAbsent(edge.getId(), edge);
            }
        }

        log.debug("Expanded {} seeds to {} nodes and {} edges (depth {}, cap {})",
                seeds.size(), nodes.size(), edges.size(), limits.getDepth(), limits.getMaxNodes());
        return new Expansion(nodes, edges);
    }

    private boolean admit(String entityId, ExpansionLimits limits, Map<String, GraphEntity> nodes) {
        GraphEntity entity = graphStore.getEntity(entityId, limits.getScope()).orElse(null);
        if (entity == null || !limits.isVisible(entity)) {
            return false;
        }
        if (limits.isEnforceSecured() && entity.isSecured()) {
            log.debug("Not expanding into secured entity {}", entityId);
            return false;
        }
        nodes.put(entityId, entity);
        return true;
    }

    /**
     * Outbound then inbound edges of one entity, deduplicated by id.
     */
    private List<GraphEdge> collectEdges(String entityId, TenantScope scope, int remainingNodes) {
        int limit = Math.max(MIN_EDGE_FETCH, Math.min(remainingNodes * 4, MAX_EDGE_FETCH));
        Map<String, GraphEdge> unique = new LinkedHashMap<>();
        for (GraphEdge edge : graphStore.listEdges(EdgeFilter.builder().sourceEntityId(entityId).limit(limit).build(), scope)) {
            unique.putIfAbsent(edge.getId(), edge);
        }
        for (GraphEdge edge : graphStore.listEdges(EdgeFilter.builder().targetEntityId(entityId).limit(limit).build(), scope)) {
            unique.putIfAbsent(edge.getId(), edge);
        }
        return new ArrayList<>(unique.values());
    }

    @Value
    @Builder
    static class ExpansionLimits {
        TenantScope scope;

        /** Null when the search is not restricted to a project. */
        String projectKey;

        int depth;
        int maxNodes;
        boolean includeSignals;
        boolean includeClusters;
        boolean enforceSecured;

        boolean isVisible(GraphEntity entity) {
            if (projectKey != null) {
                return entity.isVisibleIn(scope.tenantId(), projectKey);
            }
            return entity.resolveTenantId().map(scope.tenantId()::equals).orElse(true);
        }
    }

    record Expansion(Map<String, GraphEntity> nodes, Map<String, GraphEdge> edges) {
    }
}
