package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.knowledge.EdgeFilter;
import com.purchasingpower.brain.knowledge.EntityFilter;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Heap-backed graph store. Iteration follows insertion order so results are reproducible.
 *
 * @since 2.0.0
 */
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private final Map<String, GraphEntity> entities = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();

    @Override
    public synchronized Optional<GraphEntity> getEntity(String id, TenantScope scope) {
        GraphEntity entity = entities.get(id);
        if (entity == null || !ownedBy(entity.getTenantId(), scope)) {
            return Optional.empty();
        }
        return Optional.of(entity);
    }

    @Override
    public synchronized Optional<String> findOwnerTenant(String id) {
        return Optional.ofNullable(entities.get(id)).map(GraphEntity::getTenantId);
    }

    @Override
    public synchronized List<GraphEntity> listEntities(EntityFilter filter, TenantScope scope) {
        List<GraphEntity> result = new ArrayList<>();
        for (GraphEntity entity : entities.values()) {
            if (ownedBy(entity.getTenantId(), scope) && filter.matches(entity.getEntityType())) {
                result.add(entity);
            }
        }
        return result;
    }

    @Override
    public synchronized List<GraphEdge> listEdges(EdgeFilter filter, TenantScope scope) {
        int limit = filter.getLimit() == null ? Integer.MAX_VALUE : Math.max(0, filter.getLimit());
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : edges.values()) {
            if (result.size() >= limit) {
                break;
            }
            if (ownedBy(edge.getTenantId(), scope) && filter.matches(edge)) {
                result.add(edge);
            }
        }
        return result;
    }

    @Override
    public synchronized void upsertEntity(GraphEntity entity) {
        Preconditions.checkNotNull(entity.getId(), "entity id is required");
        entities.put(entity.getId(), entity);
        log.debug("Upserted entity {} ({})", entity.getId(), entity.getEntityType());
    }

    @Override
    public synchronized void upsertEdge(GraphEdge edge) {
        String key = edge.logicalKey();
        GraphEdge existing = edges.get(key);
        String id = existing != null ? existing.getId() : Objects.requireNonNullElse(edge.getId(), key);
        edges.put(key, edge.toBuilder().id(id).build());
    }

    public synchronized int entityCount() {
        return entities.size();
    }

    public synchronized int edgeCount() {
        return edges.size();
    }

    private static boolean ownedBy(String tenantId, TenantScope scope) {
        return tenantId == null || tenantId.equals(scope.tenantId());
    }
}
