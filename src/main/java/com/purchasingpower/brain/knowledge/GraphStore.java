package com.purchasingpower.brain.knowledge;

import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;

import java.util.List;
import java.util.Optional;

/**
 * Persistent entity/edge graph shared by ingestion and the brain layer.
 *
 * <p>Implementations enforce tenant isolation: nothing owned by another
 * tenant is ever returned. Project filtering is left to callers, because
 * producers disagree on where the project key lives.
 *
 * @since 2.0.0
 */
public interface GraphStore {

    Optional<GraphEntity> getEntity(String id, TenantScope scope);

    /**
     * Tenant that owns entity {@code id}, regardless of the caller's scope.
     * Only the tenant id is exposed, never the entity itself. Empty when the
     * entity is missing or has no owning tenant.
     */
    Optional<String> findOwnerTenant(String id);

    List<GraphEntity> listEntities(EntityFilter filter, TenantScope scope);

    /**
     * Edges matching every non-null criterion of {@code filter}, capped at its limit.
     */
    List<GraphEdge> listEdges(EdgeFilter filter, TenantScope scope);

    /**
     * Insert or replace by entity id.
     */
    void upsertEntity(GraphEntity entity);

    /**
     * Insert or replace by {@link GraphEdge#logicalKey()}.
     */
    void upsertEdge(GraphEdge edge);
}
