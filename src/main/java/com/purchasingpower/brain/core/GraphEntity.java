package com.purchasingpower.brain.core;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the shared knowledge graph.
 *
 * <p>The property bag is open; the scope columns ({@code tenantId},
 * {@code projectId}) are what the store indexes on. Several producers write
 * the project under different property names, so project resolution walks a
 * fixed candidate list before falling back to the scope column.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
public class GraphEntity {

    static final String[] PROJECT_KEY_PROPERTIES = {
            "projectKey", "project_key", "project", "sourceProjectKey", "projectId"
    };

    /**
     * Newest first; entities without a timestamp sort last.
     */
    public static final Comparator<GraphEntity> NEWEST_FIRST = Comparator.comparing(
            GraphEntity::resolveTimestamp,
            (left, right) -> {
                if (left.isEmpty() && right.isEmpty()) {
                    return 0;
                }
                if (left.isEmpty()) {
                    return 1;
                }
                if (right.isEmpty()) {
                    return -1;
                }
                return right.get().compareTo(left.get());
            });

    String id;
    String entityType;
    String displayName;
    String canonicalPath;
    String tenantId;
    String projectId;

    @Builder.Default
    Map<String, Object> properties = Map.of();

    Instant createdAt;
    Instant updatedAt;

    public EntityKind kind() {
        return EntityKind.fromEntityType(entityType);
    }

    public EntityProperties props() {
        return EntityProperties.of(properties);
    }

    public Optional<String> resolveTenantId() {
        return props().string("tenantId")
                .or(() -> Optional.ofNullable(EntityProperties.normalize(tenantId)));
    }

    public Optional<String> resolveProjectKey() {
        return props().string(PROJECT_KEY_PROPERTIES)
                .or(() -> Optional.ofNullable(EntityProperties.normalize(projectId)));
    }

    /**
     * Strict membership: the scope column or the first project property must name {@code projectKey}.
     */
    public boolean belongsToProject(String projectKey) {
        if (Objects.equals(EntityProperties.normalize(projectId), projectKey)) {
            return true;
        }
        return props().string(PROJECT_KEY_PROPERTIES)
                .map(candidate -> candidate.equals(projectKey))
                .orElse(false);
    }

    /**
     * Permissive visibility: rejected only when a resolvable tenant or project disagrees.
     */
    public boolean isVisibleIn(String tenantId, String projectKey) {
        Optional<String> entityTenant = resolveTenantId();
        if (entityTenant.isPresent() && !entityTenant.get().equals(tenantId)) {
            return false;
        }
        Optional<String> entityProject = resolveProjectKey();
        return entityProject.isEmpty() || entityProject.get().equals(projectKey);
    }

    public Optional<Instant> resolveTimestamp() {
        EntityProperties props = props();
        return props.instant("updatedAt")
                .or(() -> props.instant("createdAt"))
                .or(() -> Optional.ofNullable(updatedAt))
                .or(() -> Optional.ofNullable(createdAt));
    }

    public boolean isWithin(TimeWindow window) {
        return window == null || window.contains(resolveTimestamp().orElse(null));
    }

    public boolean isSecured() {
        EntityProperties props = props();
        Object secured = props.raw("secured");
        return secured != null ? Boolean.TRUE.equals(secured) : props.flag("isSecured");
    }
}
