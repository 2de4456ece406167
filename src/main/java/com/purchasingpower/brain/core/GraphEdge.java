package com.purchasingpower.brain.core;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Directed, typed relationship between two entities.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
public class GraphEdge {

    /** Member entity to cluster. */
    public static final String IN_CLUSTER = "IN_CLUSTER";

    /** Entity to signal instance. */
    public static final String HAS_SIGNAL = "HAS_SIGNAL";

    String id;
    String edgeType;
    String sourceEntityId;
    String targetEntityId;
    String tenantId;
    String projectId;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    /**
     * Idempotency key for upserts: {@code type|source|target}.
     */
    public String logicalKey() {
        return logicalKey(edgeType, sourceEntityId, targetEntityId);
    }

    public static String logicalKey(String edgeType, String sourceEntityId, String targetEntityId) {
        return edgeType + "|" + sourceEntityId + "|" + targetEntityId;
    }

    /**
     * The endpoint on the other side of {@code entityId}.
     */
    public String otherEnd(String entityId) {
        return sourceEntityId.equals(entityId) ? targetEntityId : sourceEntityId;
    }
}
