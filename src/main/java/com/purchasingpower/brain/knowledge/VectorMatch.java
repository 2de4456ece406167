package com.purchasingpower.brain.knowledge;

import java.util.Map;

/**
 * One nearest-neighbour result. Metadata carries profileKind, projectKey,
 * sourceSystem and tenantId when the index stored them.
 */
public record VectorMatch(String nodeId, double score, Map<String, Object> metadata) {

    public VectorMatch {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }
}
