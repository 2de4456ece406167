package com.purchasingpower.brain.knowledge;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class VectorIndexEntry {

    public static final String DEFAULT_CHUNK_ID = "chunk-0";

    String nodeId;
    String profileId;

    @Builder.Default
    String chunkId = DEFAULT_CHUNK_ID;

    List<Double> embedding;
    String tenantId;
    String projectKey;
    String profileKind;
    String sourceSystem;

    @Builder.Default
    Map<String, Object> rawMetadata = Map.of();

    public String entryId() {
        return profileId + ":" + nodeId + ":" + chunkId;
    }
}
