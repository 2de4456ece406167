package com.purchasingpower.brain.knowledge;

import java.util.List;

/**
 * Nearest-neighbour index of entity embeddings, partitioned by profile.
 *
 * @since 2.0.0
 */
public interface VectorIndexStore {

    /**
     * Insert or replace by {@code (nodeId, profileId, chunkId)}.
     */
    void upsertEntries(List<VectorIndexEntry> entries);

    /**
     * Closest entries of one profile, best first. Higher score means more similar.
     */
    List<VectorMatch> query(String profileId, List<Double> embedding, int topK, VectorQueryFilter filter);
}
