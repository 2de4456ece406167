package com.purchasingpower.brain.knowledge;

import com.purchasingpower.brain.core.TenantScope;

import java.util.List;

/**
 * Embeds graph entities of one profile into the vector index.
 *
 * @since 2.0.0
 */
public interface NodeIndexer {

    int DEFAULT_BATCH_SIZE = 25;

    /**
     * @param nodeIds optional restriction; null or empty indexes every entity of the profile's type
     * @return number of entries written
     */
    int indexNodesForProfile(String profileId, TenantScope scope, List<String> nodeIds, Integer batchSize);
}
