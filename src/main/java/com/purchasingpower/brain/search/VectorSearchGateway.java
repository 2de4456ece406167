package com.purchasingpower.brain.search;

import java.util.List;

/**
 * Nearest-neighbour search over one or more index profiles.
 *
 * @since 2.0.0
 */
public interface VectorSearchGateway {

    /**
     * Ranked hits for {@code request.queryText}, at most {@code topK}, best first.
     *
     * <p>When {@code profileKindIn} is given, every profile of those kinds is
     * searched alongside the requested one. A node found by several profiles
     * keeps its highest score.
     *
     * @throws com.purchasingpower.brain.exception.ProfileNotFoundException if the profile is unknown
     */
    List<VectorSearchHit> search(VectorSearchRequest request);
}
