package com.purchasingpower.brain.search;

/**
 * Hybrid retrieval: vector search, bounded graph expansion, episode scoring
 * and prompt assembly in one call.
 *
 * <p>The result is a pure function of the query and the stored data. Two
 * identical calls against unchanged data produce byte-identical prompt packs.
 *
 * @since 2.0.0
 */
public interface BrainSearchService {

    /**
     * @throws com.purchasingpower.brain.exception.BrainValidationException when the tenant is
     *         missing, or the actor is missing while secured filtering is on
     */
    BrainSearchResult search(BrainSearchRequest request);
}
