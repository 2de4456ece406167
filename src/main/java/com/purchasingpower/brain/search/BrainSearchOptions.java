package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

/**
 * Per-request knobs. Nulls take the default; numbers are clamped into range.
 *
 * <ul>
 *   <li>topK 1..200, default 20</li>
 *   <li>maxEpisodes 0..200, default 10</li>
 *   <li>expandDepth 0..3, default 1</li>
 *   <li>maxNodes 1..1000, default 200</li>
 * </ul>
 */
@Value
@Builder
public class BrainSearchOptions {

    public static final BrainSearchOptions DEFAULTS = BrainSearchOptions.builder().build();

    Integer topK;
    Integer maxEpisodes;
    Integer expandDepth;
    Integer maxNodes;
    Boolean includeEpisodes;
    Boolean includeSignals;
    Boolean includeClusters;

    public int resolvedTopK() {
        return clamp(topK, 1, 200, 20);
    }

    public int resolvedMaxEpisodes() {
        return clamp(maxEpisodes, 0, 200, 10);
    }

    public int resolvedExpandDepth() {
        return clamp(expandDepth, 0, 3, 1);
    }

    public int resolvedMaxNodes() {
        return clamp(maxNodes, 1, 1000, 200);
    }

    public boolean episodesIncluded() {
        return !Boolean.FALSE.equals(includeEpisodes);
    }

    public boolean signalsIncluded() {
        return !Boolean.FALSE.equals(includeSignals);
    }

    /**
     * Episodes are built from cluster edges, so asking for episodes brings clusters along.
     */
    public boolean clustersIncluded() {
        return !Boolean.FALSE.equals(includeClusters) || episodesIncluded();
    }

    private static int clamp(Integer value, int min, int max, int fallback) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }
}
