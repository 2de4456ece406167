package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BrainSearchResult {

    /** Ranked best first. */
    List<BrainSearchHit> hits;

    /** Score descending, then cluster id. */
    List<EpisodeHit> episodes;

    /** Sorted by node id. */
    List<GraphNodeView> graphNodes;

    /** Sorted by edge type, then source, then target. */
    List<GraphEdgeView> graphEdges;

    List<RagPassage> passages;
    PromptPack promptPack;
}
