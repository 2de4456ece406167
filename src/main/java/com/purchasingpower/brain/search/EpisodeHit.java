package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A cluster reached from the hits. Its score is the sum of the scores of its
 * members that are hits themselves.
 */
@Value
@Builder
public class EpisodeHit {
    String clusterNodeId;
    String clusterKind;
    String projectKey;
    double score;
    int size;
    List<String> memberNodeIds;
}
