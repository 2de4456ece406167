package com.purchasingpower.brain.search.impl;

import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.search.BrainSearchHit;
import com.purchasingpower.brain.search.EpisodeHit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.purchasingpower.brain.support.BrainFixtures.edge;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Episode Scorer Tests")
class EpisodeScorerTest {

    private final EpisodeScorer scorer = new EpisodeScorer();

    private static BrainSearchHit hit(String nodeId, double score) {
        return BrainSearchHit.builder().nodeId(nodeId).score(score).build();
    }

    @Test
    @DisplayName("Equal scores rank by cluster id and the cap applies")
    void ranksAndCaps() {
        // Given
        List<GraphEdge> edges = List.of(
                edge(GraphEdge.IN_CLUSTER, "a", "cluster:b"),
                edge(GraphEdge.IN_CLUSTER, "a", "cluster:a"),
                edge(GraphEdge.IN_CLUSTER, "c", "cluster:c"),
                edge(GraphEdge.HAS_SIGNAL, "a", "sig-1"));

        // When
        List<EpisodeHit> episodes = scorer.score(edges, List.of(hit("a", 0.5), hit("c", 0.9)), Map.of(), "global", 2);

        // Then
        assertEquals(List.of("cluster:c", "cluster:a"), episodes.stream().map(EpisodeHit::getClusterNodeId).toList());
        assertEquals("unknown", episodes.get(0).getClusterKind());
        assertEquals("global", episodes.get(0).getProjectKey());
        assertEquals(1, episodes.get(0).getSize());
    }

    @Test
    @DisplayName("Clusters without member hits are dropped")
    void dropsZeroScores() {
        List<EpisodeHit> episodes = scorer.score(
                List.of(edge(GraphEdge.IN_CLUSTER, "x", "cluster:x")), List.of(hit("a", 0.5)), Map.of(), "global", 10);

        assertTrue(episodes.isEmpty());
    }

    @Test
    @DisplayName("Zero episode cap returns nothing")
    void zeroCap() {
        List<EpisodeHit> episodes = scorer.score(
                List.of(edge(GraphEdge.IN_CLUSTER, "a", "cluster:a")), List.of(hit("a", 0.5)), Map.of(), "global", 0);

        assertTrue(episodes.isEmpty());
    }
}
