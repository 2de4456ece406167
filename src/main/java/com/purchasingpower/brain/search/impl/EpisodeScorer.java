package com.purchasingpower.brain.search.impl;

import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.search.BrainSearchHit;
import com.purchasingpower.brain.search.EpisodeHit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Ranks clusters by how many of the hits they contain, weighted by hit score.
 */
class EpisodeScorer {

    private static final Comparator<EpisodeHit> RANKING = Comparator
            .comparingDouble(EpisodeHit::getScore).reversed()
            .thenComparing(EpisodeHit::getClusterNodeId);

    List<EpisodeHit> score(Collection<GraphEdge> edges,
                           List<BrainSearchHit> hits,
                           Map<String, GraphEntity> nodes,
                           String fallbackProjectKey,
                           int maxEpisodes) {
        Map<String, Double> hitScores = new HashMap<>();
        hits.forEach(hit -> hitScores.put(hit.getNodeId(), hit.getScore()));

        Map<String, TreeSet<String>> membersByCluster = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            if (GraphEdge.IN_CLUSTER.equals(edge.getEdgeType())) {
                membersByCluster.computeIfAbsent(edge.getTargetEntityId(), id -> new TreeSet<>())
                        .add(edge.getSourceEntityId());
            }
        }

        List<EpisodeHit> episodes = new ArrayList<>();
        membersByCluster.forEach((clusterId, members) -> {
            double score = 0;
            for (String member : members) {
                score += hitScores.getOrDefault(member, 0.0);
            }
            if (score <= 0) {
                return;
            }
            Optional<GraphEntity> cluster = Optional.ofNullable(nodes.get(clusterId));
            episodes.add(EpisodeHit.builder()
                    .clusterNodeId(clusterId)
                    .clusterKind(cluster.flatMap(node -> node.props().string("clusterKind")).orElse("unknown"))
                    .projectKey(cluster.flatMap(GraphEntity::resolveProjectKey).orElse(fallbackProjectKey))
                    .score(score)
                    .size(cluster.flatMap(node -> node.props().number("size"))
                            .map(Double::intValue)
                            .orElse(members.size()))
                    .memberNodeIds(List.copyOf(members))
                    .build());
        });

        episodes.sort(RANKING);
        return episodes.size() > maxEpisodes ? List.copyOf(episodes.subList(0, maxEpisodes)) : episodes;
    }
}
