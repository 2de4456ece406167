package com.purchasingpower.brain.cluster.impl;

import com.purchasingpower.brain.cluster.ClusterBuildRequest;
import com.purchasingpower.brain.cluster.ClusterBuildResult;
import com.purchasingpower.brain.cluster.ClusterBuilder;
import com.purchasingpower.brain.cluster.ClusterIdentity;
import com.purchasingpower.brain.cluster.ClusterRunLock;
import com.purchasingpower.brain.configuration.BrainProperties;
import com.purchasingpower.brain.configuration.ClusterProperties;
import com.purchasingpower.brain.core.EntityKind;
import com.purchasingpower.brain.core.EntityProperties;
import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.core.TimeWindow;
import com.purchasingpower.brain.exception.BrainValidationException;
import com.purchasingpower.brain.knowledge.EntityFilter;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.purchasingpower.brain.knowledge.IndexProfile;
import com.purchasingpower.brain.knowledge.ProfileRegistry;
import com.purchasingpower.brain.search.VectorSearchGateway;
import com.purchasingpower.brain.search.VectorSearchHit;
import com.purchasingpower.brain.search.VectorSearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Vector-neighbour clustering of work and doc entities.
 *
 * <p>Each recent seed pulls in its nearest neighbours above the similarity
 * threshold. Seeds that end up with the same member set share one cluster.
 * Failures to resolve a neighbour only shrink that seed's cluster; they never
 * abort the run.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
public class ClusterBuilderImpl implements ClusterBuilder {

    static final int MAX_SEEDS_LIMIT = 200;

    private static final Map<EntityKind, String[]> QUERY_TEXT_FIELDS = Map.of(
            EntityKind.WORK, new String[]{"summary", "title", "displayName"},
            EntityKind.DOC, new String[]{"body", "title", "text", "displayName"});

    private final GraphStore graphStore;
    private final VectorSearchGateway vectorSearch;
    private final ProfileRegistry profileRegistry;
    private final ClusterRunLock runLock;
    private final ClusterProperties settings;
    private final Clock clock;

    public ClusterBuilderImpl(GraphStore graphStore,
                              VectorSearchGateway vectorSearch,
                              ProfileRegistry profileRegistry,
                              ClusterRunLock runLock,
                              BrainProperties properties,
                              Clock clock) {
        this.graphStore = graphStore;
        this.vectorSearch = vectorSearch;
        this.profileRegistry = profileRegistry;
        this.runLock = runLock;
        this.settings = properties.getCluster();
        this.clock = clock;
    }

    @Override
    public ClusterBuildResult buildClustersForProject(ClusterBuildRequest request) {
        if (request.getTenantId() == null || request.getTenantId().isBlank()) {
            throw new BrainValidationException("tenantId", "tenantId is required to build clusters");
        }
        if (request.getProjectKey() == null || request.getProjectKey().isBlank()) {
            throw new BrainValidationException("projectKey", "projectKey is required to build clusters");
        }
        return runLock.runExclusive(request.getTenantId(), request.getProjectKey(), () -> build(request));
    }

    private ClusterBuildResult build(ClusterBuildRequest request) {
        TenantScope scope = TenantScope.of(request.getTenantId(), request.getProjectKey());
        TimeWindow window = request.getWindow() == null ? TimeWindow.UNBOUNDED : request.getWindow();
        int maxSeeds = clamp(request.getMaxSeeds(), settings.getDefaultMaxSeeds(), 1, MAX_SEEDS_LIMIT);
        int maxClusterSize = Math.max(2, Optional.ofNullable(request.getMaxClusterSize())
                .orElse(settings.getDefaultMaxClusterSize()));

        List<GraphEntity> seeds = loadSeeds(scope, window, maxSeeds);
        log.info("🧩 Building clusters for {}/{}: {} seeds, max size {}",
                scope.tenantId(), scope.projectId(), seeds.size(), maxClusterSize);

        Map<String, GraphEntity> resolved = new HashMap<>();
        seeds.forEach(seed -> resolved.put(seed.getId(), seed));
        Map<String, ClusterDraft> drafts = new LinkedHashMap<>();

        for (GraphEntity seed : seeds) {
            SeedExpansion expansion = expandSeed(seed, scope, maxClusterSize, resolved);
            if (expansion.members().size() < 2) {
                log.debug("Seed {} found no neighbours above threshold", seed.getId());
                continue;
            }
            String key = ClusterIdentity.key(scope.tenantId(), scope.projectId(), window, expansion.members());
            ClusterDraft existing = drafts.get(key);
            if (existing != null) {
                existing.merge(seed.getId(), expansion);
            } else {
                drafts.put(key, new ClusterDraft(ClusterIdentity.clusterId(key), seed.getId(), expansion));
            }
        }

        int clustersCreated = 0;
        int membersLinked = 0;
        for (ClusterDraft draft : drafts.values()) {
            Optional<GraphEntity> previous = graphStore.getEntity(draft.clusterId, scope);
            if (previous.isEmpty()) {
                clustersCreated++;
            }
            graphStore.upsertEntity(toClusterEntity(draft, scope, window, previous.orElse(null)));
            for (String memberId : draft.members) {
                graphStore.upsertEdge(GraphEdge.builder()
                        .edgeType(GraphEdge.IN_CLUSTER)
                        .sourceEntityId(memberId)
                        .targetEntityId(draft.clusterId)
                        .tenantId(scope.tenantId())
                        .projectId(scope.projectId())
                        .build());
                membersLinked++;
            }
        }

        log.info("✅ Cluster build for {}/{} done: {} drafts, {} created, {} members linked",
                scope.tenantId(), scope.projectId(), drafts.size(), clustersCreated, membersLinked);
        return new ClusterBuildResult(clustersCreated, membersLinked);
    }

    private List<GraphEntity> loadSeeds(TenantScope scope, TimeWindow window, int maxSeeds) {
        EntityFilter filter = EntityFilter.ofTypes(EntityKind.WORK.getEntityType(), EntityKind.DOC.getEntityType());
        return graphStore.listEntities(filter, scope).stream()
                .filter(entity -> entity.belongsToProject(scope.projectId()))
                .filter(entity -> entity.isWithin(window))
                .sorted(GraphEntity.NEWEST_FIRST)
                .limit(maxSeeds)
                .toList();
    }

    private SeedExpansion expandSeed(GraphEntity seed, TenantScope scope, int maxClusterSize,
                                     Map<String, GraphEntity> resolved) {
        SortedSet<String> members = new TreeSet<>();
        members.add(seed.getId());
        Optional<IndexProfile> profile = profileRegistry.profileFor(seed.kind());
        if (profile.isEmpty()) {
            log.debug("No index profile for seed {} ({})", seed.getId(), seed.getEntityType());
            return new SeedExpansion(members, 0);
        }

        int topK = Math.min(settings.getMaxNeighbors(), Math.max(1, maxClusterSize - 1));
        String profileKind = profile.get().getProfileKind();
        List<VectorSearchHit> neighbours = new ArrayList<>(vectorSearch.search(VectorSearchRequest.builder()
                .profileId(profile.get().getId())
                .queryText(queryText(seed))
                .topK(topK)
                .tenantId(scope.tenantId())
                .projectKeyIn(List.of(scope.projectId()))
                .profileKindIn(profileKind == null ? List.of() : List.of(profileKind))
                .build()));
        neighbours.sort(Comparator.comparingDouble(VectorSearchHit::getScore).reversed());

        double topScore = 0;
        for (VectorSearchHit neighbour : neighbours) {
            if (neighbour.getNodeId() == null || neighbour.getNodeId().equals(seed.getId())) {
                continue;
            }
            topScore = Math.max(topScore, neighbour.getScore());
            if (neighbour.getScore() < settings.getScoreThreshold()) {
                continue;
            }
            Optional<GraphEntity> member = resolveMember(neighbour.getNodeId(), scope, resolved);
            if (member.isEmpty()) {
                log.debug("Skipping neighbour {} of {}: missing or out of scope", neighbour.getNodeId(), seed.getId());
                continue;
            }
            members.add(member.get().getId());
            if (members.size() >= maxClusterSize) {
                break;
            }
        }
        return new SeedExpansion(members, topScore);
    }

    private Optional<GraphEntity> resolveMember(String nodeId, TenantScope scope, Map<String, GraphEntity> resolved) {
        GraphEntity cached = resolved.get(nodeId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<GraphEntity> entity = graphStore.getEntity(nodeId, scope)
                .filter(candidate -> candidate.kind().isClusterMember())
                .filter(candidate -> candidate.belongsToProject(scope.projectId()));
        entity.ifPresent(found -> resolved.put(nodeId, found));
        return entity;
    }

    static String queryText(GraphEntity seed) {
        String[] fields = QUERY_TEXT_FIELDS.getOrDefault(seed.kind(), new String[0]);
        return seed.props().string(fields)
                .orElseGet(() -> Optional.ofNullable(EntityProperties.normalize(seed.getDisplayName()))
                        .orElse(seed.getId()));
    }

    private GraphEntity toClusterEntity(ClusterDraft draft, TenantScope scope, TimeWindow window,
                                        GraphEntity previous) {
        Instant now = clock.instant();
        Instant createdAt = Optional.ofNullable(previous)
                .flatMap(existing -> existing.props().instant("createdAt"))
                .orElse(now);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("tenantId", scope.tenantId());
        properties.put("projectKey", scope.projectId());
        properties.put("clusterKind", settings.getClusterKind());
        properties.put("seedNodeIds", List.copyOf(draft.seedNodeIds));
        properties.put("size", draft.members.size());
        properties.put("createdAt", createdAt.toString());
        properties.put("updatedAt", now.toString());
        if (window.start() != null) {
            properties.put("windowStart", window.start().toString());
        }
        if (window.end() != null) {
            properties.put("windowEnd", window.end().toString());
        }
        properties.put("score", draft.score);
        properties.put("algo", settings.getAlgo());

        return GraphEntity.builder()
                .id(draft.clusterId)
                .entityType(EntityKind.CLUSTER.getEntityType())
                .tenantId(scope.tenantId())
                .projectId(scope.projectId())
                .properties(properties)
                .createdAt(createdAt)
                .updatedAt(now)
                .build();
    }

    private static int clamp(Integer value, int fallback, int min, int max) {
        int effective = value == null ? fallback : value;
        return Math.max(min, Math.min(max, effective));
    }

    private record SeedExpansion(SortedSet<String> members, double score) {
    }

    private static final class ClusterDraft {
        private final String clusterId;
        private final SortedSet<String> seedNodeIds = new TreeSet<>();
        private final SortedSet<String> members = new TreeSet<>();
        private double score;

        private ClusterDraft(String clusterId, String seedId, SeedExpansion expansion) {
            this.clusterId = clusterId;
            this.seedNodeIds.add(seedId);
            this.members.addAll(expansion.members());
            this.score = expansion.score();
        }

        private void merge(String seedId, SeedExpansion expansion) {
            seedNodeIds.add(seedId);
            members.addAll(expansion.members());
            score = Math.max(score, expansion.score());
        }
    }
}
