package com.purchasingpower.brain.episode.impl;

import com.purchasingpower.brain.cluster.ClusterRead;
import com.purchasingpower.brain.cluster.ClusterSummary;
import com.purchasingpower.brain.core.EntityKind;
import com.purchasingpower.brain.core.EntityProperties;
import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.episode.Episode;
import com.purchasingpower.brain.episode.EpisodeConnection;
import com.purchasingpower.brain.episode.EpisodeListRequest;
import com.purchasingpower.brain.episode.EpisodeMember;
import com.purchasingpower.brain.episode.EpisodeReadService;
import com.purchasingpower.brain.episode.EpisodeSignal;
import com.purchasingpower.brain.exception.BrainValidationException;
import com.purchasingpower.brain.exception.ScopeMismatchException;
import com.purchasingpower.brain.knowledge.EdgeFilter;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.purchasingpower.brain.knowledge.SignalDefinition;
import com.purchasingpower.brain.knowledge.SignalInstance;
import com.purchasingpower.brain.knowledge.SignalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hydrates clusters into episodes: typed member summaries plus the signals
 * attached to the members or to the cluster itself.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpisodeReadServiceImpl implements EpisodeReadService {

    static final int MAX_SIGNALS_PER_SOURCE = 200;
    static final int MAX_MEMBERS_PER_CLUSTER = 500;
    static final String UNKNOWN = "unknown";

    private final GraphStore graphStore;
    private final ClusterRead clusterRead;
    private final SignalStore signalStore;
    private final Clock clock;

    @Override
    public EpisodeConnection listEpisodes(EpisodeListRequest request) {
        TenantScope scope = scopeOf(request.getTenantId(), request.getProjectKey());
        List<ClusterSummary> summaries = clusterRead.listClustersForProject(
                scope.tenantId(), scope.projectId(), request.getWindow());
        if (summaries.isEmpty()) {
            return EpisodeConnection.EMPTY;
        }

        List<ScopedCluster> scoped = new ArrayList<>();
        for (ClusterSummary summary : summaries) {
            Optional<GraphEntity> cluster = graphStore.getEntity(summary.clusterNodeId(), scope);
            if (cluster.isEmpty()) {
                continue;
            }
            if (!cluster.get().isVisibleIn(scope.tenantId(), scope.projectId())) {
                log.debug("Excluding cluster {} from {}/{}: scope mismatch",
                        summary.clusterNodeId(), scope.tenantId(), scope.projectId());
                continue;
            }
            scoped.add(new ScopedCluster(cluster.get(), summary.memberNodeIds()));
        }
        scoped.sort((left, right) -> GraphEntity.NEWEST_FIRST.compare(left.cluster(), right.cluster()));

        int offset = Math.max(0, Optional.ofNullable(request.getOffset()).orElse(0));
        int limit = Math.max(0, Optional.ofNullable(request.getLimit()).orElse(scoped.size()));
        int from = Math.min(offset, scoped.size());
        int to = (int) Math.min((long) from + limit, scoped.size());

        List<Episode> nodes = new ArrayList<>();
        for (ScopedCluster entry : scoped.subList(from, to)) {
            nodes.add(hydrate(entry.cluster(), entry.memberNodeIds(), scope));
        }
        log.debug("Listed {} of {} episodes for {}/{} (actor {})",
                nodes.size(), scoped.size(), scope.tenantId(), scope.projectId(), request.getActorId());
        return EpisodeConnection.builder().nodes(nodes).totalCount(scoped.size()).build();
    }

    @Override
    public Optional<Episode> getEpisode(String tenantId, String projectKey, String id, String actorId) {
        TenantScope scope = scopeOf(tenantId, projectKey);
        Optional<GraphEntity> found = graphStore.getEntity(id, scope);
        if (found.isEmpty()) {
            Optional<String> owner = graphStore.findOwnerTenant(id);
            if (owner.isPresent() && !owner.get().equals(tenantId)) {
                throw scopeMismatch(id, tenantId, projectKey, actorId);
            }
            return Optional.empty();
        }
        Optional<GraphEntity> cluster = found.filter(entity -> entity.kind() == EntityKind.CLUSTER);
        if (cluster.isEmpty()) {
            return Optional.empty();
        }
        if (!cluster.get().isVisibleIn(tenantId, projectKey)) {
            throw scopeMismatch(id, tenantId, projectKey, actorId);
        }
        return Optional.of(hydrate(cluster.get(), loadMemberIds(id, scope), scope));
    }

    private static ScopeMismatchException scopeMismatch(String id, String tenantId, String projectKey, String actorId) {
        log.warn("⚠️  Episode {} requested from {}/{} by {} belongs to another scope",
                id, tenantId, projectKey, actorId);
        return new ScopeMismatchException(id, tenantId, projectKey);
    }

    private List<String> loadMemberIds(String clusterId, TenantScope scope) {
        TreeSet<String> members = new TreeSet<>();
        graphStore.listEdges(EdgeFilter.builder()
                        .edgeType(GraphEdge.IN_CLUSTER)
                        .targetEntityId(clusterId)
                        .limit(MAX_MEMBERS_PER_CLUSTER)
                        .build(), scope)
                .forEach(edge -> members.add(edge.getSourceEntityId()));
        return new ArrayList<>(members);
    }

    private Episode hydrate(GraphEntity cluster, List<String> memberNodeIds, TenantScope scope) {
        EntityProperties props = cluster.props();
        String projectKey = cluster.resolveProjectKey().orElse(scope.projectId());
        List<EpisodeMember> members = loadMembers(memberNodeIds, scope, projectKey);

        List<String> signalSources = new ArrayList<>(memberNodeIds);
        signalSources.add(cluster.getId());
        List<EpisodeSignal> signals = loadSignals(signalSources, scope);

        Instant createdAt = props.instant("createdAt")
                .or(() -> Optional.ofNullable(cluster.getCreatedAt()))
                .orElseGet(clock::instant);
        Instant updatedAt = props.instant("updatedAt")
                .or(() -> Optional.ofNullable(cluster.getUpdatedAt()))
                .orElse(createdAt);

        return Episode.builder()
                .id(cluster.getId())
                .tenantId(cluster.resolveTenantId().orElse(scope.tenantId()))
                .projectKey(projectKey)
                .clusterKind(props.string("clusterKind").orElse(UNKNOWN))
                .size(props.number("size").map(Double::intValue).orElse(members.size()))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .windowStart(props.instant("windowStart").orElse(null))
                .windowEnd(props.instant("windowEnd").orElse(null))
                .summary(props.string("summary").orElseGet(() -> EntityProperties.normalize(cluster.getDisplayName())))
                .members(members)
                .signals(signals)
                .build();
    }

    private List<EpisodeMember> loadMembers(List<String> memberIds, TenantScope scope, String projectKey) {
        List<EpisodeMember> members = new ArrayList<>();
        for (String memberId : memberIds) {
            Optional<GraphEntity> entity = graphStore.getEntity(memberId, scope)
                    .filter(candidate -> candidate.isVisibleIn(scope.tenantId(), projectKey));
            if (entity.isEmpty()) {
                log.debug("Skipping member {}: missing or out of scope", memberId);
                continue;
            }
            members.add(toMember(entity.get(), projectKey));
        }
        return members;
    }

    static EpisodeMember toMember(GraphEntity entity, String fallbackProjectKey) {
        EntityProperties props = entity.props();
        EntityKind kind = entity.kind();
        String canonicalPath = EntityProperties.normalize(entity.getCanonicalPath());
        String workKey = kind == EntityKind.WORK
                ? props.string("sourceIssueKey", "workKey", "canonicalPath").orElse(canonicalPath)
                : null;
        String docUrl = kind == EntityKind.DOC
                ? props.string("sourceUrl", "url", "canonicalPath").orElse(canonicalPath)
                : null;
        String displayName = EntityProperties.normalize(entity.getDisplayName());

        String title = props.string("title", "displayName")
                .orElseGet(() -> firstNonNull(displayName, workKey, docUrl));
        String summary = props.string("summary", "description").orElse(displayName);

        return EpisodeMember.builder()
                .nodeId(entity.getId())
                .nodeType(entity.getEntityType())
                .entityKind(props.string("entityKind").orElse(entity.getEntityType()))
                .cdmModelId(props.string("cdmModelId", "modelId").orElse(null))
                .title(title)
                .summary(summary)
                .projectKey(entity.resolveProjectKey().orElse(fallbackProjectKey))
                .workKey(workKey)
                .docUrl(docUrl)
                .build();
    }

    private List<EpisodeSignal> loadSignals(List<String> sourceIds, TenantScope scope) {
        Set<String> signalIds = new LinkedHashSet<>();
        for (String sourceId : sourceIds) {
            graphStore.listEdges(EdgeFilter.builder()
                            .edgeType(GraphEdge.HAS_SIGNAL)
                            .sourceEntityId(sourceId)
                            .limit(MAX_SIGNALS_PER_SOURCE)
                            .build(), scope)
                    .forEach(edge -> signalIds.add(edge.getTargetEntityId()));
        }
        if (signalIds.isEmpty()) {
            return List.of();
        }

        Map<String, Optional<String>> slugsByDefinition = new HashMap<>();
        List<EpisodeSignal> signals = new ArrayList<>(signalIds.size());
        for (String signalId : signalIds) {
            Optional<SignalInstance> instance = signalStore.getInstance(signalId);
            Optional<GraphEntity> node = graphStore.getEntity(signalId, scope);
            EntityProperties nodeProps = node.map(GraphEntity::props).orElse(EntityProperties.of(null));

            String definitionId = instance.map(SignalInstance::getDefinitionId)
                    .map(EntityProperties::normalize)
                    .or(() -> nodeProps.string("definitionId"))
                    .orElse(null);
            String slug = instance.map(SignalInstance::getDefinition)
                    .map(SignalDefinition::getSlug)
                    .map(EntityProperties::normalize)
                    .orElse(null);
            if (slug == null && definitionId != null) {
                slug = slugsByDefinition.computeIfAbsent(definitionId, defId -> signalStore.getDefinition(defId)
                                .map(SignalDefinition::getSlug)
                                .map(EntityProperties::normalize))
                        .orElse(null);
            }

            signals.add(EpisodeSignal.builder()
                    .id(instance.map(SignalInstance::getId).or(() -> node.map(GraphEntity::getId)).orElse(signalId))
                    .severity(instance.map(SignalInstance::getSeverity).map(EntityProperties::normalize)
                            .or(() -> nodeProps.string("severity"))
                            .orElse(EpisodeSignal.DEFAULT_SEVERITY))
                    .status(instance.map(SignalInstance::getStatus).map(EntityProperties::normalize)
                            .or(() -> nodeProps.string("status"))
                            .orElse(EpisodeSignal.DEFAULT_STATUS))
                    .summary(instance.map(SignalInstance::getSummary).map(EntityProperties::normalize)
                            .or(() -> nodeProps.string("summary"))
                            .or(() -> node.map(GraphEntity::getDisplayName).map(EntityProperties::normalize))
                            .orElse(signalId))
                    .definitionSlug(slug != null ? slug : definitionId != null ? definitionId : UNKNOWN)
                    .build());
        }
        return signals;
    }

    private static TenantScope scopeOf(String tenantId, String projectKey) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new BrainValidationException("tenantId", "tenantId is required to read episodes");
        }
        if (projectKey == null || projectKey.isBlank()) {
            throw new BrainValidationException("projectKey", "projectKey is required to read episodes");
        }
        return TenantScope.of(tenantId, projectKey);
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private record ScopedCluster(GraphEntity cluster, List<String> memberNodeIds) {
    }
}
