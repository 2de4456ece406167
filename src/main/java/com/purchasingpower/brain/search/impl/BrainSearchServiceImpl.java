package com.purchasingpower.brain.search.impl;

import com.purchasingpower.brain.configuration.BrainProperties;
import com.purchasingpower.brain.configuration.SearchProperties;
import com.purchasingpower.brain.core.EntityKind;
import com.purchasingpower.brain.core.EntityProperties;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.exception.BrainValidationException;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.purchasingpower.brain.search.BrainSearchFilter;
import com.purchasingpower.brain.search.BrainSearchHit;
import com.purchasingpower.brain.search.BrainSearchOptions;
import com.purchasingpower.brain.search.BrainSearchRequest;
import com.purchasingpower.brain.search.BrainSearchResult;
import com.purchasingpower.brain.search.BrainSearchService;
import com.purchasingpower.brain.search.EpisodeHit;
import com.purchasingpower.brain.search.GraphEdgeView;
import com.purchasingpower.brain.search.GraphNodeView;
import com.purchasingpower.brain.search.PromptPack;
import com.purchasingpower.brain.search.RagPassage;
import com.purchasingpower.brain.search.VectorSearchGateway;
import com.purchasingpower.brain.search.VectorSearchHit;
import com.purchasingpower.brain.search.VectorSearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Brain search pipeline.
 *
 * <ol>
 *   <li>vector search over the default profiles, merged by best score</li>
 *   <li>hit resolution, dropping missing and secured entities</li>
 *   <li>bounded breadth-first expansion from the hits</li>
 *   <li>episode scoring over the cluster edges found</li>
 *   <li>passage extraction and prompt assembly</li>
 * </ol>
 *
 * @since 2.0.0
 */
@Slf4j
@Service
public class BrainSearchServiceImpl implements BrainSearchService {

    private final VectorSearchGateway vectorSearch;
    private final GraphStore graphStore;
    private final SearchProperties settings;
    private final BoundedGraphExpander expander;
    private final EpisodeScorer episodeScorer = new EpisodeScorer();
    private final PassageExtractor passageExtractor;
    private final PromptPackAssembler promptAssembler = new PromptPackAssembler();

    public BrainSearchServiceImpl(VectorSearchGateway vectorSearch, GraphStore graphStore, BrainProperties properties) {
        this.vectorSearch = vectorSearch;
        this.graphStore = graphStore;
        this.settings = properties.getSearch();
        this.expander = new BoundedGraphExpander(graphStore);
        this.passageExtractor = new PassageExtractor(
                Math.max(1000, settings.getMaxPassageCharacters()),
                Math.max(200, settings.getMaxPassagePerNode()));
    }

    @Override
    public BrainSearchResult search(BrainSearchRequest request) {
        BrainSearchFilter filter = request.getFilter();
        String tenantId = filter == null ? null : EntityProperties.normalize(filter.getTenantId());
        if (tenantId == null) {
            throw new BrainValidationException("tenantId", "tenantId is required for brain search");
        }
        if (filter.enforcesSecured() && EntityProperties.normalize(request.getActorId()) == null) {
            throw new BrainValidationException("actorId",
                    "Brain search requires an authenticated principal when secured filtering is on");
        }

        String requestedProject = EntityProperties.normalize(filter.getProjectKey());
        TenantScope scope = TenantScope.of(tenantId,
                requestedProject != null ? requestedProject : settings.getDefaultProjectKey());
        BrainSearchOptions options = request.getOptions() != null ? request.getOptions() : BrainSearchOptions.DEFAULTS;
        boolean enforceSecured = filter.enforcesSecured();
        String queryText = request.getQueryText() == null ? "" : request.getQueryText();

        log.info("🔍 Brain search for {}/{}: '{}'", tenantId, scope.projectId(), queryText);

        List<VectorSearchHit> vectorHits = runVectorSearch(queryText, options.resolvedTopK(), tenantId,
                requestedProject, normalizeList(filter.getProfileKindIn()));

        Map<String, GraphEntity> hitEntities = new LinkedHashMap<>();
        List<BrainSearchHit> hits = new ArrayList<>();
        for (VectorSearchHit vectorHit : vectorHits) {
            Optional<GraphEntity> entity = graphStore.getEntity(vectorHit.getNodeId(), scope)
                    .filter(candidate -> requestedProject == null
                            || candidate.isVisibleIn(tenantId, requestedProject));
            if (entity.isEmpty() || (enforceSecured && entity.get().isSecured())) {
                continue;
            }
            hitEntities.put(entity.get().getId(), entity.get());
            hits.add(toHit(vectorHit, entity.get()));
        }

        BoundedGraphExpander.Expansion expansion = expander.expand(new ArrayList<>(hitEntities.values()),
                BoundedGraphExpander.ExpansionLimits.builder()
                        .scope(scope)
                        .projectKey(requestedProject)
                        .depth(options.resolvedExpandDepth())
                        .maxNodes(options.resolvedMaxNodes())
                        .includeSignals(options.signalsIncluded())
                        .includeClusters(options.clustersIncluded())
                        .enforceSecured(enforceSecured)
                        .build());

        List<EpisodeHit> episodes = options.episodesIncluded()
                ? episodeScorer.score(expansion.edges().values(), hits, expansion.nodes(),
                        scope.projectId(), options.resolvedMaxEpisodes())
                : List.of();

        List<GraphNodeView> graphNodes = expansion.nodes().values().stream()
                .map(BrainSearchServiceImpl::toNodeView)
                .sorted(Comparator.comparing(GraphNodeView::getNodeId))
                .toList();
        List<GraphEdgeView> graphEdges = expansion.edges().values().stream()
                .map(edge -> GraphEdgeView.builder()
                        .edgeType(edge.getEdgeType())
                        .fromNodeId(edge.getSourceEntityId())
                        .toNodeId(edge.getTargetEntityId())
                        .properties(edge.getMetadata())
                        .build())
                .sorted(GraphEdgeView.CANONICAL_ORDER)
                .toList();

        List<RagPassage> passages = passageExtractor.extract(hits, hitEntities);
        PromptPack promptPack = promptAssembler.assemble(queryText, hits, episodes, passages);

        log.info("✅ Brain search done: {} hits, {} episodes, {} nodes, {} edges, {} passages",
                hits.size(), episodes.size(), graphNodes.size(), graphEdges.size(), passages.size());
        return BrainSearchResult.builder()
                .hits(List.copyOf(hits))
                .episodes(episodes)
                .graphNodes(graphNodes)
                .graphEdges(graphEdges)
                .passages(passages)
                .promptPack(promptPack)
                .build();
    }

    /**
     * One vector search per default profile, merged by best score, stable on ties.
     */
    private List<VectorSearchHit> runVectorSearch(String queryText, int topK, String tenantId,
                                                  String projectKey, List<String> profileKinds) {
        Map<String, VectorSearchHit> merged = new LinkedHashMap<>();
        for (var profile : settings.getDefaultProfiles()) {
            List<VectorSearchHit> results = vectorSearch.search(VectorSearchRequest.builder()
                    .profileId(profile.getProfileId())
                    .queryText(queryText)
                    .topK(topK)
                    .tenantId(tenantId)
                    .projectKeyIn(projectKey == null ? List.of() : List.of(projectKey))
                    .profileKindIn(profileKinds)
                    .build());
            for (VectorSearchHit result : results) {
                VectorSearchHit existing = merged.get(result.getNodeId());
                if (existing == null || result.getScore() > existing.getScore()) {
                    merged.put(result.getNodeId(), result);
                }
            }
        }
        List<VectorSearchHit> ranked = new ArrayList<>(merged.values());
        ranked.sort(Comparator.comparingDouble(VectorSearchHit::getScore).reversed());
        return ranked.subList(0, Math.min(topK, ranked.size()));
    }

    private static BrainSearchHit toHit(VectorSearchHit hit, GraphEntity entity) {
        String profileKind = EntityProperties.normalize(hit.getProfileKind());
        if (profileKind == null) {
            profileKind = entity.kind() != EntityKind.OTHER ? entity.kind().getProfileKind() : "unknown";
        }
        String title = entity.props().string("title", "summary")
                .orElseGet(() -> EntityProperties.normalize(entity.getDisplayName()));
        return BrainSearchHit.builder()
                .nodeId(entity.getId())
                .nodeType(entity.getEntityType())
                .profileId(hit.getProfileId())
                .profileKind(profileKind)
                .score(hit.getScore())
                .title(title)
                .url(resolveUrl(entity))
                .build();
    }

    private static GraphNodeView toNodeView(GraphEntity entity) {
        return GraphNodeView.builder()
                .nodeId(entity.getId())
                .nodeType(entity.getEntityType())
                .label(EntityProperties.normalize(entity.getDisplayName()))
                .properties(entity.getProperties())
                .build();
    }

    static String resolveUrl(GraphEntity entity) {
        return entity.props().string("url", "sourceUrl", "canonicalPath")
                .orElseGet(() -> EntityProperties.normalize(entity.getCanonicalPath()));
    }

    private static List<String> normalizeList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .map(EntityProperties::normalize)
                .filter(value -> value != null)
                .toList();
    }
}
