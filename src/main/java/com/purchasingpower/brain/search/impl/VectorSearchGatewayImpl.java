package com.purchasingpower.brain.search.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.brain.exception.BrainException;
import com.purchasingpower.brain.exception.EmbeddingDimensionException;
import com.purchasingpower.brain.exception.ProfileNotFoundException;
import com.purchasingpower.brain.knowledge.EmbeddingProvider;
import com.purchasingpower.brain.knowledge.IndexProfile;
import com.purchasingpower.brain.knowledge.IndexProfileStore;
import com.purchasingpower.brain.knowledge.VectorIndexStore;
import com.purchasingpower.brain.knowledge.VectorMatch;
import com.purchasingpower.brain.knowledge.VectorQueryFilter;
import com.purchasingpower.brain.search.VectorSearchGateway;
import com.purchasingpower.brain.search.VectorSearchHit;
import com.purchasingpower.brain.search.VectorSearchRequest;
import com.purchasingpower.brain.util.CallContext;
import com.purchasingpower.brain.util.ExternalCallLogger;
import com.purchasingpower.brain.util.ServiceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fans a query out across index profiles and merges the results.
 *
 * <p>The query is embedded once per distinct embedding model, not once per
 * profile.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorSearchGatewayImpl implements VectorSearchGateway {

    private final IndexProfileStore profileStore;
    private final VectorIndexStore vectorStore;
    private final EmbeddingProvider embeddingProvider;

    @Override
    public List<VectorSearchHit> search(VectorSearchRequest request) {
        Preconditions.checkNotNull(request, "request");
        IndexProfile baseProfile = profileStore.getProfile(request.getProfileId())
                .orElseThrow(() -> new ProfileNotFoundException(request.getProfileId()));
        int topK = Math.max(1, request.getTopK());
        List<IndexProfile> targets = resolveTargets(baseProfile, request.getProfileKindIn());

        VectorQueryFilter filter = VectorQueryFilter.builder()
                .tenantId(request.getTenantId())
                .projectKeyIn(request.getProjectKeyIn())
                .profileKindIn(request.getProfileKindIn())
                .build();

        Map<String, List<Double>> embeddingsByModel = new HashMap<>();
        Map<String, VectorSearchHit> merged = new LinkedHashMap<>();
        for (IndexProfile profile : targets) {
            List<Double> embedding = embeddingsByModel.computeIfAbsent(
                    profile.getEmbeddingModel(), model -> embedQuery(model, request.getQueryText()));
            for (VectorMatch match : vectorStore.query(profile.getId(), embedding, topK, filter)) {
                VectorSearchHit hit = toHit(match, profile);
                VectorSearchHit existing = merged.get(hit.getNodeId());
                if (existing == null || hit.getScore() > existing.getScore()) {
                    merged.put(hit.getNodeId(), hit);
                }
            }
        }

        List<VectorSearchHit> ranked = new ArrayList<>(merged.values());
        ranked.sort(Comparator.comparingDouble(VectorSearchHit::getScore).reversed());
        List<VectorSearchHit> result = ranked.subList(0, Math.min(topK, ranked.size()));
        log.debug("Vector search on {} ({} profiles, {} models) returned {} hits",
                baseProfile.getId(), targets.size(), embeddingsByModel.size(), result.size());
        return List.copyOf(result);
    }

    /**
     * The requested profile first, then every other profile of an allowed kind.
     */
    private List<IndexProfile> resolveTargets(IndexProfile baseProfile, List<String> profileKindIn) {
        List<IndexProfile> targets = new ArrayList<>();
        targets.add(baseProfile);
        if (profileKindIn == null || profileKindIn.isEmpty()) {
            return targets;
        }
        Set<String> allowed = new HashSet<>(profileKindIn);
        for (IndexProfile profile : profileStore.listProfiles()) {
            if (!profile.getId().equals(baseProfile.getId()) && allowed.contains(profile.getProfileKind())) {
                targets.add(profile);
            }
        }
        return targets;
    }

    private List<Double> embedQuery(String model, String queryText) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.EMBEDDING, "EmbedQuery", log);
        ctx.logRequest("Embedding query text",
                "Model", model,
                "Query", ExternalCallLogger.truncate(queryText, 120));
        List<List<Double>> vectors;
        try {
            vectors = embeddingProvider.embedText(model, List.of(queryText == null ? "" : queryText));
        } catch (RuntimeException e) {
            ctx.logError("Query embedding failed", e);
            throw e;
        }
        if (vectors.size() != 1) {
            throw new BrainException("Embedding provider returned " + vectors.size() + " vectors for one query");
        }
        List<Double> vector = vectors.get(0);
        if (vector.size() != embeddingProvider.dimension()) {
            throw new EmbeddingDimensionException("Query embedding has the wrong dimension",
                    embeddingProvider.dimension(), vector.size());
        }
        ctx.logResponse("Query embedded", "Dimensions", vector.size());
        return vector;
    }

    private static VectorSearchHit toHit(VectorMatch match, IndexProfile profile) {
        String profileKind = match.metadataString("profileKind");
        return VectorSearchHit.builder()
                .nodeId(match.nodeId())
                .score(match.score())
                .profileId(profile.getId())
                .profileKind(profileKind != null ? profileKind : profile.getProfileKind())
                .projectKey(match.metadataString("projectKey"))
                .sourceSystem(match.metadataString("sourceSystem"))
                .tenantId(match.metadataString("tenantId"))
                .build();
    }
}
