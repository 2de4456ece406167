package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.exception.EmbeddingDimensionException;
import com.purchasingpower.brain.knowledge.VectorIndexEntry;
import com.purchasingpower.brain.knowledge.VectorIndexStore;
import com.purchasingpower.brain.knowledge.VectorMatch;
import com.purchasingpower.brain.knowledge.VectorQueryFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brute-force cosine index held on the heap.
 *
 * <p>Score is {@code 1 - cosineDistance}, i.e. the cosine similarity. Every
 * vector written or queried must have exactly {@code dimension} components.
 *
 * @since 2.0.0
 */
@Slf4j
public class InMemoryVectorIndexStore implements VectorIndexStore {

    private final int dimension;
    private final Map<String, VectorIndexEntry> entries = new LinkedHashMap<>();

    public InMemoryVectorIndexStore(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public synchronized void upsertEntries(List<VectorIndexEntry> batch) {
        for (VectorIndexEntry entry : batch) {
            checkDimension(entry.getEmbedding(), "Vector entry " + entry.entryId());
            entries.put(entry.entryId(), entry);
        }
        log.debug("Upserted {} vector entries ({} total)", batch.size(), entries.size());
    }

    @Override
    public synchronized List<VectorMatch> query(String profileId, List<Double> embedding, int topK,
                                                VectorQueryFilter filter) {
        checkDimension(embedding, "Query embedding");
        List<VectorMatch> matches = new ArrayList<>();
        for (VectorIndexEntry entry : entries.values()) {
            if (!entry.getProfileId().equals(profileId) || !accepts(filter, entry)) {
                continue;
            }
            matches.add(new VectorMatch(entry.getNodeId(), cosine(embedding, entry.getEmbedding()), metadata(entry)));
        }
        matches.sort(Comparator.comparingDouble(VectorMatch::score).reversed());
        return matches.subList(0, Math.min(matches.size(), Math.max(1, topK)));
    }

    public synchronized int size() {
        return entries.size();
    }

    private void checkDimension(List<Double> vector, String label) {
        int actual = vector == null ? 0 : vector.size();
        if (actual != dimension) {
            throw new EmbeddingDimensionException(label + " has the wrong dimension", dimension, actual);
        }
    }

    private static boolean accepts(VectorQueryFilter filter, VectorIndexEntry entry) {
        if (filter == null) {
            return true;
        }
        if (filter.getTenantId() != null && !filter.getTenantId().equals(entry.getTenantId())) {
            return false;
        }
        if (!filter.getProjectKeyIn().isEmpty() && !filter.getProjectKeyIn().contains(entry.getProjectKey())) {
            return false;
        }
        return filter.getProfileKindIn().isEmpty() || filter.getProfileKindIn().contains(entry.getProfileKind());
    }

    private static Map<String, Object> metadata(VectorIndexEntry entry) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("profileId", entry.getProfileId());
        metadata.put("profileKind", entry.getProfileKind());
        metadata.put("projectKey", entry.getProjectKey());
        metadata.put("sourceSystem", entry.getSourceSystem());
        metadata.put("tenantId", entry.getTenantId());
        metadata.put("raw", entry.getRawMetadata());
        return metadata;
    }

    static double cosine(List<Double> left, List<Double> right) {
        double dot = 0;
        double leftNorm = 0;
        double rightNorm = 0;
        for (int i = 0; i < left.size(); i++) {
            double l = finite(left.get(i));
            double r = finite(right.get(i));
            dot += l * r;
            leftNorm += l * l;
            rightNorm += r * r;
        }
        if (leftNorm == 0 || rightNorm == 0) {
            return 0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private static double finite(Double value) {
        return value == null || !Double.isFinite(value) ? 0 : value;
    }
}
