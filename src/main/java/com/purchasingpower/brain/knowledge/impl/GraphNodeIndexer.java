package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.configuration.BrainProperties;
import com.purchasingpower.brain.core.EntityProperties;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.exception.BrainException;
import com.purchasingpower.brain.exception.EmbeddingDimensionException;
import com.purchasingpower.brain.exception.ProfileNotFoundException;
import com.purchasingpower.brain.knowledge.EmbeddingProvider;
import com.purchasingpower.brain.knowledge.EntityFilter;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.purchasingpower.brain.knowledge.IndexProfile;
import com.purchasingpower.brain.knowledge.IndexProfileStore;
import com.purchasingpower.brain.knowledge.NodeIndexer;
import com.purchasingpower.brain.knowledge.VectorIndexEntry;
import com.purchasingpower.brain.knowledge.VectorIndexStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Embeds graph entities into the vector index, one profile at a time.
 *
 * <p>Entities are processed newest first in fixed-size batches. Entities that
 * yield no text are skipped. A batch whose embeddings do not line up with its
 * inputs aborts the run.
 *
 * @since 2.0.0
 */
@Slf4j
@Service
public class GraphNodeIndexer implements NodeIndexer {

    private static final String[] PROJECT_KEY_PROPERTIES = {
            "projectKey", "project_key", "source_project_key", "sourceProjectKey", "project", "projectId", "project_id"
    };
    private static final String[] METADATA_PROJECT_KEYS = {"projectKey", "project_key", "source_project_key"};
    private static final String[] FALLBACK_TEXT_FIELDS = {"summary", "body", "text", "content"};

    private final GraphStore graphStore;
    private final IndexProfileStore profileStore;
    private final VectorIndexStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final int dimension;

    public GraphNodeIndexer(GraphStore graphStore,
                            IndexProfileStore profileStore,
                            VectorIndexStore vectorStore,
                            EmbeddingProvider embeddingProvider,
                            BrainProperties properties) {
        this.graphStore = graphStore;
        this.profileStore = profileStore;
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.dimension = properties.getEmbedding().getDimension();
    }

    @Override
    public int indexNodesForProfile(String profileId, TenantScope scope, List<String> nodeIds, Integer batchSize) {
        IndexProfile profile = profileStore.getProfile(profileId)
                .orElseThrow(() -> new ProfileNotFoundException(profileId));
        if (!profile.isEnabled()) {
            log.info("⏭️  Profile {} is disabled, nothing to index", profileId);
            return 0;
        }

        List<GraphEntity> nodes = loadNodes(profile, scope, nodeIds);
        int size = Math.max(1, batchSize == null ? DEFAULT_BATCH_SIZE : batchSize);
        log.info("📊 Indexing {} {} entities for profile {} (batch size {})",
                nodes.size(), profile.getEntityType(), profileId, size);

        int indexed = 0;
        for (int offset = 0; offset < nodes.size(); offset += size) {
            List<GraphEntity> slice = nodes.subList(offset, Math.min(offset + size, nodes.size()));
            indexed += indexBatch(profile, slice);
        }

        log.info("✅ Indexed {} entries for profile {}", indexed, profileId);
        return indexed;
    }

    private List<GraphEntity> loadNodes(IndexProfile profile, TenantScope scope, List<String> nodeIds) {
        Set<String> restrictTo = nodeIds == null ? Set.of() : new HashSet<>(nodeIds);
        List<GraphEntity> nodes = new ArrayList<>();
        for (GraphEntity entity : graphStore.listEntities(EntityFilter.ofTypes(profile.getEntityType()), scope)) {
            if (restrictTo.isEmpty() || restrictTo.contains(entity.getId())) {
                nodes.add(entity);
            }
        }
        nodes.sort(GraphEntity.NEWEST_FIRST);
        return nodes;
    }

    private int indexBatch(IndexProfile profile, List<GraphEntity> slice) {
        List<GraphEntity> toEmbed = new ArrayList<>();
        List<String> texts = new ArrayList<>();
        for (GraphEntity entity : slice) {
            String text = extractText(profile, entity.getProperties());
            if (text == null) {
                log.debug("Skipping {}: no indexable text", entity.getId());
                continue;
            }
            toEmbed.add(entity);
            texts.add(text);
        }
        if (toEmbed.isEmpty()) {
            return 0;
        }

        List<List<Double>> embeddings = embeddingProvider.embedText(profile.getEmbeddingModel(), texts);
        if (embeddings.size() != toEmbed.size()) {
            throw new BrainException("Embedding provider returned " + embeddings.size()
                    + " vectors for " + toEmbed.size() + " texts");
        }

        List<VectorIndexEntry> entries = new ArrayList<>(toEmbed.size());
        for (int i = 0; i < toEmbed.size(); i++) {
            GraphEntity entity = toEmbed.get(i);
            List<Double> embedding = embeddings.get(i);
            if (embedding.size() != dimension) {
                throw new EmbeddingDimensionException(
                        "Embedding for " + entity.getId() + " has the wrong dimension", dimension, embedding.size());
            }
            String projectKey = resolveProjectKey(entity);
            String sourceSystem = entity.props().string("sourceSystem").orElse(null);
            entries.add(VectorIndexEntry.builder()
                    .nodeId(entity.getId())
                    .profileId(profile.getId())
                    .embedding(embedding)
                    .tenantId(entity.getTenantId())
                    .projectKey(projectKey)
                    .profileKind(profile.getProfileKind())
                    .sourceSystem(sourceSystem)
                    .rawMetadata(rawMetadata(entity, projectKey, profile, sourceSystem))
                    .build());
        }
        vectorStore.upsertEntries(entries);
        return entries.size();
    }

    static String extractText(IndexProfile profile, Map<String, Object> properties) {
        Map<String, Object> base = properties;
        if (profile.getTextFrom() != null && properties.get(profile.getTextFrom()) instanceof Map<?, ?> nested) {
            base = asStringMap(nested);
        }
        if (!profile.getTextPath().isEmpty()) {
            String text = stringify(dig(base, profile.getTextPath()));
            if (text != null) {
                return text;
            }
        }
        if (profile.getTextField() != null) {
            String text = stringify(base.get(profile.getTextField()));
            if (text == null) {
                text = deepFindString(base, profile.getTextField());
            }
            if (text != null) {
                return text;
            }
        }
        for (String field : FALLBACK_TEXT_FIELDS) {
            String text = stringify(base.get(field));
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    static String resolveProjectKey(GraphEntity entity) {
        EntityProperties props = entity.props();
        Optional<String> fromProperties = props.string(PROJECT_KEY_PROPERTIES);
        if (fromProperties.isPresent()) {
            return fromProperties.get();
        }
        if (props.raw("_metadata") instanceof Map<?, ?> metadata) {
            Optional<String> fromMetadata = EntityProperties.of(asStringMap(metadata)).string(METADATA_PROJECT_KEYS);
            if (fromMetadata.isPresent()) {
                return fromMetadata.get();
            }
        }
        return EntityProperties.normalize(entity.getProjectId());
    }

    private static Map<String, Object> rawMetadata(GraphEntity entity, String projectKey, IndexProfile profile,
                                                   String sourceSystem) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entityType", entity.getEntityType());
        metadata.put("tenantId", entity.getTenantId());
        metadata.put("scopeProjectId", entity.getProjectId());
        metadata.put("projectKey", projectKey);
        metadata.put("profileKind", profile.getProfileKind());
        metadata.put("sourceSystem", sourceSystem);
        metadata.put("properties", entity.getProperties());
        return metadata;
    }

    private static Object dig(Map<String, Object> root, List<String> path) {
        Object cursor = root;
        for (String key : path) {
            if (!(cursor instanceof Map<?, ?> map)) {
                return null;
            }
            cursor = map.get(key);
        }
        return cursor;
    }

    private static String stringify(Object value) {
        if (value instanceof String text) {
            String trimmed = text.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value instanceof Collection<?> parts) {
            List<String> lines = new ArrayList<>();
            for (Object part : parts) {
                if (part instanceof String text && !text.isBlank()) {
                    lines.add(text.trim());
                }
            }
            return lines.isEmpty() ? null : String.join("\n", lines);
        }
        return null;
    }

    private static String deepFindString(Object value, String key) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        if (map.get(key) instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        for (Object nested : map.values()) {
            String found = deepFindString(nested, key);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }
}
