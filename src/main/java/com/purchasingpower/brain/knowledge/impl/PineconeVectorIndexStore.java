package com.purchasingpower.brain.knowledge.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.protobuf.ListValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.brain.configuration.PineconeProperties;
import com.purchasingpower.brain.exception.EmbeddingDimensionException;
import com.purchasingpower.brain.knowledge.VectorIndexEntry;
import com.purchasingpower.brain.knowledge.VectorIndexStore;
import com.purchasingpower.brain.knowledge.VectorMatch;
import com.purchasingpower.brain.knowledge.VectorQueryFilter;
import com.purchasingpower.brain.util.CallContext;
import com.purchasingpower.brain.util.ExternalCallLogger;
import com.purchasingpower.brain.util.ServiceType;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.QueryResponseWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.ScoredVectorWithUnsignedIndices;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vector index backed by a Pinecone index using the cosine metric.
 *
 * <p>All profiles share one index; each vector carries its profile, tenant,
 * project and kind as metadata and every query filters on them. Pinecone
 * scores cosine indexes as similarity, so scores pass through unchanged.
 *
 * @since 2.0.0
 */
@Slf4j
public class PineconeVectorIndexStore implements VectorIndexStore {

    private static final int UPSERT_BATCH_SIZE = 100;

    private final Pinecone client;
    private final String indexName;
    private final String namespace;
    private final int dimension;

    public PineconeVectorIndexStore(PineconeProperties properties, int dimension) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(properties.getApiKey()),
                "brain.pinecone.api-key is required when the Pinecone vector store is enabled");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(properties.getIndexName()),
                "brain.pinecone.index-name is required when the Pinecone vector store is enabled");
        this.client = new Pinecone.Builder(properties.getApiKey()).build();
        this.indexName = properties.getIndexName();
        this.namespace = Strings.nullToEmpty(properties.getNamespace());
        this.dimension = dimension;
    }

    @Override
    public void upsertEntries(List<VectorIndexEntry> entries) {
        List<VectorWithUnsignedIndices> vectors = new ArrayList<>(entries.size());
        for (VectorIndexEntry entry : entries) {
            vectors.add(new VectorWithUnsignedIndices(
                    entry.entryId(),
                    toFloats(entry.getEmbedding(), "Vector entry " + entry.entryId()),
                    toMetadata(entry),
                    null));
        }

        for (int i = 0; i < vectors.size(); i += UPSERT_BATCH_SIZE) {
            List<VectorWithUnsignedIndices> batch = vectors.subList(i, Math.min(i + UPSERT_BATCH_SIZE, vectors.size()));
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Upsert", log);
            try {
                ctx.logRequest("Upserting vector batch", "Index", indexName, "Vectors", batch.size());
                client.getIndexConnection(indexName).upsert(batch, namespace);
                ctx.logResponse("Batch upserted successfully");
            } catch (RuntimeException e) {
                ctx.logError("Failed to upsert batch", e);
                throw e;
            }
        }
    }

    @Override
    public List<VectorMatch> query(String profileId, List<Double> embedding, int topK, VectorQueryFilter filter) {
        List<Float> floats = toFloats(embedding, "Query embedding");
        Struct metadataFilter = buildFilter(profileId, filter);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.PINECONE, "Query", log);
        QueryResponseWithUnsignedIndices response;
        try {
            ctx.logRequest("Querying vectors", "Index", indexName, "Profile", profileId, "TopK", topK);
            response = client.getIndexConnection(indexName).query(
                    Math.max(1, topK),
                    floats,
                    null,
                    null,
                    null,
                    namespace,
                    metadataFilter,
                    false,
                    true);
        } catch (RuntimeException e) {
            ctx.logError("Pinecone query failed", e);
            throw e;
        }

        List<VectorMatch> matches = new ArrayList<>();
        if (response.getMatchesList() != null) {
            for (ScoredVectorWithUnsignedIndices match : response.getMatchesList()) {
                Map<String, Object> metadata = fromMetadata(match.getMetadata());
                Object nodeId = metadata.getOrDefault("nodeId", match.getId());
                matches.add(new VectorMatch(String.valueOf(nodeId), match.getScore(), metadata));
            }
        }
        ctx.logResponse("Matches returned", "Count", matches.size());
        return matches;
    }

    /**
     * Equivalent to {@code profileId = ? AND tenantId = ? AND projectKey IN (...) AND profileKind IN (...)}.
     */
    static Struct buildFilter(String profileId, VectorQueryFilter filter) {
        Struct.Builder builder = Struct.newBuilder().putFields("profileId", operator("$eq", string(profileId)));
        if (filter == null) {
            return builder.build();
        }
        if (filter.getTenantId() != null) {
            builder.putFields("tenantId", operator("$eq", string(filter.getTenantId())));
        }
        if (!filter.getProjectKeyIn().isEmpty()) {
            builder.putFields("projectKey", operator("$in", list(filter.getProjectKeyIn())));
        }
        if (!filter.getProfileKindIn().isEmpty()) {
            builder.putFields("profileKind", operator("$in", list(filter.getProfileKindIn())));
        }
        return builder.build();
    }

    private static Value operator(String op, Value operand) {
        return Value.newBuilder()
                .setStructValue(Struct.newBuilder().putFields(op, operand).build())
                .build();
    }

    private static Value string(String text) {
        return Value.newBuilder().setStringValue(text).build();
    }

    private static Value list(List<String> values) {
        ListValue.Builder list = ListValue.newBuilder();
        values.forEach(value -> list.addValues(string(value)));
        return Value.newBuilder().setListValue(list.build()).build();
    }

    private static Struct toMetadata(VectorIndexEntry entry) {
        Map<String, String> flat = new LinkedHashMap<>();
        flat.put("nodeId", entry.getNodeId());
        flat.put("profileId", entry.getProfileId());
        flat.put("chunkId", entry.getChunkId());
        flat.put("tenantId", entry.getTenantId());
        flat.put("projectKey", entry.getProjectKey());
        flat.put("profileKind", entry.getProfileKind());
        flat.put("sourceSystem", entry.getSourceSystem());

        Struct.Builder metadata = Struct.newBuilder();
        flat.forEach((key, value) -> {
            if (value != null) {
                metadata.putFields(key, string(value));
            }
        });
        return metadata.build();
    }

    private static Map<String, Object> fromMetadata(Struct metadata) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (metadata == null) {
            return values;
        }
        metadata.getFieldsMap().forEach((key, value) -> {
            switch (value.getKindCase()) {
                case STRING_VALUE -> values.put(key, value.getStringValue());
                case NUMBER_VALUE -> values.put(key, value.getNumberValue());
                case BOOL_VALUE -> values.put(key, value.getBoolValue());
                default -> log.debug("Ignoring non-scalar metadata field {}", key);
            }
        });
        return values;
    }

    private List<Float> toFloats(List<Double> vector, String label) {
        int actual = vector == null ? 0 : vector.size();
        if (actual != dimension) {
            throw new EmbeddingDimensionException(label + " has the wrong dimension", dimension, actual);
        }
        return vector.stream().map(Double::floatValue).toList();
    }
}
