package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.configuration.EmbeddingProperties;
import com.purchasingpower.brain.knowledge.EmbeddingProvider;
import com.purchasingpower.brain.util.CallContext;
import com.purchasingpower.brain.util.ExternalCallLogger;
import com.purchasingpower.brain.util.ServiceType;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Embedding provider backed by LangChain4j's Ollama client.
 *
 * <p>One {@link OllamaEmbeddingModel} is built lazily per model name.
 * Timeouts and retries are handled by LangChain4j.
 */
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProperties properties;
    private final Function<String, EmbeddingModel> modelFactory;
    private final Map<String, EmbeddingModel> models = new ConcurrentHashMap<>();

    public LangChain4jEmbeddingProvider(EmbeddingProperties properties) {
        this(properties, name -> OllamaEmbeddingModel.builder()
                .baseUrl(properties.getOllamaBaseUrl())
                .modelName(name)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .maxRetries(properties.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build());
    }

    LangChain4jEmbeddingProvider(EmbeddingProperties properties, Function<String, EmbeddingModel> modelFactory) {
        this.properties = properties;
        this.modelFactory = modelFactory;
        log.info("✅ LangChain4j embedding provider ready (Ollama at {}, default model {})",
                properties.getOllamaBaseUrl(), properties.getModel());
    }

    @Override
    public List<List<Double>> embedText(String model, List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        String modelName = model == null || model.isBlank() ? properties.getModel() : model;
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.OLLAMA, "EmbedAll", log);
        try {
            ctx.logRequest("Embedding texts", "Model", modelName, "Texts", texts.size());
            Response<List<Embedding>> response = modelFor(modelName).embedAll(segments);
            List<List<Double>> vectors = new ArrayList<>(response.content().size());
            for (Embedding embedding : response.content()) {
                vectors.add(toDoubles(embedding));
            }
            ctx.logResponse("Embeddings generated", "Count", vectors.size());
            return vectors;
        } catch (RuntimeException e) {
            ctx.logError("Embedding generation failed after retries", e);
            throw e;
        }
    }

    @Override
    public int dimension() {
        return properties.getDimension();
    }

    private EmbeddingModel modelFor(String modelName) {
        return models.computeIfAbsent(modelName, modelFactory);
    }

    private static List<Double> toDoubles(Embedding embedding) {
        float[] vector = embedding.vector();
        List<Double> values = new ArrayList<>(vector.length);
        for (float value : vector) {
            values.add((double) value);
        }
        return values;
    }
}
