package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.configuration.EmbeddingProperties;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LangChain4j Embedding Provider Tests")
class LangChain4jEmbeddingProviderTest {

    @Test
    @DisplayName("Should convert embeddings and fall back to the configured model name")
    void embedsWithDefaultModel() {
        // Given
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setModel("default-model");
        List<String> requested = new ArrayList<>();
        LangChain4jEmbeddingProvider provider = new LangChain4jEmbeddingProvider(properties, name -> {
            requested.add(name);
            EmbeddingModel model = segments -> Response.from(segments.stream()
                    .map(segment -> Embedding.from(new float[]{0.5f, 0.25f}))
                    .toList());
            return model;
        });

        // When
        List<List<Double>> vectors = provider.embedText(" ", List.of("first", "second"));

        // Then
        assertEquals(List.of(List.of(0.5, 0.25), List.of(0.5, 0.25)), vectors);
        assertEquals(List.of("default-model"), requested);
        assertEquals(List.of(), provider.embedText("default-model", List.of()));
    }

    @Test
    @DisplayName("Should rethrow client failures unchanged")
    void clientErrorsPropagate() {
        // Given
        IllegalStateException failure = new IllegalStateException("connection refused");
        EmbeddingModel broken = segments -> {
            throw failure;
        };
        LangChain4jEmbeddingProvider provider = new LangChain4jEmbeddingProvider(new EmbeddingProperties(), name -> broken);

        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> provider.embedText("m", List.of("text")));

        // Then
        assertSame(failure, thrown);
    }
}
