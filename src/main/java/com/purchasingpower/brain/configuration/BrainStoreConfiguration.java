package com.purchasingpower.brain.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.brain.knowledge.EmbeddingProvider;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.purchasingpower.brain.knowledge.IndexProfileStore;
import com.purchasingpower.brain.knowledge.SignalStore;
import com.purchasingpower.brain.knowledge.VectorIndexStore;
import com.purchasingpower.brain.knowledge.impl.HashingEmbeddingProvider;
import com.purchasingpower.brain.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.brain.knowledge.impl.InMemoryIndexProfileStore;
import com.purchasingpower.brain.knowledge.impl.InMemorySignalStore;
import com.purchasingpower.brain.knowledge.impl.InMemoryVectorIndexStore;
import com.purchasingpower.brain.knowledge.impl.LangChain4jEmbeddingProvider;
import com.purchasingpower.brain.knowledge.impl.Neo4jGraphStore;
import com.purchasingpower.brain.knowledge.impl.PineconeVectorIndexStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the collaborator adapters.
 *
 * <p>Defaults are the in-memory stores and the hashing embedder, so the
 * service starts without Neo4j, Pinecone or Ollama. Switch per concern with
 * {@code brain.stores.graph}, {@code brain.stores.vector} and
 * {@code brain.embedding.provider}.
 */
@Slf4j
@Configuration
public class BrainStoreConfiguration {

    @Bean
    @ConditionalOnProperty(name = "brain.stores.graph", havingValue = "neo4j")
    public GraphStore neo4jGraphStore(BrainProperties properties, ObjectMapper objectMapper) {
        return new Neo4jGraphStore(properties.getNeo4j(), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(GraphStore.class)
    public GraphStore inMemoryGraphStore() {
        log.info("Using in-memory graph store");
        return new InMemoryGraphStore();
    }

    @Bean
    @ConditionalOnProperty(name = "brain.stores.vector", havingValue = "pinecone")
    public VectorIndexStore pineconeVectorIndexStore(BrainProperties properties) {
        return new PineconeVectorIndexStore(properties.getPinecone(), properties.getEmbedding().getDimension());
    }

    @Bean
    @ConditionalOnMissingBean(VectorIndexStore.class)
    public VectorIndexStore inMemoryVectorIndexStore(BrainProperties properties) {
        log.info("Using in-memory vector index ({} dimensions)", properties.getEmbedding().getDimension());
        return new InMemoryVectorIndexStore(properties.getEmbedding().getDimension());
    }

    @Bean
    @ConditionalOnProperty(name = "brain.embedding.provider", havingValue = "ollama")
    public EmbeddingProvider ollamaEmbeddingProvider(BrainProperties properties) {
        return new LangChain4jEmbeddingProvider(properties.getEmbedding());
    }

    @Bean
    @ConditionalOnMissingBean(EmbeddingProvider.class)
    public EmbeddingProvider hashingEmbeddingProvider(BrainProperties properties) {
        log.info("Using hashing embedding provider");
        return new HashingEmbeddingProvider(properties.getEmbedding().getDimension());
    }

    @Bean
    @ConditionalOnMissingBean
    public IndexProfileStore indexProfileStore(BrainProperties properties) {
        String defaultModel = properties.getEmbedding().getModel();
        return new InMemoryIndexProfileStore(properties.getProfiles().stream()
                .map(profile -> profile.toProfile(defaultModel))
                .toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public SignalStore signalStore() {
        return new InMemorySignalStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
