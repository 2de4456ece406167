package com.purchasingpower.brain.util;

/**
 * External collaborators whose calls go through {@link ExternalCallLogger}.
 *
 * @see CallContext
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    PINECONE("🔵", "Pinecone"),
    OLLAMA("🟣", "Ollama"),
    EMBEDDING("🔷", "Embedding");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
