package com.purchasingpower.brain.configuration;

import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Which adapter backs each collaborator.
 */
@Data
public class StoreProperties {

    @Pattern(regexp = "in-memory|neo4j", message = "graph store must be in-memory or neo4j")
    private String graph = "in-memory";

    @Pattern(regexp = "in-memory|pinecone", message = "vector store must be in-memory or pinecone")
    private String vector = "in-memory";
}
