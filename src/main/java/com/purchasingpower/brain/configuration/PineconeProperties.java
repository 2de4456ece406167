package com.purchasingpower.brain.configuration;

import lombok.Data;

/**
 * Only read when {@code brain.stores.vector=pinecone}.
 */
@Data
public class PineconeProperties {

    private String apiKey;

    private String indexName;

    /** Empty string is the default namespace. */
    private String namespace = "";
}
