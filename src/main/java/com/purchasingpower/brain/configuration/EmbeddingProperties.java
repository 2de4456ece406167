package com.purchasingpower.brain.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class EmbeddingProperties {

    /** {@code hashing} needs no model server; {@code ollama} calls a local Ollama. */
    @Pattern(regexp = "hashing|ollama")
    private String provider = "hashing";

    /** Every vector written to or read from the index must have this many components. */
    @Min(1)
    private int dimension = 1536;

    @NotBlank
    private String ollamaBaseUrl = "http://localhost:11434";

    @NotBlank
    private String model = "mxbai-embed-large";

    @Min(1)
    private int timeoutSeconds = 60;

    @Min(0)
    private int maxRetries = 3;
}
