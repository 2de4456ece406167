package com.purchasingpower.brain.knowledge;

import java.util.List;

/**
 * Turns text into fixed-dimension vectors.
 *
 * <p>Results are 1:1 with the input list and in the same order.
 *
 * @since 2.0.0
 */
public interface EmbeddingProvider {

    List<List<Double>> embedText(String model, List<String> texts);

    int dimension();
}
