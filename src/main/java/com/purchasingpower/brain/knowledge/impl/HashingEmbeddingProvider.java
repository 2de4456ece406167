package com.purchasingpower.brain.knowledge.impl;

import com.google.common.base.Splitter;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.purchasingpower.brain.knowledge.EmbeddingProvider;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic bag-of-words embedding: each lower-cased token is hashed into
 * one of {@code dimension} buckets and the counts are L2-normalised.
 *
 * <p>Needs no model server, so it backs local runs and tests. Texts sharing
 * tokens score higher than unrelated texts; the model name is ignored.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Splitter TOKENS = Splitter.on(Pattern.compile("[^\\p{L}\\p{N}]+")).omitEmptyStrings();
    private static final HashFunction HASH = Hashing.murmur3_32_fixed();

    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public List<List<Double>> embedText(String model, List<String> texts) {
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private List<Double> embed(String text) {
        double[] buckets = new double[dimension];
        String source = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String token : TOKENS.split(source)) {
            int bucket = Math.floorMod(HASH.hashString(token, StandardCharsets.UTF_8).asInt(), dimension);
            buckets[bucket] += 1;
        }
        double norm = 0;
        for (double value : buckets) {
            norm += value * value;
        }
        List<Double> vector = new ArrayList<>(dimension);
        if (norm == 0) {
            // empty text still gets a unit vector
            vector.add(1.0);
            for (int i = 1; i < dimension; i++) {
                vector.add(0.0);
            }
            return vector;
        }
        double length = Math.sqrt(norm);
        for (double value : buckets) {
            vector.add(value / length);
        }
        return vector;
    }
}
