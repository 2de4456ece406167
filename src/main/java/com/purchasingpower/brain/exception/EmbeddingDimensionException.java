package com.purchasingpower.brain.exception;

import lombok.Getter;

@Getter
public class EmbeddingDimensionException extends BrainException {

    private final int expected;
    private final int actual;

    public EmbeddingDimensionException(String message, int expected, int actual) {
        super(message + " (expected " + expected + ", got " + actual + ")");
        this.expected = expected;
        this.actual = actual;
    }

}
