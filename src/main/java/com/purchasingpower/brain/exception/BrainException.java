package com.purchasingpower.brain.exception;

/**
 * Base type for failures raised by the brain layer.
 */
public class BrainException extends RuntimeException {

    public BrainException(String message) {
        super(message);
    }

    public BrainException(String message, Throwable cause) {
        super(message, cause);
    }
}
