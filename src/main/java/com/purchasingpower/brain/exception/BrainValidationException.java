package com.purchasingpower.brain.exception;

import lombok.Getter;

@Getter
public class BrainValidationException extends BrainException {

    private final String field;

    public BrainValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

}
