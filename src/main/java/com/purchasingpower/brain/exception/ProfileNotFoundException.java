package com.purchasingpower.brain.exception;

import lombok.Getter;

@Getter
public class ProfileNotFoundException extends BrainException {

    private final String profileId;

    public ProfileNotFoundException(String profileId) {
        super("Index profile not found: " + profileId);
        this.profileId = profileId;
    }

}
