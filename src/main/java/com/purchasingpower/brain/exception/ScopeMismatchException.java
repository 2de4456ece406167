package com.purchasingpower.brain.exception;

import lombok.Getter;

/**
 * A by-id lookup resolved an entity that belongs to a different tenant or project.
 */
@Getter
public class ScopeMismatchException extends BrainException {

    private final String entityId;
    private final String tenantId;
    private final String projectKey;

    public ScopeMismatchException(String entityId, String tenantId, String projectKey) {
        super("Entity " + entityId + " is outside scope " + tenantId + "/" + projectKey);
        this.entityId = entityId;
        this.tenantId = tenantId;
        this.projectKey = projectKey;
    }

}
