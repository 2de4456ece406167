package com.purchasingpower.brain.core;

import java.util.Arrays;

/**
 * Kinds of graph entities the brain layer distinguishes.
 *
 * <p>Dispatch is always on the exact entity type tag, never on a prefix.
 *
 * @since 2.0.0
 */
public enum EntityKind {
    WORK("cdm.work.item", "work"),
    DOC("cdm.doc.item", "doc"),
    CLUSTER("kg.cluster", "cluster"),
    SIGNAL("signal.instance", "signal"),
    OTHER(null, "other");

    private final String entityType;
    private final String profileKind;

    EntityKind(String entityType, String profileKind) {
        this.entityType = entityType;
        this.profileKind = profileKind;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getProfileKind() {
        return profileKind;
    }

    /**
     * Work and doc entities are the only ones that can seed or join a cluster.
     */
    public boolean isClusterMember() {
        return this == WORK || this == DOC;
    }

    public static EntityKind fromEntityType(String entityType) {
        if (entityType == null) {
            return OTHER;
        }
        return Arrays.stream(values())
                .filter(kind -> entityType.equals(kind.entityType))
                .findFirst()
                .orElse(OTHER);
    }
}
