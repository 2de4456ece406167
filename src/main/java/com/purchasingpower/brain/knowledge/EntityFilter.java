package com.purchasingpower.brain.knowledge;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EntityFilter {

    /** Exact entity type tags; empty matches every type. */
    @Singular
    List<String> entityTypes;

    public static EntityFilter ofTypes(String... entityTypes) {
        return EntityFilter.builder().entityTypes(List.of(entityTypes)).build();
    }

    public boolean matches(String entityType) {
        return entityTypes.isEmpty() || entityTypes.contains(entityType);
    }
}
