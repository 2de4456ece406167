package com.purchasingpower.brain.knowledge;

import com.purchasingpower.brain.core.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves which index profile embeds a given kind of entity.
 *
 * <p>The table is built once, when the registry is created. The first enabled
 * profile bound to the kind's entity type wins, in the order the profile store
 * lists them.
 */
@Slf4j
@Component
public class ProfileRegistry {

    private final Map<EntityKind, IndexProfile> profilesByKind;

    public ProfileRegistry(IndexProfileStore profileStore) {
        Map<EntityKind, IndexProfile> table = new EnumMap<>(EntityKind.class);
        for (IndexProfile profile : profileStore.listProfiles()) {
            if (!profile.isEnabled()) {
                continue;
            }
            EntityKind kind = EntityKind.fromEntityType(profile.getEntityType());
            if (kind != EntityKind.OTHER) {
                table.putIfAbsent(kind, profile);
            }
        }
        this.profilesByKind = Collections.unmodifiableMap(table);
        log.info("Profile registry resolved {} kind(s): {}", table.size(), table.keySet());
    }

    public Optional<IndexProfile> profileFor(EntityKind kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profilesByKind.get(kind));
    }
}
