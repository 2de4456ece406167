package com.purchasingpower.brain.knowledge;

import com.purchasingpower.brain.core.EntityKind;
import com.purchasingpower.brain.knowledge.impl.InMemoryIndexProfileStore;
import com.purchasingpower.brain.support.BrainFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileRegistryTest {

    @Test
    @DisplayName("Should map work and doc kinds to their profiles")
    void resolvesProfilesByKind() {
        // Given
        ProfileRegistry registry = new ProfileRegistry(BrainFixtures.profileStore());

        // Then
        assertEquals("cdm.work.summary", registry.profileFor(EntityKind.WORK).orElseThrow().getId());
        assertEquals("cdm.doc.body", registry.profileFor(EntityKind.DOC).orElseThrow().getId());
        assertTrue(registry.profileFor(EntityKind.CLUSTER).isEmpty());
        assertTrue(registry.profileFor(EntityKind.OTHER).isEmpty());
        assertTrue(registry.profileFor(null).isEmpty());
    }

    @Test
    @DisplayName("Should skip disabled profiles and keep the first enabled one per kind")
    void firstEnabledProfileWins() {
        // Given
        IndexProfile disabled = BrainFixtures.workProfile().toBuilder().id("work.disabled").enabled(false).build();
        IndexProfile second = BrainFixtures.workProfile().toBuilder().id("work.second").build();
        InMemoryIndexProfileStore store = new InMemoryIndexProfileStore(
                List.of(disabled, BrainFixtures.workProfile(), second));

        // When
        ProfileRegistry registry = new ProfileRegistry(store);

        // Then
        assertEquals("cdm.work.summary", registry.profileFor(EntityKind.WORK).orElseThrow().getId());
    }

    @Test
    @DisplayName("Should keep the table resolved at construction")
    void tableIsResolvedOnce() {
        // Given
        InMemoryIndexProfileStore store = new InMemoryIndexProfileStore(List.of(BrainFixtures.workProfile()));
        ProfileRegistry registry = new ProfileRegistry(store);

        // When
        store.register(BrainFixtures.docProfile());

        // Then
        assertTrue(registry.profileFor(EntityKind.DOC).isEmpty());
        assertTrue(registry.profileFor(EntityKind.WORK).isPresent());
    }
}
