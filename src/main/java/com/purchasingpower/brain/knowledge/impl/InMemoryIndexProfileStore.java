package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.knowledge.IndexProfile;
import com.purchasingpower.brain.knowledge.IndexProfileStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryIndexProfileStore implements IndexProfileStore {

    private final Map<String, IndexProfile> profiles = new LinkedHashMap<>();

    public InMemoryIndexProfileStore(List<IndexProfile> initial) {
        initial.forEach(this::register);
    }

    public synchronized void register(IndexProfile profile) {
        profiles.put(profile.getId(), profile);
    }

    @Override
    public synchronized List<IndexProfile> listProfiles() {
        return new ArrayList<>(profiles.values());
    }

    @Override
    public synchronized Optional<IndexProfile> getProfile(String id) {
        return Optional.ofNullable(profiles.get(id));
    }
}
