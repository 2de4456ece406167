package com.purchasingpower.brain.knowledge;

import java.util.List;
import java.util.Optional;

public interface IndexProfileStore {

    List<IndexProfile> listProfiles();

    Optional<IndexProfile> getProfile(String id);
}
