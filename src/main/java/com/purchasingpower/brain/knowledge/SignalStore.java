package com.purchasingpower.brain.knowledge;

import java.util.Optional;

/**
 * Read access to alert-like signals attached to graph entities.
 */
public interface SignalStore {

    Optional<SignalDefinition> getDefinition(String id);

    Optional<SignalInstance> getInstance(String id);
}
