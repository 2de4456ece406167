package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.knowledge.SignalDefinition;
import com.purchasingpower.brain.knowledge.SignalInstance;
import com.purchasingpower.brain.knowledge.SignalStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemorySignalStore implements SignalStore {

    private final Map<String, SignalDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, SignalInstance> instances = new ConcurrentHashMap<>();
    private final AtomicInteger definitionLookups = new AtomicInteger();

    public void putDefinition(SignalDefinition definition) {
        definitions.put(definition.getId(), definition);
    }

    public void putInstance(SignalInstance instance) {
        instances.put(instance.getId(), instance);
    }

    @Override
    public Optional<SignalDefinition> getDefinition(String id) {
        definitionLookups.incrementAndGet();
        return Optional.ofNullable(definitions.get(id));
    }

    @Override
    public Optional<SignalInstance> getInstance(String id) {
        return Optional.ofNullable(instances.get(id));
    }

    /**
     * Number of definition lookups served so far.
     */
    public int getDefinitionLookups() {
        return definitionLookups.get();
    }
}
