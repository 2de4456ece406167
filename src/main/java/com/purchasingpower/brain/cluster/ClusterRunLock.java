package com.purchasingpower.brain.cluster;

import java.util.function.Supplier;

/**
 * Serializes cluster builds per tenant and project.
 */
public interface ClusterRunLock {

    <T> T runExclusive(String tenantId, String projectKey, Supplier<T> work);
}
