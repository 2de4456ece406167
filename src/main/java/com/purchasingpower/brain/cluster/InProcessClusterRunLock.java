package com.purchasingpower.brain.cluster;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per tenant and project, held for the duration of a build.
 * Only serializes builds running in this JVM.
 */
@Slf4j
@Component
public class InProcessClusterRunLock implements ClusterRunLock {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public <T> T runExclusive(String tenantId, String projectKey, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(tenantId + "::" + projectKey, key -> new ReentrantLock(true));
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.info("⏳ Waiting for running cluster build of {}/{}", tenantId, projectKey);
        }
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
