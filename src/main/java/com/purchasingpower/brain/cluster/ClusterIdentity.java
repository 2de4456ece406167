package com.purchasingpower.brain.cluster;

import com.google.common.hash.Hashing;
import com.purchasingpower.brain.core.TimeWindow;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.TreeSet;

/**
 * Content-addressed cluster ids.
 *
 * <p>The key is {@code tenant::project::start|end::m1|m2|...} with members
 * sorted; the id is {@code cluster:} followed by the first 16 hex characters
 * of its SHA-256.
 */
public final class ClusterIdentity {

    public static final String ID_PREFIX = "cluster:";
    private static final int HASH_LENGTH = 16;

    private ClusterIdentity() {
    }

    public static String key(String tenantId, String projectKey, TimeWindow window, Collection<String> memberIds) {
        TimeWindow effective = window == null ? TimeWindow.UNBOUNDED : window;
        return String.join("::",
                tenantId,
                projectKey,
                effective.key(),
                String.join("|", new TreeSet<>(memberIds)));
    }

    public static String clusterId(String key) {
        String hash = Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString();
        return ID_PREFIX + hash.substring(0, HASH_LENGTH);
    }
}
