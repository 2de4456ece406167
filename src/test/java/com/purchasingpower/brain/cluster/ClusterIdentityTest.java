package com.purchasingpower.brain.cluster;

import com.purchasingpower.brain.core.TimeWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cluster Identity Tests")
class ClusterIdentityTest {

    @Test
    @DisplayName("Key sorts members and joins scope, window and members")
    void keyIsOrderIndependent() {
        String forward = ClusterIdentity.key("t1", "PROJ", TimeWindow.UNBOUNDED, List.of("work-1", "doc-1"));
        String reverse = ClusterIdentity.key("t1", "PROJ", TimeWindow.UNBOUNDED, List.of("doc-1", "work-1"));

        assertEquals("t1::PROJ::|::doc-1|work-1", forward);
        assertEquals(forward, reverse);
    }

    @Test
    @DisplayName("Id is the prefix plus 16 hex characters and is stable")
    void idShape() {
        String key = ClusterIdentity.key("t1", "PROJ", TimeWindow.UNBOUNDED, List.of("a", "b"));

        String id = ClusterIdentity.clusterId(key);

        assertTrue(id.matches("cluster:[0-9a-f]{16}"), id);
        assertEquals(id, ClusterIdentity.clusterId(key));
    }

    @Test
    @DisplayName("Different windows give different ids")
    void windowChangesId() {
        List<String> members = List.of("a", "b");
        TimeWindow may = TimeWindow.of(Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-31T00:00:00Z"));

        String unbounded = ClusterIdentity.clusterId(ClusterIdentity.key("t1", "P", null, members));
        String bounded = ClusterIdentity.clusterId(ClusterIdentity.key("t1", "P", may, members));

        assertNotEquals(unbounded, bounded);
    }
}
