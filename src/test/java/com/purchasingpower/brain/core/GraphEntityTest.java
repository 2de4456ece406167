package com.purchasingpower.brain.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph Entity Tests")
class GraphEntityTest {

    private static GraphEntity entity(String projectId, Map<String, Object> properties) {
        return GraphEntity.builder()
                .id("e1")
                .entityType("cdm.work.item")
                .tenantId("t1")
                .projectId(projectId)
                .properties(properties)
                .build();
    }

    @Test
    @DisplayName("Kind dispatch uses the exact entity type")
    void kindIsExact() {
        assertEquals(EntityKind.WORK, entity(null, Map.of()).kind());
        assertEquals(EntityKind.OTHER, entity(null, Map.of()).toBuilder().entityType("cdm.work.item.v2").build().kind());
    }

    @Test
    @DisplayName("Project membership accepts the scope column or a project property")
    void belongsToProject() {
        assertTrue(entity("PROJ", Map.of()).belongsToProject("PROJ"));
        assertTrue(entity(null, Map.of("project_key", "PROJ")).belongsToProject("PROJ"));
        assertFalse(entity(null, Map.of()).belongsToProject("PROJ"));
        assertFalse(entity("OTHER", Map.of()).belongsToProject("PROJ"));
    }

    @Test
    @DisplayName("Visibility only rejects an explicit mismatch")
    void visibility() {
        assertTrue(entity(null, Map.of()).isVisibleIn("t1", "PROJ"));
        assertTrue(entity("PROJ", Map.of()).isVisibleIn("t1", "PROJ"));
        assertFalse(entity("OTHER", Map.of()).isVisibleIn("t1", "PROJ"));
        assertFalse(entity("PROJ", Map.of("tenantId", "t2")).isVisibleIn("t1", "PROJ"));
    }

    @Test
    @DisplayName("Secured reads the secured flag, then isSecured")
    void secured() {
        assertTrue(entity(null, Map.of("secured", true)).isSecured());
        assertFalse(entity(null, Map.of("secured", false, "isSecured", true)).isSecured());
        assertTrue(entity(null, Map.of("isSecured", true)).isSecured());
        assertFalse(entity(null, Map.of()).isSecured());
    }

    @Test
    @DisplayName("Newest first puts entities without timestamps last")
    void newestFirst() {
        GraphEntity old = entity(null, Map.of("updatedAt", "2024-01-01T00:00:00Z")).toBuilder().id("old").build();
        GraphEntity fresh = entity(null, Map.of("createdAt", "2024-03-01T00:00:00Z")).toBuilder().id("fresh").build();
        GraphEntity undated = entity(null, Map.of()).toBuilder().id("undated").build();

        List<GraphEntity> sorted = new ArrayList<>(List.of(undated, old, fresh));
        sorted.sort(GraphEntity.NEWEST_FIRST);

        assertEquals(List.of("fresh", "old", "undated"), sorted.stream().map(GraphEntity::getId).toList());
    }

    @Test
    @DisplayName("Time windows are inclusive and let undated entities through")
    void windows() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        TimeWindow window = TimeWindow.of(start, Instant.parse("2024-02-01T00:00:00Z"));

        assertTrue(entity(null, Map.of("updatedAt", "2024-01-01T00:00:00Z")).isWithin(window));
        assertFalse(entity(null, Map.of("updatedAt", "2023-12-31T23:59:59Z")).isWithin(window));
        assertTrue(entity(null, Map.of()).isWithin(window));
        assertSame(TimeWindow.UNBOUNDED, TimeWindow.of(null, null));
    }
}
