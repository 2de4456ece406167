package com.purchasingpower.brain.knowledge.impl;

import com.purchasingpower.brain.exception.EmbeddingDimensionException;
import com.purchasingpower.brain.knowledge.VectorIndexEntry;
import com.purchasingpower.brain.knowledge.VectorMatch;
import com.purchasingpower.brain.knowledge.VectorQueryFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Vector Index Tests")
class InMemoryVectorIndexStoreTest {

    private InMemoryVectorIndexStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorIndexStore(3);
        store.upsertEntries(List.of(
                entry("a", "P1", List.of(1.0, 0.0, 0.0)),
                entry("b", "P1", List.of(0.6, 0.8, 0.0)),
                entry("c", "P2", List.of(0.0, 1.0, 0.0))));
    }

    private static VectorIndexEntry entry(String nodeId, String projectKey, List<Double> embedding) {
        return VectorIndexEntry.builder()
                .nodeId(nodeId)
                .profileId("profile")
                .embedding(embedding)
                .tenantId("t1")
                .projectKey(projectKey)
                .profileKind("work")
                .build();
    }

    @Test
    @DisplayName("Matches are ranked by cosine similarity")
    void ranksByCosine() {
        List<VectorMatch> matches = store.query("profile", List.of(1.0, 0.0, 0.0), 3, null);

        assertEquals(List.of("a", "b", "c"), matches.stream().map(VectorMatch::nodeId).toList());
        assertEquals(0.6, matches.get(1).score(), 1e-9);
    }

    @Test
    @DisplayName("Project and tenant filters restrict candidates")
    void filters() {
        List<VectorMatch> matches = store.query("profile", List.of(0.0, 1.0, 0.0), 5,
                VectorQueryFilter.builder().tenantId("t1").projectKeyIn(List.of("P1")).build());

        assertEquals(List.of("b", "a"), matches.stream().map(VectorMatch::nodeId).toList());
        assertTrue(store.query("profile", List.of(0.0, 1.0, 0.0), 5,
                VectorQueryFilter.builder().tenantId("t2").build()).isEmpty());
    }

    @Test
    @DisplayName("Upserting the same node and profile replaces the entry")
    void upsertReplaces() {
        store.upsertEntries(List.of(entry("a", "P1", List.of(0.0, 0.0, 1.0))));

        assertEquals(3, store.size());
        assertEquals("a", store.query("profile", List.of(0.0, 0.0, 1.0), 1, null).get(0).nodeId());
    }

    @Test
    @DisplayName("Vectors of the wrong size are rejected")
    void rejectsWrongDimension() {
        EmbeddingDimensionException error = assertThrows(EmbeddingDimensionException.class,
                () -> store.query("profile", List.of(1.0, 0.0), 1, null));

        assertEquals(3, error.getExpected());
        assertEquals(2, error.getActual());
    }
}
