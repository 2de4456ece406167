package com.purchasingpower.brain.episode.impl;

import com.purchasingpower.brain.cluster.impl.ClusterReadImpl;
import com.purchasingpower.brain.core.EntityKind;
import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.episode.Episode;
import com.purchasingpower.brain.episode.EpisodeConnection;
import com.purchasingpower.brain.episode.EpisodeListRequest;
import com.purchasingpower.brain.episode.EpisodeMember;
import com.purchasingpower.brain.episode.EpisodeSignal;
import com.purchasingpower.brain.exception.BrainValidationException;
import com.purchasingpower.brain.exception.ScopeMismatchException;
import com.purchasingpower.brain.knowledge.SignalDefinition;
import com.purchasingpower.brain.knowledge.SignalInstance;
import com.purchasingpower.brain.knowledge.impl.InMemoryGraphStore;
import com.purchasingpower.brain.knowledge.impl.InMemorySignalStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.purchasingpower.brain.support.BrainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Episode Read Service Tests")
class EpisodeReadServiceImplTest {

    private InMemoryGraphStore graph;
    private InMemorySignalStore signals;
    private EpisodeReadServiceImpl service;

    @BeforeEach
    void setUp() {
        graph = graphWith(
                work("work-1", "summary", "Checkout fails on retry", "sourceIssueKey", "PROJ-42"),
                doc("doc-1", "title", "Retry runbook", "sourceUrl", "https://wiki.example.com/retry"),
                cluster("cluster:a", "2024-04-30T10:00:00Z"));
        link("work-1", "cluster:a");
        link("doc-1", "cluster:a");
        signals = new InMemorySignalStore();
        service = new EpisodeReadServiceImpl(graph, new ClusterReadImpl(graph), signals, fixedClock());
    }

    private GraphEntity cluster(String id, String updatedAt) {
        return entity(id, EntityKind.CLUSTER.getEntityType(), TENANT, PROJECT,
                "tenantId", TENANT,
                "projectKey", PROJECT,
                "clusterKind", "work-doc-episode",
                "size", 2,
                "createdAt", "2024-04-01T00:00:00Z",
                "updatedAt", updatedAt);
    }

    private void link(String memberId, String clusterId) {
        graph.upsertEdge(edge(GraphEdge.IN_CLUSTER, memberId, clusterId));
    }

    @Test
    @DisplayName("Episode members carry work keys and doc urls by kind")
    void hydratesTypedMembers() {
        // When
        Episode episode = service.getEpisode(TENANT, PROJECT, "cluster:a", "actor-1").orElseThrow();

        // Then
        assertEquals("work-doc-episode", episode.getClusterKind());
        assertEquals(2, episode.getSize());
        assertEquals(Instant.parse("2024-04-01T00:00:00Z"), episode.getCreatedAt());
        assertEquals(List.of("doc-1", "work-1"), episode.getMembers().stream().map(EpisodeMember::getNodeId).toList());

        EpisodeMember doc = episode.getMembers().get(0);
        assertEquals("https://wiki.example.com/retry", doc.getDocUrl());
        assertNull(doc.getWorkKey());
        assertEquals("Retry runbook", doc.getTitle());

        EpisodeMember work = episode.getMembers().get(1);
        assertEquals("PROJ-42", work.getWorkKey());
        assertNull(work.getDocUrl());
        assertEquals(PROJECT, work.getProjectKey());
    }

    @Test
    @DisplayName("Unknown ids and non-cluster entities read as absent")
    void missingEpisode() {
        assertEquals(Optional.empty(), service.getEpisode(TENANT, PROJECT, "cluster:missing", "actor-1"));
        assertEquals(Optional.empty(), service.getEpisode(TENANT, PROJECT, "work-1", "actor-1"));
    }

    @Test
    @DisplayName("Fetching a cluster from another project is a scope mismatch")
    void getEpisodeFromOtherProjectFails() {
        // Given
        graph.upsertEntity(entity("cluster:other", EntityKind.CLUSTER.getEntityType(), TENANT, "OTHER",
                "projectKey", "OTHER"));

        // When / Then
        ScopeMismatchException error = assertThrows(ScopeMismatchException.class,
                () -> service.getEpisode(TENANT, PROJECT, "cluster:other", "actor-1"));
        assertEquals("cluster:other", error.getEntityId());
    }

    @Test
    @DisplayName("Another tenant sees no episodes and fails fetching a foreign cluster by id")
    void tenantIsolation() {
        // When
        EpisodeConnection listed = service.listEpisodes(EpisodeListRequest.builder()
                .tenantId("tenant-2").projectKey(PROJECT).build());

        // Then
        assertEquals(0, listed.getTotalCount());
        assertTrue(listed.getNodes().isEmpty());
        ScopeMismatchException error = assertThrows(ScopeMismatchException.class,
                () -> service.getEpisode("tenant-2", PROJECT, "cluster:a", "actor-1"));
        assertEquals("cluster:a", error.getEntityId());
        assertEquals(Optional.empty(), service.getEpisode("tenant-2", PROJECT, "cluster:missing", "actor-1"));
    }

    @Test
    @DisplayName("Listing silently drops clusters whose properties name another project")
    void listExcludesMismatchedClusters() {
        // Given: scope column says PROJ, property says OTHER
        graph.upsertEntity(entity("cluster:mixed", EntityKind.CLUSTER.getEntityType(), TENANT, PROJECT,
                "projectKey", "OTHER"));

        // When
        EpisodeConnection connection = service.listEpisodes(EpisodeListRequest.builder()
                .tenantId(TENANT).projectKey(PROJECT).build());

        // Then
        assertEquals(1, connection.getTotalCount());
        assertEquals("cluster:a", connection.getNodes().get(0).getId());
    }

    @Test
    @DisplayName("Pages are cut from the newest-first list and report the full count")
    void paginates() {
        // Given
        graph.upsertEntity(cluster("cluster:b", "2024-04-28T10:00:00Z"));
        graph.upsertEntity(cluster("cluster:c", "2024-05-01T10:00:00Z"));

        // When
        EpisodeConnection page = service.listEpisodes(EpisodeListRequest.builder()
                .tenantId(TENANT).projectKey(PROJECT).offset(1).limit(1).build());

        // Then
        assertEquals(3, page.getTotalCount());
        assertEquals(1, page.getNodes().size());
        assertEquals("cluster:a", page.getNodes().get(0).getId());
    }

    @Test
    @DisplayName("Offset past the end yields an empty page")
    void offsetPastEnd() {
        EpisodeConnection page = service.listEpisodes(EpisodeListRequest.builder()
                .tenantId(TENANT).projectKey(PROJECT).offset(10).limit(5).build());

        assertEquals(1, page.getTotalCount());
        assertTrue(page.getNodes().isEmpty());
    }

    @Test
    @DisplayName("Signals default severity and status and resolve each definition once")
    void hydratesSignals() {
        // Given
        signals.putDefinition(SignalDefinition.builder().id("def-1").slug("retry-storm").build());
        signals.putInstance(SignalInstance.builder().id("sig-1").definitionId("def-1").summary("Retries spiking").build());
        signals.putInstance(SignalInstance.builder().id("sig-2").definitionId("def-1").severity("HIGH").status("ACKED").build());
        graph.upsertEdge(edge(GraphEdge.HAS_SIGNAL, "work-1", "sig-1"));
        graph.upsertEdge(edge(GraphEdge.HAS_SIGNAL, "cluster:a", "sig-2"));

        // When
        Episode episode = service.getEpisode(TENANT, PROJECT, "cluster:a", "actor-1").orElseThrow();

        // Then
        assertEquals(2, episode.getSignals().size());
        EpisodeSignal first = episode.getSignals().stream().filter(s -> s.getId().equals("sig-1")).findFirst().orElseThrow();
        assertEquals(EpisodeSignal.DEFAULT_SEVERITY, first.getSeverity());
        assertEquals(EpisodeSignal.DEFAULT_STATUS, first.getStatus());
        assertEquals("retry-storm", first.getDefinitionSlug());
        assertEquals("Retries spiking", first.getSummary());

        EpisodeSignal second = episode.getSignals().stream().filter(s -> s.getId().equals("sig-2")).findFirst().orElseThrow();
        assertEquals("HIGH", second.getSeverity());
        assertEquals("ACKED", second.getStatus());
        assertEquals(1, signals.getDefinitionLookups());
    }

    @Test
    @DisplayName("Signals known only as graph nodes fall back to node properties")
    void signalFromGraphNode() {
        // Given
        graph.upsertEntity(entity("sig-9", EntityKind.SIGNAL.getEntityType(), TENANT, PROJECT,
                "severity", "WARN", "definitionId", "def-x"));
        graph.upsertEdge(edge(GraphEdge.HAS_SIGNAL, "doc-1", "sig-9"));

        // When
        Episode episode = service.getEpisode(TENANT, PROJECT, "cluster:a", "actor-1").orElseThrow();

        // Then
        EpisodeSignal signal = episode.getSignals().get(0);
        assertEquals("WARN", signal.getSeverity());
        assertEquals(EpisodeSignal.DEFAULT_STATUS, signal.getStatus());
        assertEquals("def-x", signal.getDefinitionSlug());
        assertEquals("SIG-9", signal.getSummary());
    }

    @Test
    @DisplayName("Blank tenant is rejected")
    void requiresTenant() {
        BrainValidationException error = assertThrows(BrainValidationException.class,
                () -> service.listEpisodes(EpisodeListRequest.builder().tenantId("").projectKey(PROJECT).build()));

        assertEquals("tenantId", error.getField());
    }
}
