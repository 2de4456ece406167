package com.purchasingpower.brain;

import com.purchasingpower.brain.cluster.ClusterBuildRequest;
import com.purchasingpower.brain.cluster.ClusterBuildResult;
import com.purchasingpower.brain.cluster.ClusterBuilder;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.episode.Episode;
import com.purchasingpower.brain.episode.EpisodeConnection;
import com.purchasingpower.brain.episode.EpisodeListRequest;
import com.purchasingpower.brain.episode.EpisodeMember;
import com.purchasingpower.brain.episode.EpisodeReadService;
import com.purchasingpower.brain.exception.ScopeMismatchException;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.purchasingpower.brain.knowledge.NodeIndexer;
import com.purchasingpower.brain.search.BrainSearchFilter;
import com.purchasingpower.brain.search.BrainSearchHit;
import com.purchasingpower.brain.search.BrainSearchRequest;
import com.purchasingpower.brain.search.BrainSearchResult;
import com.purchasingpower.brain.search.BrainSearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static com.purchasingpower.brain.support.BrainFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ═══════════════════════════════════════════════════════════════════
 * END-TO-END ON THE DEFAULT WIRING
 * ═══════════════════════════════════════════════════════════════════
 *
 * In-memory graph and vector stores with the hashing embedder: index,
 * cluster, read episodes and search without any external service.
 */
@SpringBootTest
@DisplayName("Brain Application Tests")
class BrainApplicationTests {

    @Autowired
    private GraphStore graphStore;

    @Autowired
    private NodeIndexer nodeIndexer;

    @Autowired
    private ClusterBuilder clusterBuilder;

    @Autowired
    private EpisodeReadService episodeReadService;

    @Autowired
    private BrainSearchService brainSearchService;

    @Test
    @DisplayName("Indexed work items cluster into an episode that search finds")
    void indexClusterReadAndSearch() {
        // Given
        String tenant = "it-tenant";
        graphStore.upsertEntity(entity("it-work-1", "cdm.work.item", tenant, PROJECT,
                "summary", "checkout retry fails", "updatedAt", "2024-04-30T10:00:00Z"));
        graphStore.upsertEntity(entity("it-work-2", "cdm.work.item", tenant, PROJECT,
                "summary", "checkout retry timeout", "updatedAt", "2024-04-29T10:00:00Z"));
        graphStore.upsertEntity(entity("it-doc-1", "cdm.doc.item", tenant, PROJECT,
                "body", "checkout retry runbook", "sourceUrl", "https://wiki.example.com/retry"));

        TenantScope scope = TenantScope.of(tenant, PROJECT);
        assertEquals(2, nodeIndexer.indexNodesForProfile("cdm.work.summary", scope, null, null));
        assertEquals(1, nodeIndexer.indexNodesForProfile("cdm.doc.body", scope, null, null));

        // When: cluster
        ClusterBuildResult built = clusterBuilder.buildClustersForProject(ClusterBuildRequest.builder()
                .tenantId(tenant).projectKey(PROJECT).build());

        // Then
        assertEquals(1, built.clustersCreated());
        assertEquals(2, built.membersLinked());

        // When: read episodes
        EpisodeConnection episodes = episodeReadService.listEpisodes(EpisodeListRequest.builder()
                .tenantId(tenant).projectKey(PROJECT).actorId("actor-1").build());

        // Then
        assertEquals(1, episodes.getTotalCount());
        Episode episode = episodes.getNodes().get(0);
        assertEquals(List.of("it-work-1", "it-work-2"),
                episode.getMembers().stream().map(EpisodeMember::getNodeId).toList());

        // When: search
        BrainSearchResult result = brainSearchService.search(BrainSearchRequest.builder()
                .queryText("checkout retry")
                .filter(BrainSearchFilter.builder().tenantId(tenant).projectKey(PROJECT).build())
                .actorId("actor-1")
                .build());

        // Then
        assertEquals(3, result.getHits().size());
        assertTrue(result.getHits().stream().map(BrainSearchHit::getNodeId).toList().contains("it-doc-1"));
        assertEquals(1, result.getEpisodes().size());
        assertEquals(episode.getId(), result.getEpisodes().get(0).getClusterNodeId());
        assertTrue(result.getPromptPack().getContextMarkdown().startsWith("# Brain Search Context\nQuery: checkout retry"));
    }

    @Test
    @DisplayName("Clusters built for one tenant stay invisible to another")
    void tenantIsolation() {
        // Given
        String owner = "iso-tenant-a";
        String other = "iso-tenant-b";
        graphStore.upsertEntity(entity("iso-work-1", "cdm.work.item", owner, PROJECT,
                "summary", "invoice export stalls", "updatedAt", "2024-04-30T10:00:00Z"));
        graphStore.upsertEntity(entity("iso-work-2", "cdm.work.item", owner, PROJECT,
                "summary", "invoice export timeout", "updatedAt", "2024-04-29T10:00:00Z"));
        assertEquals(2, nodeIndexer.indexNodesForProfile("cdm.work.summary", TenantScope.of(owner, PROJECT), null, null));
        assertEquals(1, clusterBuilder.buildClustersForProject(ClusterBuildRequest.builder()
                .tenantId(owner).projectKey(PROJECT).build()).clustersCreated());
        String clusterId = episodeReadService.listEpisodes(EpisodeListRequest.builder()
                .tenantId(owner).projectKey(PROJECT).build()).getNodes().get(0).getId();

        // When
        EpisodeConnection listed = episodeReadService.listEpisodes(EpisodeListRequest.builder()
                .tenantId(other).projectKey(PROJECT).actorId("actor-2").build());
        BrainSearchResult result = brainSearchService.search(BrainSearchRequest.builder()
                .queryText("invoice export")
                .filter(BrainSearchFilter.builder().tenantId(other).projectKey(PROJECT).build())
                .actorId("actor-2")
                .build());

        // Then
        assertEquals(0, listed.getTotalCount());
        assertThrows(ScopeMismatchException.class,
                () -> episodeReadService.getEpisode(other, PROJECT, clusterId, "actor-2"));
        assertTrue(result.getHits().isEmpty());
        assertTrue(result.getEpisodes().isEmpty());
        assertTrue(result.getGraphNodes().isEmpty());
    }
}
