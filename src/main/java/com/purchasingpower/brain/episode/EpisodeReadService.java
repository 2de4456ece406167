package com.purchasingpower.brain.episode;

import java.util.Optional;

/**
 * Read-only episode views over persisted clusters.
 *
 * <p>Episodes are rebuilt from the graph on every call and never stored.
 *
 * @since 2.0.0
 */
public interface EpisodeReadService {

    /**
     * One page of the project's episodes, newest first. Clusters whose own
     * tenant or project disagrees with the request are left out silently.
     */
    EpisodeConnection listEpisodes(EpisodeListRequest request);

    /**
     * @return empty when no cluster has this id
     * @throws com.purchasingpower.brain.exception.ScopeMismatchException when the cluster belongs elsewhere
     */
    Optional<Episode> getEpisode(String tenantId, String projectKey, String id, String actorId);
}
