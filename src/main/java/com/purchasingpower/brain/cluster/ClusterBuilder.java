package com.purchasingpower.brain.cluster;

/**
 * Groups related work and doc entities of a project into persisted clusters.
 *
 * <p>Cluster ids are derived from scope, window and member set, so rebuilding
 * the same data rewrites the same clusters instead of adding new ones.
 *
 * @since 2.0.0
 */
public interface ClusterBuilder {

    ClusterBuildResult buildClustersForProject(ClusterBuildRequest request);
}
