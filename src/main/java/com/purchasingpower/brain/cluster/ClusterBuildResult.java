package com.purchasingpower.brain.cluster;

/**
 * @param clustersCreated clusters that did not exist before the run
 * @param membersLinked   membership edges written, including ones that already existed
 */
public record ClusterBuildResult(int clustersCreated, int membersLinked) {

    public static final ClusterBuildResult EMPTY = new ClusterBuildResult(0, 0);
}
