package com.purchasingpower.brain.cluster;

import com.purchasingpower.brain.configuration.BrainProperties;
import com.purchasingpower.brain.configuration.ClusterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically rebuilds clusters for the configured tenant/project targets.
 *
 * <p>A failing target is logged and skipped; the remaining targets still run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "brain.cluster.schedule.enabled", havingValue = "true")
public class ClusterBuildScheduler {

    private final ClusterBuilder clusterBuilder;
    private final BrainProperties properties;

    @Scheduled(cron = "${brain.cluster.schedule.cron:0 0 * * * *}")
    public void rebuildAll() {
        ClusterProperties.Schedule schedule = properties.getCluster().getSchedule();
        log.info("⏰ Scheduled cluster rebuild for {} targets", schedule.getTargets().size());
        for (ClusterProperties.Target target : schedule.getTargets()) {
            try {
                ClusterBuildResult result = clusterBuilder.buildClustersForProject(ClusterBuildRequest.builder()
                        .tenantId(target.getTenantId())
                        .projectKey(target.getProjectKey())
                        .build());
                log.info("✅ {}/{}: {} clusters created, {} members linked",
                        target.getTenantId(), target.getProjectKey(),
                        result.clustersCreated(), result.membersLinked());
            } catch (RuntimeException e) {
                log.error("❌ Cluster rebuild failed for {}/{}: {}",
                        target.getTenantId(), target.getProjectKey(), e.getMessage(), e);
            }
        }
    }
}
