package com.purchasingpower.brain.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Tuning for episode clustering.
 *
 * <pre>
 * brain:
 *   cluster:
 *     score-threshold: 0.35
 *     max-neighbors: 5
 *     schedule:
 *       enabled: true
 *       cron: "0 0 * * * *"
 *       targets:
 *         - tenant-id: acme
 *           project-key: PAY
 * </pre>
 */
@Data
public class ClusterProperties {

    @NotBlank
    private String clusterKind = "work-doc-episode";

    @NotBlank
    private String algo = "vector-neighbors-v1";

    /** Neighbours scoring strictly below this are not admitted. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double scoreThreshold = 0.35;

    @Min(1)
    private int maxNeighbors = 5;

    @Min(1)
    @Max(200)
    private int defaultMaxSeeds = 25;

    @Min(2)
    private int defaultMaxClusterSize = 5;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Schedule schedule = new Schedule();

    @Data
    public static class Schedule {

        private boolean enabled = false;

        @NotBlank
        private String cron = "0 0 * * * *";

        @Valid
        private List<Target> targets = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Target {

        @NotBlank
        private String tenantId;

        @NotBlank
        private String projectKey;
    }
}
