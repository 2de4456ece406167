package com.purchasingpower.brain.episode;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class Episode {
    String id;
    String tenantId;
    String projectKey;
    String clusterKind;
    int size;
    Instant createdAt;
    Instant updatedAt;
    Instant windowStart;
    Instant windowEnd;
    String summary;
    List<EpisodeMember> members;
    List<EpisodeSignal> signals;
}
