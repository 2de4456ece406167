package com.purchasingpower.brain.episode;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one cluster member. {@code workKey} is only set for work items,
 * {@code docUrl} only for documents.
 */
@Value
@Builder
public class EpisodeMember {
    String nodeId;
    String nodeType;
    String entityKind;
    String cdmModelId;
    String title;
    String summary;
    String projectKey;
    String workKey;
    String docUrl;
}
