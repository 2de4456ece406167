package com.purchasingpower.brain.episode;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EpisodeConnection {

    public static final EpisodeConnection EMPTY = EpisodeConnection.builder().nodes(List.of()).totalCount(0).build();

    List<Episode> nodes;

    /** Size of the whole scoped set, not of this page. */
    int totalCount;
}
