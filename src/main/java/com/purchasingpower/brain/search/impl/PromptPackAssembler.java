package com.purchasingpower.brain.search.impl;

import com.purchasingpower.brain.search.BrainSearchHit;
import com.purchasingpower.brain.search.Citation;
import com.purchasingpower.brain.search.EpisodeHit;
import com.purchasingpower.brain.search.PromptPack;
import com.purchasingpower.brain.search.RagPassage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders search results as a markdown context block plus citations.
 *
 * <p>Output depends only on the arguments: no clock, no locale, no hash
 * ordering. Sections appear as header, query, episodes, hits, passages; empty
 * sections are omitted.
 */
class PromptPackAssembler {

    static final String HEADER = "# Brain Search Context";

    PromptPack assemble(String queryText, List<BrainSearchHit> hits, List<EpisodeHit> episodes,
                        List<RagPassage> passages) {
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add("Query: " + queryText);

        if (!episodes.isEmpty()) {
            lines.add("Episodes:");
            for (int i = 0; i < episodes.size(); i++) {
                EpisodeHit episode = episodes.get(i);
                lines.add(String.format(Locale.ROOT, "%d. %s [%s] score=%.3f members=%s",
                        i + 1, episode.getClusterNodeId(), episode.getClusterKind(), episode.getScore(),
                        String.join(",", episode.getMemberNodeIds())));
            }
        }
        if (!hits.isEmpty()) {
            lines.add("Hits:");
            for (int i = 0; i < hits.size(); i++) {
                BrainSearchHit hit = hits.get(i);
                String title = hit.getTitle() != null ? hit.getTitle() : hit.getNodeId();
                lines.add(String.format(Locale.ROOT, "%d. %s (%s) score=%.3f id=%s",
                        i + 1, title, hit.getNodeType(), hit.getScore(), hit.getNodeId()));
            }
        }
        if (!passages.isEmpty()) {
            lines.add("Passages:");
            for (int i = 0; i < passages.size(); i++) {
                RagPassage passage = passages.get(i);
                lines.add((i + 1) + ". (" + passage.getSourceKind() + ") " + passage.getText());
            }
        }

        List<Citation> citations = hits.stream()
                .map(hit -> new Citation(hit.getNodeId(), hit.getUrl(), hit.getTitle(), hit.getNodeType()))
                .toList();
        return PromptPack.builder()
                .contextMarkdown(String.join("\n", lines))
                .citations(citations)
                .build();
    }
}
