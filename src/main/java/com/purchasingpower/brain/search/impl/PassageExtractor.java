package com.purchasingpower.brain.search.impl;

import com.purchasingpower.brain.core.EntityKind;
import com.purchasingpower.brain.core.EntityProperties;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.search.BrainSearchHit;
import com.purchasingpower.brain.search.RagPassage;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cuts one text passage per hit, in rank order, until the character budget runs out.
 */
@RequiredArgsConstructor
class PassageExtractor {

    private static final String[] TEXT_FIELDS = {"summary", "description", "body", "text", "content", "title"};

    private final int maxTotalCharacters;
    private final int maxPerNode;

    List<RagPassage> extract(List<BrainSearchHit> hits, Map<String, GraphEntity> nodes) {
        List<RagPassage> passages = new ArrayList<>();
        int remaining = maxTotalCharacters;
        for (BrainSearchHit hit : hits) {
            if (remaining <= 0) {
                break;
            }
            GraphEntity node = nodes.get(hit.getNodeId());
            if (node == null) {
                continue;
            }
            String text = passageText(node);
            if (text == null) {
                continue;
            }
            String snippet = text.substring(0, Math.min(text.length(), Math.min(maxPerNode, remaining)));
            passages.add(RagPassage.builder()
                    .sourceNodeId(hit.getNodeId())
                    .sourceKind(sourceKind(node, hit))
                    .text(snippet)
                    .url(BrainSearchServiceImpl.resolveUrl(node))
                    .build());
            remaining -= snippet.length();
        }
        return passages;
    }

    private static String passageText(GraphEntity node) {
        EntityProperties props = node.props();
        for (String field : TEXT_FIELDS) {
            if (props.raw(field) instanceof String value && !value.isBlank()) {
                return value;
            }
        }
        String displayName = node.getDisplayName();
        return displayName != null && !displayName.isBlank() ? displayName : null;
    }

    private static String sourceKind(GraphEntity node, BrainSearchHit hit) {
        if (node.kind() != EntityKind.OTHER) {
            return node.kind().getProfileKind();
        }
        return hit.getProfileKind() != null ? hit.getProfileKind() : EntityKind.OTHER.getProfileKind();
    }
}
