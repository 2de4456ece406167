package com.purchasingpower.brain.search;

public record Citation(String sourceNodeId, String url, String title, String nodeType) {
}
