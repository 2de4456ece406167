package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PromptPack {

    String contextMarkdown;

    /** In hit order. */
    List<Citation> citations;
}
