package com.purchasingpower.brain.knowledge;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SignalDefinition {
    String id;
    String slug;
    String title;
    String severity;
}
