package com.purchasingpower.brain.knowledge;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SignalInstance {
    String id;
    String definitionId;

    /** Embedded definition when the store joins it; may be null. */
    SignalDefinition definition;

    String severity;
    String status;
    String summary;
}
