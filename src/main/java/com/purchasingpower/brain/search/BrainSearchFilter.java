package com.purchasingpower.brain.search;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BrainSearchFilter {

    String tenantId;

    /** Null searches every project of the tenant. */
    String projectKey;

    @Builder.Default
    List<String> profileKindIn = List.of();

    /** Anything but an explicit false keeps secured entities hidden. */
    Boolean secured;

    public boolean enforcesSecured() {
        return !Boolean.FALSE.equals(secured);
    }
}
