package com.purchasingpower.brain.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
public class SearchProperties {

    /** Profiles queried by every brain search, merged by best score. */
    @Valid
    @NotEmpty
    private List<DefaultProfile> defaultProfiles = new ArrayList<>(List.of(
            new DefaultProfile("cdm.work.summary", "work"),
            new DefaultProfile("cdm.doc.body", "doc")));

    @Min(1000)
    private int maxPassageCharacters = 30_000;

    @Min(200)
    private int maxPassagePerNode = 2_000;

    /** Project key reported when a search is not restricted to a project. */
    @NotBlank
    private String defaultProjectKey = "global";

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DefaultProfile {

        @NotBlank
        private String profileId;

        private String profileKind;
    }
}
