package com.purchasingpower.brain.configuration;

import com.purchasingpower.brain.knowledge.IndexProfile;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ProfileProperties {

    @NotBlank
    private String id;

    private String family;

    @NotBlank
    private String entityType;

    /** Falls back to {@code brain.embedding.model} when blank. */
    private String embeddingModel;

    @NotBlank
    private String profileKind;

    private String textFrom;

    private List<String> textPath = new ArrayList<>();

    private String textField;

    private boolean enabled = true;

    public IndexProfile toProfile(String defaultModel) {
        return IndexProfile.builder()
                .id(id)
                .family(family)
                .entityType(entityType)
                .embeddingModel(embeddingModel == null || embeddingModel.isBlank() ? defaultModel : embeddingModel)
                .profileKind(profileKind)
                .textFrom(textFrom)
                .textPath(List.copyOf(textPath))
                .textField(textField)
                .enabled(enabled)
                .build();
    }

    static List<ProfileProperties> defaults() {
        return List.of(
                profile("cdm.work.summary", "cdm.work", "cdm.work.item", "work", "summary"),
                profile("cdm.doc.body", "cdm.doc", "cdm.doc.item", "doc", "body"));
    }

    private static ProfileProperties profile(String id, String family, String entityType, String kind, String field) {
        ProfileProperties profile = new ProfileProperties();
        profile.setId(id);
        profile.setFamily(family);
        profile.setEntityType(entityType);
        profile.setProfileKind(kind);
        profile.setTextField(field);
        return profile;
    }
}
