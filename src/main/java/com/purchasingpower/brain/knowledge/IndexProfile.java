package com.purchasingpower.brain.knowledge;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Binds an entity type to an embedding model, a text-extraction rule and a kind tag.
 *
 * <p>Text extraction tries {@code textPath} (nested keys below {@code textFrom}),
 * then {@code textField}, then the common body fields.
 *
 * @since 2.0.0
 */
@Value
@Builder(toBuilder = true)
public class IndexProfile {

    String id;
    String family;
    String entityType;
    String embeddingModel;
    String profileKind;

    /** Optional property holding a nested object to read text from. */
    String textFrom;

    @Builder.Default
    List<String> textPath = List.of();

    String textField;

    @Builder.Default
    boolean enabled = true;
}
