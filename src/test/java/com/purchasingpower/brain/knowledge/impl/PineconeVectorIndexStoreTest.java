package com.purchasingpower.brain.knowledge.impl;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.brain.configuration.PineconeProperties;
import com.purchasingpower.brain.knowledge.VectorQueryFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pinecone Vector Index Tests")
class PineconeVectorIndexStoreTest {

    @Test
    @DisplayName("Query filter always pins the profile and adds the scope clauses given")
    void buildsMetadataFilter() {
        // When
        Struct filter = PineconeVectorIndexStore.buildFilter("cdm.work.summary", VectorQueryFilter.builder()
                .tenantId("t1")
                .projectKeyIn(List.of("PROJ", "OPS"))
                .build());

        // Then
        assertEquals("cdm.work.summary", operand(filter, "profileId", "$eq").getStringValue());
        assertEquals("t1", operand(filter, "tenantId", "$eq").getStringValue());
        List<Value> projects = operand(filter, "projectKey", "$in").getListValue().getValuesList();
        assertEquals(List.of("PROJ", "OPS"), projects.stream().map(Value::getStringValue).toList());
        assertFalse(filter.containsFields("profileKind"));
    }

    @Test
    @DisplayName("Without a filter only the profile is pinned")
    void profileOnly() {
        Struct filter = PineconeVectorIndexStore.buildFilter("cdm.doc.body", null);

        assertEquals(1, filter.getFieldsCount());
    }

    @Test
    @DisplayName("Missing api key fails fast")
    void requiresApiKey() {
        PineconeProperties properties = new PineconeProperties();
        properties.setIndexName("kg-brain");

        assertThrows(IllegalArgumentException.class, () -> new PineconeVectorIndexStore(properties, 8));
    }

    private static Value operand(Struct filter, String field, String op) {
        return filter.getFieldsOrThrow(field).getStructValue().getFieldsOrThrow(op);
    }
}
