package com.toolhub.tools.spec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParameterSchemaTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SCHEMA_JSON = """
            {
              "type": "object",
              "properties": {
                "query": {"type": "string", "description": "Search terms"},
                "limit": {"type": "integer", "required": true},
                "sort": {"type": "string", "enum": ["relevance", "date"]},
                "filters": {"type": "object", "properties": {"year": {"type": "integer"}}, "required": ["year"]},
                "note": {"type": ["string", "null"]}
              },
              "required": ["query"]
            }
            """;

    @Test
    void fromJson_readsPropertiesInDeclarationOrder() throws Exception {
        ParameterSchema schema = MAPPER.readValue(SCHEMA_JSON, ParameterSchema.class);

        assertEquals(List.of("query", "limit", "sort", "filters", "note"), List.copyOf(schema.getParameters().keySet()));
        assertEquals(List.of(ParameterKind.STRING), schema.get("query").orElseThrow().getKinds());
        assertEquals("Search terms", schema.get("query").orElseThrow().getDescription());
        assertEquals(List.of("relevance", "date"), schema.get("sort").orElseThrow().getEnumValues());
        assertEquals(List.of(ParameterKind.STRING, ParameterKind.NULL), schema.get("note").orElseThrow().getKinds());
    }

    @Test
    void fromJson_honorsBothRequiredStyles() throws Exception {
        ParameterSchema schema = MAPPER.readValue(SCHEMA_JSON, ParameterSchema.class);

        assertEquals(List.of("query", "limit"), schema.getRequiredNames());
        assertFalse(schema.get("filters").orElseThrow().isRequired());
    }

    @Test
    void fromJson_requiredNameWithoutPropertyBecomesUntypedParameter() throws Exception {
        ParameterSchema schema = MAPPER.readValue("{\"required\":[\"text\"]}", ParameterSchema.class);

        ParameterSpec text = schema.get("text").orElseThrow();
        assertTrue(text.isRequired());
        assertTrue(text.getKinds().isEmpty());
        assertTrue(text.acceptsKind(42));
    }

    @Test
    void toJson_writesCatalogShape() throws Exception {
        ParameterSchema schema = ParameterSchema.of(
                ParameterSpec.required("text", ParameterKind.STRING),
                ParameterSpec.optional("count", ParameterKind.INTEGER));

        @SuppressWarnings("unchecked")
        Map<String, Object> json = MAPPER.readValue(MAPPER.writeValueAsString(schema), Map.class);

        assertEquals("object", json.get("type"));
        assertEquals(List.of("text"), json.get("required"));
        assertEquals(Map.of("type", "string"), ((Map<?, ?>) json.get("properties")).get("text"));
    }

    @Test
    void duplicateParameterNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ParameterSchema.of(
                ParameterSpec.required("text", ParameterKind.STRING),
                ParameterSpec.optional("text", ParameterKind.NUMBER)));
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(Exception.class, () -> MAPPER.readValue(
                "{\"properties\":{\"x\":{\"type\":\"date\"}}}", ParameterSchema.class));
    }
}
