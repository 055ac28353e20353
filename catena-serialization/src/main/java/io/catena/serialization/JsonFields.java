package io.catena.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/// Field readers shared by the tree-based deserializers.
final class JsonFields {

    static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
    static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private JsonFields() {}

    static String requireText(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Missing required field '" + field + "'");
        }
        return value.asText();
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }

    /// Reads a duration written as whole milliseconds.
    static Duration millis(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : Duration.ofMillis(value.asLong());
    }

    static Map<String, Object> objectMap(ObjectMapper mapper, JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? Map.of() : mapper.convertValue(value, OBJECT_MAP);
    }

    static Map<String, String> stringMap(ObjectMapper mapper, JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? Map.of() : mapper.convertValue(value, STRING_MAP);
    }
}
