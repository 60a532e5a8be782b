package dev.pagestack.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Raw JSON text stored in a JSONB column (TEXT on H2).
 * Kept as text so the stored document is returned exactly as it was written.
 */
public final class JsonDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String json;

    private JsonDocument(String json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    public static JsonDocument of(String json) {
        return new JsonDocument(json);
    }

    public static JsonDocument of(JsonNode node) {
        return new JsonDocument(node.toString());
    }

    public String asString() {
        return json;
    }

    public JsonNode asTree() {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonDocument other && json.equals(other.json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        return json;
    }
}
