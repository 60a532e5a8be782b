package dev.pagestack.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Conditions are stored as JSON text that is sometimes itself JSON-encoded as a string
 * (several times over). This peels those layers off.
 */
public final class ConditionDecoder {

    static final int MAX_DECODE_DEPTH = 5;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConditionDecoder() {
        // utility class
    }

    /**
     * Decodes the condition text, unwrapping up to {@value #MAX_DECODE_DEPTH} nested string encodings.
     *
     * @throws JsonProcessingException when the outermost text is not valid JSON
     */
    public static JsonNode decode(String condition) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(condition);
        for (int depth = 0; depth < MAX_DECODE_DEPTH && node != null && node.isTextual(); depth++) {
            try {
                node = MAPPER.readTree(node.textValue());
            } catch (JsonProcessingException e) {
                // the string is the condition itself, keep it
                break;
            }
        }
        return node;
    }

    /**
     * Tree-build normalization: returns the innermost JSON text when the stored value is a
     * string-encoded document, otherwise the input unchanged. Invalid JSON is kept verbatim so
     * that evaluation can report it.
     */
    public static String normalize(String condition) {
        if (condition == null || condition.isBlank()) {
            return condition;
        }
        try {
            JsonNode decoded = decode(condition);
            if (decoded == null || decoded.isTextual()) {
                return condition;
            }
            return MAPPER.writeValueAsString(decoded);
        } catch (JsonProcessingException e) {
            return condition;
        }
    }
}
