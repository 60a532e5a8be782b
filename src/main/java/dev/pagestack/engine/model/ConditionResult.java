package dev.pagestack.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outcome of a section condition together with the data needed to debug it in an editor:
 * the error (if any), the variables the expression looked up and the decoded expression.
 * Only ever attached to live render output.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionResult(
        boolean result,
        String error,
        Map<String, Object> variables,
        @JsonProperty("condition_object") JsonNode conditionObject
) {

    public static ConditionResult passed() {
        return new ConditionResult(true, null, Map.of(), null);
    }

    public static ConditionResult failed(String error) {
        return new ConditionResult(false, error, Map.of(), null);
    }
}
