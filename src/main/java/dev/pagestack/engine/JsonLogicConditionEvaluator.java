package dev.pagestack.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.pagestack.engine.model.ConditionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates section conditions written in JsonLogic.
 * <p>
 * A {@code var} with a bare name ({@code user_group}) reads the {@code system} namespace first and
 * then the top-level namespaces; a dotted name ({@code orders.0.status}) reads the scope directly.
 * A condition that decodes to a JSON boolean is returned as is. Anything that cannot be
 * evaluated fails the condition and reports why in {@link ConditionResult#error()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonLogicConditionEvaluator implements ConditionEvaluator {

    private final ObjectMapper objectMapper;

    @Override
    public ConditionResult evaluate(String condition, Long userId, String sectionKeyword, ScopeStore scope) {
        if (condition == null || condition.isBlank()) {
            return ConditionResult.passed();
        }

        JsonNode expression;
        try {
            expression = ConditionDecoder.decode(condition);
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON condition in section '{}': {}", sectionKeyword, e.getOriginalMessage());
            return ConditionResult.failed("Invalid JSON condition in section '" + sectionKeyword + "': "
                    + e.getOriginalMessage());
        }

        if (expression.isBoolean()) {
            return new ConditionResult(expression.booleanValue(), null, Map.of(), expression);
        }
        if (!expression.isContainerNode()) {
            return new ConditionResult(false,
                    "Condition must be a JSON object or array in section '" + sectionKeyword + "', got " + expression,
                    Map.of(), expression);
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        try {
            JsonNode outcome = new Run(scope, userId, variables).evaluate(expression);
            return new ConditionResult(ConditionOperator.truthy(outcome), null, variables, expression);
        } catch (RuntimeException e) {
            log.debug("Condition evaluation failed in section '{}': {}", sectionKeyword, e.getMessage());
            return new ConditionResult(false,
                    "Condition evaluation failed in section '" + sectionKeyword + "': " + e.getMessage(),
                    variables, expression);
        }
    }

    /**
     * One evaluation; records every variable lookup for the trace.
     */
    private final class Run implements ConditionOperator.Evaluation {

        private final ScopeStore scope;
        private final Long userId;
        private final Map<String, Object> variables;

        private Run(ScopeStore scope, Long userId, Map<String, Object> variables) {
            this.scope = scope;
            this.userId = userId;
            this.variables = variables;
        }

        @Override
        public JsonNode evaluate(JsonNode expression) {
            if (expression.isArray()) {
                List<JsonNode> values = new ArrayList<>(expression.size());
                expression.forEach(element -> values.add(evaluate(element)));
                return objectMapper.valueToTree(values);
            }
            if (!expression.isObject()) {
                return expression;
            }
            if (expression.size() != 1) {
                throw new IllegalArgumentException("Operation objects must have exactly one key, got " + expression.size());
            }
            String symbol = expression.fieldNames().next();
            JsonNode rawArgs = expression.get(symbol);
            List<JsonNode> args = new ArrayList<>();
            if (rawArgs.isArray()) {
                rawArgs.forEach(args::add);
            } else {
                args.add(rawArgs);
            }
            return ConditionOperator.fromSymbol(symbol).apply(args, this);
        }

        @Override
        public JsonNode variable(String name, JsonNode fallback) {
            Object value = null;
            boolean found = false;
            if (name.contains(".")) {
                found = scope.has(name);
                value = scope.get(name);
            } else {
                String systemPath = ScopeStore.SYSTEM + "." + name;
                if (scope.has(systemPath)) {
                    found = true;
                    value = scope.get(systemPath);
                } else if (scope.has(name)) {
                    found = true;
                    value = scope.get(name);
                } else if ("user_id".equals(name) && userId != null) {
                    found = true;
                    value = userId;
                }
            }
            variables.put(name, found ? value : null);
            if (!found || value == null) {
                return fallback != null ? fallback : JsonNodeFactory.instance.nullNode();
            }
            return objectMapper.valueToTree(value);
        }
    }
}
