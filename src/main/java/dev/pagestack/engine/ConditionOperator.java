package dev.pagestack.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Iterator;
import java.util.List;

/**
 * JsonLogic operators understood by {@link JsonLogicConditionEvaluator}. Arguments arrive
 * unevaluated so that {@code and}, {@code or} and {@code if} can short-circuit.
 */
enum ConditionOperator {

    VAR("var") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            JsonNode name = args.isEmpty() ? TextNode.valueOf("") : evaluation.evaluate(args.get(0));
            JsonNode fallback = args.size() > 1 ? evaluation.evaluate(args.get(1)) : null;
            return evaluation.variable(name.asText(), fallback);
        }
    },
    EQUALS("==") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(looseEquals(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))));
        }
    },
    NOT_EQUALS("!=") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(!looseEquals(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))));
        }
    },
    STRICT_EQUALS("===") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(strictEquals(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))));
        }
    },
    STRICT_NOT_EQUALS("!==") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(!strictEquals(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))));
        }
    },
    LESS("<") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(ordered(args, evaluation, false));
        }
    },
    LESS_OR_EQUAL("<=") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(ordered(args, evaluation, true));
        }
    },
    GREATER(">") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(compare(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))) > 0);
        }
    },
    GREATER_OR_EQUAL(">=") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(compare(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))) >= 0);
        }
    },
    NOT("!") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(!truthy(evaluation.evaluate(arg(args, 0))));
        }
    },
    DOUBLE_NOT("!!") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(truthy(evaluation.evaluate(arg(args, 0))));
        }
    },
    AND("and") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            JsonNode last = BooleanNode.TRUE;
            for (JsonNode arg : args) {
                last = evaluation.evaluate(arg);
                if (!truthy(last)) {
                    return last;
                }
            }
            return last;
        }
    },
    OR("or") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            JsonNode last = BooleanNode.FALSE;
            for (JsonNode arg : args) {
                last = evaluation.evaluate(arg);
                if (truthy(last)) {
                    return last;
                }
            }
            return last;
        }
    },
    IN("in") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(contains(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))));
        }
    },
    NOT_IN("notIn") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            return bool(!contains(evaluation.evaluate(arg(args, 0)), evaluation.evaluate(arg(args, 1))));
        }
    },
    /** {@code [cond1, then1, cond2, then2, ..., else]} */
    IF("if") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            int i = 0;
            for (; i + 1 < args.size(); i += 2) {
                if (truthy(evaluation.evaluate(args.get(i)))) {
                    return evaluation.evaluate(args.get(i + 1));
                }
            }
            return i < args.size() ? evaluation.evaluate(args.get(i)) : JsonNodeFactory.instance.nullNode();
        }
    },
    CAT("cat") {
        @Override
        JsonNode apply(List<JsonNode> args, Evaluation evaluation) {
            StringBuilder joined = new StringBuilder();
            args.forEach(arg -> joined.append(asString(evaluation.evaluate(arg))));
            return TextNode.valueOf(joined.toString());
        }
    };

    private final String symbol;

    ConditionOperator(String symbol) {
        this.symbol = symbol;
    }

    abstract JsonNode apply(List<JsonNode> args, Evaluation evaluation);

    static ConditionOperator fromSymbol(String symbol) {
        for (ConditionOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unrecognized operation " + symbol);
    }

    /**
     * Evaluation callbacks supplied by the evaluator.
     */
    interface Evaluation {
        JsonNode evaluate(JsonNode expression);

        JsonNode variable(String name, JsonNode fallback);
    }

    /**
     * JsonLogic truthiness: false, null, 0, "" and [] are false.
     */
    static boolean truthy(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        if (value.isArray()) {
            return value.size() > 0;
        }
        return true;
    }

    private static JsonNode arg(List<JsonNode> args, int index) {
        return index < args.size() ? args.get(index) : JsonNodeFactory.instance.nullNode();
    }

    private static JsonNode bool(boolean value) {
        return BooleanNode.valueOf(value);
    }

    private static boolean ordered(List<JsonNode> args, Evaluation evaluation, boolean inclusive) {
        JsonNode a = evaluation.evaluate(arg(args, 0));
        JsonNode b = evaluation.evaluate(arg(args, 1));
        boolean first = inclusive ? compare(a, b) <= 0 : compare(a, b) < 0;
        if (args.size() < 3) {
            return first;
        }
        // between form: a < b < c
        JsonNode c = evaluation.evaluate(args.get(2));
        return first && (inclusive ? compare(b, c) <= 0 : compare(b, c) < 0);
    }

    private static boolean looseEquals(JsonNode a, JsonNode b) {
        if (isNull(a) || isNull(b)) {
            return isNull(a) && isNull(b);
        }
        Double left = asNumber(a);
        Double right = asNumber(b);
        if (left != null && right != null && (a.isNumber() || b.isNumber() || a.isBoolean() || b.isBoolean())) {
            return left.doubleValue() == right.doubleValue();
        }
        return asString(a).equals(asString(b));
    }

    private static boolean strictEquals(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.doubleValue() == b.doubleValue();
        }
        return a.equals(b);
    }

    private static int compare(JsonNode a, JsonNode b) {
        Double left = asNumber(a);
        Double right = asNumber(b);
        if (left != null && right != null) {
            return Double.compare(left, right);
        }
        return asString(a).compareTo(asString(b));
    }

    private static boolean contains(JsonNode needle, JsonNode haystack) {
        if (haystack.isArray()) {
            if (needle.isArray()) {
                // query builder form: any selected value present in the field's values
                for (JsonNode candidate : needle) {
                    if (arrayContains(haystack, candidate)) {
                        return true;
                    }
                }
                return false;
            }
            return arrayContains(haystack, needle);
        }
        if (needle.isArray()) {
            return arrayContains(needle, haystack);
        }
        if (haystack.isTextual()) {
            return haystack.textValue().contains(asString(needle));
        }
        return false;
    }

    private static boolean arrayContains(JsonNode array, JsonNode value) {
        Iterator<JsonNode> elements = array.elements();
        while (elements.hasNext()) {
            if (looseEquals(elements.next(), value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNull(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    private static Double asNumber(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? 1.0 : 0.0;
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String asString(JsonNode value) {
        if (isNull(value)) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
