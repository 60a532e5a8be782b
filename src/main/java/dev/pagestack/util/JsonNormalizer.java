package dev.pagestack.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;

/**
 * Key-order independent views of JSON documents.
 * <p>
 * Every object is rebuilt with its keys in natural string order, at every depth; arrays keep their
 * element order. Two documents that differ only in property order normalize to identical text.
 */
public final class JsonNormalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonNormalizer() {
        // utility class
    }

    public static JsonNode sortRecursive(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                sorted.put(name, sortRecursive(node.get(name)));
            }
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            sorted.forEach(result::set);
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode(node.size());
            node.forEach(element -> result.add(sortRecursive(element)));
            return result;
        }
        return node;
    }

    /**
     * Compact, key-sorted serialization. Used for structure hashes and for rendering
     * maps and lists into interpolated text.
     */
    public static String canonical(JsonNode node) {
        return write(sortRecursive(node), false);
    }

    public static String canonical(Object value) {
        return canonical(MAPPER.valueToTree(value));
    }

    /**
     * Pretty-printed, key-sorted serialization used as the input of line based diffs.
     */
    public static String pretty(JsonNode node) {
        return write(sortRecursive(node), true);
    }

    /**
     * Structured differences between two documents after key sorting.
     */
    public static DifferenceSummary differenceSummary(JsonNode oldNode, JsonNode newNode) {
        JsonNode left = sortRecursive(oldNode);
        JsonNode right = sortRecursive(newNode);
        List<JsonChange> changes = new ArrayList<>();
        findChanges(left, right, "", changes);
        return new DifferenceSummary(changes.isEmpty(), changes);
    }

    private static void findChanges(JsonNode oldNode, JsonNode newNode, String path, List<JsonChange> changes) {
        if (oldNode.getNodeType() != newNode.getNodeType()) {
            changes.add(JsonChange.typeChange(path, oldNode, newNode));
            return;
        }
        if (oldNode.isObject()) {
            compareObjects(oldNode, newNode, path, changes);
            return;
        }
        if (oldNode.isArray()) {
            compareArrays(oldNode, newNode, path, changes);
            return;
        }
        if (!sameValue(oldNode, newNode)) {
            changes.add(JsonChange.valueChange(path, oldNode, newNode));
        }
    }

    /**
     * Numbers compare by value: a parsed snapshot holds {@code IntNode}s where the in-memory
     * one holds {@code LongNode}s.
     */
    private static boolean sameValue(JsonNode oldNode, JsonNode newNode) {
        if (oldNode.isNumber() && newNode.isNumber()) {
            return oldNode.decimalValue().compareTo(newNode.decimalValue()) == 0;
        }
        return oldNode.equals(newNode);
    }

    private static void compareObjects(JsonNode oldNode, JsonNode newNode, String path, List<JsonChange> changes) {
        newNode.fieldNames().forEachRemaining(name -> {
            if (!oldNode.has(name)) {
                changes.add(JsonChange.addition(child(path, name), newNode.get(name)));
            }
        });
        oldNode.fieldNames().forEachRemaining(name -> {
            if (!newNode.has(name)) {
                changes.add(JsonChange.removal(child(path, name), oldNode.get(name)));
            }
        });
        oldNode.fieldNames().forEachRemaining(name -> {
            if (newNode.has(name)) {
                findChanges(oldNode.get(name), newNode.get(name), child(path, name), changes);
            }
        });
    }

    private static void compareArrays(JsonNode oldNode, JsonNode newNode, String path, List<JsonChange> changes) {
        int common = Math.min(oldNode.size(), newNode.size());
        for (int i = oldNode.size(); i < newNode.size(); i++) {
            changes.add(JsonChange.addition(child(path, String.valueOf(i)), newNode.get(i)));
        }
        // highest index first, so the removals can be applied one after another
        for (int i = oldNode.size() - 1; i >= newNode.size(); i--) {
            changes.add(JsonChange.removal(child(path, String.valueOf(i)), oldNode.get(i)));
        }
        for (int i = 0; i < common; i++) {
            findChanges(oldNode.get(i), newNode.get(i), child(path, String.valueOf(i)), changes);
        }
    }

    private static String child(String path, String segment) {
        return path.isEmpty() ? segment : path + "." + segment;
    }

    private static String write(JsonNode node, boolean pretty) {
        try {
            return pretty
                    ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON document", e);
        }
    }

    public enum ChangeType {
        ADDITION,
        REMOVAL,
        VALUE_CHANGE,
        TYPE_CHANGE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * One difference at a dot-separated path; array indexes are path segments.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record JsonChange(
            String path,
            ChangeType type,
            JsonNode value,
            @JsonProperty("old_value") JsonNode oldValue,
            @JsonProperty("new_value") JsonNode newValue,
            @JsonProperty("old_type") String oldType,
            @JsonProperty("new_type") String newType
    ) {
        static JsonChange addition(String path, JsonNode value) {
            return new JsonChange(path, ChangeType.ADDITION, value, null, null, null, null);
        }

        static JsonChange removal(String path, JsonNode value) {
            return new JsonChange(path, ChangeType.REMOVAL, value, null, null, null, null);
        }

        static JsonChange valueChange(String path, JsonNode oldValue, JsonNode newValue) {
            return new JsonChange(path, ChangeType.VALUE_CHANGE, null, oldValue, newValue, null, null);
        }

        static JsonChange typeChange(String path, JsonNode oldValue, JsonNode newValue) {
            String oldType = oldValue.getNodeType().name().toLowerCase(Locale.ROOT);
            String newType = newValue.getNodeType().name().toLowerCase(Locale.ROOT);
            return new JsonChange(path, ChangeType.TYPE_CHANGE, null, oldValue, newValue, oldType, newType);
        }
    }

    public record DifferenceSummary(@JsonProperty("are_equal") boolean areEqual, List<JsonChange> changes) {
    }
}
