package dev.pagestack.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.pagestack.engine.model.FieldTranslation;
import dev.pagestack.engine.model.SectionNode;
import dev.pagestack.util.JsonNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code {{namespace.key}}} placeholders with values from a {@link ScopeStore}.
 * <p>
 * Maps and lists render as key-sorted JSON, booleans as {@code true}/{@code false}, null as an
 * empty string. Placeholders whose path is not in the store are left untouched, so partially
 * available data degrades to visible placeholders instead of errors.
 */
@Component
public class InterpolationEngine {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    /**
     * Content fields eligible for interpolation. Everything else on a section is structural.
     */
    public static final Set<String> INTERPOLATED_FIELDS = Set.of(
            "text", "html", "markdown", "content", "label", "placeholder", "description", "name", "title",
            "alt", "url", "value",
            "btn_save_label", "btn_update_label", "btn_cancel_label", "btn_cancel_url",
            "alert_success", "alert_error", "redirect_at_end",
            "confirmation_title", "confirmation_continue", "confirmation_message");

    public String interpolate(String text, ScopeStore scope) {
        if (text == null || text.indexOf("{{") < 0) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String path = matcher.group(1).trim();
            String replacement = scope.has(path) ? render(scope.get(path)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Interpolates every string inside nested maps and lists; other values are returned as is.
     */
    public Object interpolateValue(Object value, ScopeStore scope) {
        if (value instanceof String text) {
            return interpolate(text, scope);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> result = new LinkedHashMap<>();
            map.forEach((key, nested) -> result.put(key, interpolateValue(nested, scope)));
            return result;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> result = new ArrayList<>(collection.size());
            collection.forEach(nested -> result.add(interpolateValue(nested, scope)));
            return result;
        }
        return value;
    }

    /**
     * Interpolates the eligible fields of one section: allow-listed content fields of the selected
     * language, the condition and both css variants. Children are left for their own pass.
     */
    public SectionNode interpolateSection(SectionNode node, ScopeStore scope) {
        Map<String, FieldTranslation> fields = new LinkedHashMap<>();
        node.fields().forEach((name, translation) -> fields.put(name, INTERPOLATED_FIELDS.contains(name)
                ? translation.withContent(interpolate(translation.content(), scope))
                : translation));
        return node.toBuilder()
                .fields(fields)
                .condition(interpolate(node.condition(), scope))
                .css(interpolate(node.css(), scope))
                .cssMobile(interpolate(node.cssMobile(), scope))
                .build();
    }

    static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        if (value instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return "";
            }
            return node.isContainerNode() ? JsonNormalizer.canonical(node) : node.asText();
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray()) {
            return JsonNormalizer.canonical(value);
        }
        return String.valueOf(value);
    }
}
