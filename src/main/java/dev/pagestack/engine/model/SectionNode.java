package dev.pagestack.engine.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable node of a page's section tree.
 * <p>
 * {@code translations} holds every stored language ({@code languageId -> fieldName -> value});
 * {@code fields} is the view selected for one working language and is empty until a language
 * has been selected. {@code dataConfig} keeps the stored text so snapshots can reproduce it,
 * {@code dataSources} is its decoded form.
 */
@Builder(toBuilder = true)
public record SectionNode(
        Long id,
        String name,
        String styleName,
        int position,
        String condition,
        String dataConfig,
        List<DataSourceDeclaration> dataSources,
        boolean dataConfigMalformed,
        String css,
        String cssMobile,
        boolean debug,
        Map<Long, Map<String, FieldTranslation>> translations,
        Map<String, FieldTranslation> fields,
        List<SectionNode> children
) {

    /** Language id under which structural property fields are stored. */
    public static final long PROPERTY_LANGUAGE_ID = 1L;

    public SectionNode {
        dataSources = dataSources == null ? List.of() : List.copyOf(dataSources);
        translations = translations == null ? Map.of() : copyTranslations(translations);
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }

    private static Map<Long, Map<String, FieldTranslation>> copyTranslations(
            Map<Long, Map<String, FieldTranslation>> source) {
        Map<Long, Map<String, FieldTranslation>> copy = new LinkedHashMap<>();
        source.forEach((languageId, byField) ->
                copy.put(languageId, Collections.unmodifiableMap(new LinkedHashMap<>(byField))));
        return Collections.unmodifiableMap(copy);
    }
}
