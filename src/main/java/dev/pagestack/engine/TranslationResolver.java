package dev.pagestack.engine;

import dev.pagestack.engine.model.FieldTranslation;
import dev.pagestack.engine.model.SectionFieldRow;
import dev.pagestack.engine.model.SectionNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static dev.pagestack.engine.model.SectionNode.PROPERTY_LANGUAGE_ID;

/**
 * Attaches stored field values to a section tree and selects the view for one language.
 * <p>
 * Property fields only exist under {@link SectionNode#PROPERTY_LANGUAGE_ID} and never fall back.
 * Content fields use the working language and fall back per field to the default language; a
 * field stored in neither is absent, while a stored empty string is kept.
 */
@Component
@Slf4j
public class TranslationResolver {

    /**
     * Copies every stored language into {@link SectionNode#translations()}, recursively.
     */
    public List<SectionNode> attachTranslations(List<SectionNode> tree, List<SectionFieldRow> rows) {
        Map<Long, Map<Long, Map<String, FieldTranslation>>> bySection = new LinkedHashMap<>();
        for (SectionFieldRow row : rows) {
            if (row.property() && row.languageId() != PROPERTY_LANGUAGE_ID) {
                log.debug("Ignoring property field '{}' of section {} stored under language {}",
                        row.fieldName(), row.sectionId(), row.languageId());
                continue;
            }
            bySection.computeIfAbsent(row.sectionId(), id -> new TreeMap<>())
                    .computeIfAbsent(row.languageId(), id -> new TreeMap<>())
                    .put(row.fieldName(), new FieldTranslation(row.content(), row.meta()));
        }
        return attach(tree, bySection);
    }

    private List<SectionNode> attach(List<SectionNode> nodes, Map<Long, Map<Long, Map<String, FieldTranslation>>> bySection) {
        List<SectionNode> result = new ArrayList<>(nodes.size());
        for (SectionNode node : nodes) {
            result.add(node.toBuilder()
                    .translations(bySection.getOrDefault(node.id(), Map.of()))
                    .children(attach(node.children(), bySection))
                    .build());
        }
        return result;
    }

    /**
     * Fills {@link SectionNode#fields()} for {@code languageId}, recursively.
     */
    public List<SectionNode> selectLanguage(List<SectionNode> tree, long languageId, long defaultLanguageId) {
        List<SectionNode> result = new ArrayList<>(tree.size());
        for (SectionNode node : tree) {
            result.add(node.toBuilder()
                    .fields(resolveFields(node.translations(), languageId, defaultLanguageId))
                    .children(selectLanguage(node.children(), languageId, defaultLanguageId))
                    .build());
        }
        return result;
    }

    Map<String, FieldTranslation> resolveFields(Map<Long, Map<String, FieldTranslation>> translations,
                                                long languageId, long defaultLanguageId) {
        Map<String, FieldTranslation> fields = new LinkedHashMap<>();
        if (defaultLanguageId != PROPERTY_LANGUAGE_ID) {
            fields.putAll(translations.getOrDefault(defaultLanguageId, Map.of()));
        }
        if (languageId != PROPERTY_LANGUAGE_ID) {
            fields.putAll(translations.getOrDefault(languageId, Map.of()));
        }
        // properties last: structural values are never shadowed by content of the same name
        fields.putAll(translations.getOrDefault(PROPERTY_LANGUAGE_ID, Map.of()));
        return fields;
    }
}
