package dev.pagestack.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.pagestack.engine.model.DataSourceDeclaration;
import dev.pagestack.engine.model.FieldTranslation;
import dev.pagestack.engine.model.SectionNode;
import dev.pagestack.entity.Page;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts between a page's section tree and the snapshot document stored with a version:
 * <pre>
 * {"page": {"id", "keyword", "url", "parent_page_id", "is_headless", "nav_position",
 *           "footer_position", "sections": [ ... ]}}
 * </pre>
 * Snapshots carry every stored language and the raw configuration of each section; they never
 * contain retrieved data or condition traces.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SnapshotMapper {

    private final ObjectMapper objectMapper;
    private final DataConfigParser dataConfigParser;

    public ObjectNode toSnapshot(Page page, List<SectionNode> tree) {
        ObjectNode pageNode = objectMapper.createObjectNode();
        pageNode.put("id", page.getId());
        pageNode.put("keyword", page.getKeyword());
        pageNode.put("url", page.getUrl());
        pageNode.put("parent_page_id", page.getParentPageId());
        pageNode.put("is_headless", Boolean.TRUE.equals(page.getHeadless()));
        pageNode.put("nav_position", page.getNavPosition());
        pageNode.put("footer_position", page.getFooterPosition());
        pageNode.set("sections", sectionsToJson(tree));

        ObjectNode root = objectMapper.createObjectNode();
        root.set("page", pageNode);
        return root;
    }

    private ArrayNode sectionsToJson(List<SectionNode> sections) {
        ArrayNode array = objectMapper.createArrayNode();
        for (SectionNode section : sections) {
            ObjectNode node = array.addObject();
            node.put("id", section.id());
            node.put("position", section.position());
            node.put("section_name", section.name());
            node.put("style_name", section.styleName());
            node.put("condition", section.condition());
            node.set("data_config", dataConfigToJson(section.dataConfig()));
            node.put("css", section.css());
            node.put("css_mobile", section.cssMobile());
            node.put("debug", section.debug());
            node.set("translations", translationsToJson(section.translations()));
            node.set("children", sectionsToJson(section.children()));
        }
        return array;
    }

    // valid JSON is embedded as a tree, anything else is kept verbatim as text
    private JsonNode dataConfigToJson(String dataConfig) {
        if (dataConfig == null || dataConfig.isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(dataConfig);
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(dataConfig);
        }
    }

    private ObjectNode translationsToJson(Map<Long, Map<String, FieldTranslation>> translations) {
        ObjectNode byLanguage = objectMapper.createObjectNode();
        new TreeMap<>(translations).forEach((languageId, fields) -> {
            ObjectNode byField = byLanguage.putObject(String.valueOf(languageId));
            new TreeMap<>(fields).forEach((fieldName, value) -> {
                ObjectNode field = byField.putObject(fieldName);
                field.put("content", value.content());
                field.put("meta", value.meta());
            });
        });
        return byLanguage;
    }

    /**
     * Reads a stored snapshot back into a section tree with every language attached.
     *
     * @throws IllegalArgumentException when the document has no {@code page} object
     */
    public Snapshot fromSnapshot(JsonNode snapshot) {
        JsonNode page = snapshot == null ? null : snapshot.get("page");
        if (page == null || !page.isObject()) {
            throw new IllegalArgumentException("Snapshot has no page object");
        }
        return new Snapshot(
                longOrNull(page.get("id")),
                textOrNull(page.get("keyword")),
                sectionsFromJson(page.path("sections")));
    }

    private List<SectionNode> sectionsFromJson(JsonNode sections) {
        List<SectionNode> result = new ArrayList<>();
        for (JsonNode node : sections) {
            JsonNode dataConfig = node.get("data_config");
            String dataConfigText = dataConfig == null || dataConfig.isNull()
                    ? null
                    : dataConfig.isTextual() ? dataConfig.textValue() : dataConfig.toString();

            List<DataSourceDeclaration> dataSources = List.of();
            boolean malformed = false;
            try {
                dataSources = dataConfigParser.parse(dataConfig);
            } catch (DataConfigParser.MalformedDataConfigException e) {
                log.warn("Ignoring data_config of snapshot section {}: {}", node.path("id").asText(), e.getMessage());
                malformed = true;
            }

            result.add(SectionNode.builder()
                    .id(longOrNull(node.get("id")))
                    .name(textOrNull(node.get("section_name")))
                    .styleName(textOrNull(node.get("style_name")))
                    .position(node.path("position").asInt())
                    .condition(ConditionDecoder.normalize(textOrNull(node.get("condition"))))
                    .dataConfig(dataConfigText)
                    .dataSources(dataSources)
                    .dataConfigMalformed(malformed)
                    .css(textOrNull(node.get("css")))
                    .cssMobile(textOrNull(node.get("css_mobile")))
                    .debug(node.path("debug").asBoolean(false))
                    .translations(translationsFromJson(node.path("translations")))
                    .children(sectionsFromJson(node.path("children")))
                    .build());
        }
        return result;
    }

    private Map<Long, Map<String, FieldTranslation>> translationsFromJson(JsonNode translations) {
        Map<Long, Map<String, FieldTranslation>> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> languages = translations.fields();
        while (languages.hasNext()) {
            Map.Entry<String, JsonNode> language = languages.next();
            Map<String, FieldTranslation> fields = new LinkedHashMap<>();
            language.getValue().fields().forEachRemaining(field -> fields.put(field.getKey(),
                    new FieldTranslation(textOrNull(field.getValue().get("content")), textOrNull(field.getValue().get("meta")))));
            try {
                result.put(Long.parseLong(language.getKey()), fields);
            } catch (NumberFormatException e) {
                log.warn("Skipping snapshot translations under non-numeric language key '{}'", language.getKey());
            }
        }
        return result;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Long longOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asLong();
    }

    /**
     * Page identity and section tree read from a snapshot.
     */
    public record Snapshot(Long pageId, String keyword, List<SectionNode> sections) {
    }
}
