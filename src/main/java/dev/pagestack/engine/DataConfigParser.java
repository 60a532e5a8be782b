package dev.pagestack.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagestack.engine.model.DataSourceDeclaration;
import dev.pagestack.engine.model.RetrieveMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a section's stored {@code data_config} into typed declarations.
 * A single object is accepted as a one-element list.
 */
@Component
@RequiredArgsConstructor
public class DataConfigParser {

    private final ObjectMapper objectMapper;

    public List<DataSourceDeclaration> parse(String dataConfig) throws MalformedDataConfigException {
        if (dataConfig == null || dataConfig.isBlank()) {
            return List.of();
        }
        try {
            return parse(objectMapper.readTree(dataConfig));
        } catch (JsonProcessingException e) {
            throw new MalformedDataConfigException("data_config is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public List<DataSourceDeclaration> parse(JsonNode dataConfig) throws MalformedDataConfigException {
        if (dataConfig == null || dataConfig.isNull() || dataConfig.isMissingNode()) {
            return List.of();
        }
        if (dataConfig.isTextual()) {
            return parse(dataConfig.textValue());
        }
        if (dataConfig.isObject()) {
            return List.of(declaration(dataConfig, 0));
        }
        if (!dataConfig.isArray()) {
            throw new MalformedDataConfigException("data_config must be a list of declarations, got " + dataConfig.getNodeType(), null);
        }
        List<DataSourceDeclaration> declarations = new ArrayList<>(dataConfig.size());
        for (int i = 0; i < dataConfig.size(); i++) {
            declarations.add(declaration(dataConfig.get(i), i));
        }
        return declarations;
    }

    private DataSourceDeclaration declaration(JsonNode node, int index) throws MalformedDataConfigException {
        if (!node.isObject()) {
            throw new MalformedDataConfigException("data_config entry " + index + " is not an object", null);
        }
        String table = text(node, "table");
        if (table == null || table.isBlank()) {
            throw new MalformedDataConfigException("data_config entry " + index + " has no table", null);
        }

        List<DataSourceDeclaration.FieldSelection> fields = new ArrayList<>();
        for (JsonNode field : node.path("fields")) {
            String fieldName = text(field, "field_name");
            if (fieldName != null) {
                fields.add(new DataSourceDeclaration.FieldSelection(
                        fieldName, text(field, "field_holder"), text(field, "not_found_text")));
            }
        }
        List<DataSourceDeclaration.FieldRename> renames = new ArrayList<>();
        for (JsonNode rename : node.path("map_fields")) {
            String fieldName = text(rename, "field_name");
            String newName = text(rename, "field_new_name");
            if (fieldName != null && newName != null) {
                renames.add(new DataSourceDeclaration.FieldRename(fieldName, newName));
            }
        }

        return new DataSourceDeclaration(
                table,
                text(node, "filter"),
                text(node, "scope"),
                node.path("current_user").asBoolean(true),
                RetrieveMode.fromWireName(text(node, "retrieve")),
                node.path("all_fields").asBoolean(true),
                fields,
                renames);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Raised when a stored {@code data_config} cannot be decoded.
     */
    public static class MalformedDataConfigException extends Exception {
        public MalformedDataConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
