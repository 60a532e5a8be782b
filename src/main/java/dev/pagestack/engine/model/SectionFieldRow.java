package dev.pagestack.engine.model;

/**
 * One stored field value of a section. Property fields are structural and only live under
 * {@link SectionNode#PROPERTY_LANGUAGE_ID}.
 */
public record SectionFieldRow(
        Long sectionId,
        String fieldName,
        long languageId,
        String content,
        String meta,
        boolean property
) {
}
