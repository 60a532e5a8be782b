package dev.pagestack.engine.model;

/**
 * Content of one section field in one language.
 */
public record FieldTranslation(String content, String meta) {

    public static FieldTranslation of(String content) {
        return new FieldTranslation(content, null);
    }

    public FieldTranslation withContent(String newContent) {
        return new FieldTranslation(newContent, meta);
    }
}
