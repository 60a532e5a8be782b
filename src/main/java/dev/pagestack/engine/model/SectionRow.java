package dev.pagestack.engine.model;

/**
 * A section as loaded for one page: its placement (parent and position) plus its own columns.
 * {@code parentId} is null for sections attached directly to the page.
 */
public record SectionRow(
        Long id,
        Long parentId,
        int position,
        String name,
        String styleName,
        String condition,
        String dataConfig,
        String css,
        String cssMobile,
        boolean debug
) {
}
