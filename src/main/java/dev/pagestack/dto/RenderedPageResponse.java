package dev.pagestack.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pagestack.engine.model.RenderedSection;

import java.util.List;

/**
 * A page rendered for one visitor. {@code versionId} is null for a draft render.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RenderedPageResponse(
        String pageId,
        String keyword,
        String versionId,
        long languageId,
        boolean cached,
        List<RenderedSection> sections
) {

    public RenderedPageResponse asCached() {
        return new RenderedPageResponse(pageId, keyword, versionId, languageId, true, sections);
    }
}
