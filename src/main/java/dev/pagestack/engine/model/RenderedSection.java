package dev.pagestack.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A section after the live pipeline: interpolated content in the working language, the data
 * its own declarations produced and, when it carries a condition, the evaluation trace.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RenderedSection(
        Long id,
        @JsonProperty("section_name") String name,
        @JsonProperty("style_name") String styleName,
        int position,
        String condition,
        String css,
        @JsonProperty("css_mobile") String cssMobile,
        boolean debug,
        Map<String, FieldTranslation> fields,
        @JsonProperty("section_data") Map<String, Object> sectionData,
        @JsonProperty("condition_debug") ConditionResult conditionDebug,
        List<RenderedSection> children
) {

    public static RenderedSection of(SectionNode node,
                                     Map<String, Object> sectionData,
                                     ConditionResult conditionDebug,
                                     List<RenderedSection> children) {
        return new RenderedSection(
                node.id(),
                node.name(),
                node.styleName(),
                node.position(),
                node.condition(),
                node.css(),
                node.cssMobile(),
                node.debug(),
                node.fields(),
                sectionData,
                conditionDebug,
                children);
    }
}
