package dev.pagestack.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import dev.pagestack.entity.PageVersion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageVersionResponse {
    private String id;
    private String pageId;
    private Integer versionNumber;
    private String versionName;
    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime publishedAt;
    private boolean published;
    private JsonNode metadata;
    /** Only set when the full snapshot was requested. */
    private JsonNode pageJson;

    public static PageVersionResponse fromEntity(PageVersion version) {
        return fromEntity(version, false);
    }

    public static PageVersionResponse fromEntity(PageVersion version, boolean includeSnapshot) {
        return PageVersionResponse.builder()
                .id(String.valueOf(version.getId()))
                .pageId(String.valueOf(version.getPageId()))
                .versionNumber(version.getVersionNumber())
                .versionName(version.getVersionName())
                .createdBy(version.getCreatedBy() != null ? String.valueOf(version.getCreatedBy()) : null)
                .createdAt(version.getCreatedAt())
                .publishedAt(version.getPublishedAt())
                .published(version.getPublishedAt() != null)
                .metadata(version.getMetadata() != null ? version.getMetadata().asTree() : null)
                .pageJson(includeSnapshot ? version.getPageJson().asTree() : null)
                .build();
    }
}
