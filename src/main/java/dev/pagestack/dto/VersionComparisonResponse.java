package dev.pagestack.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pagestack.entity.PageVersion;
import dev.pagestack.service.DiffFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Result of comparing two versions, or the draft with a version. {@code diff} depends on
 * {@code format}: text for unified, rows for side_by_side, operations for json_patch and a
 * change list for summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VersionComparisonResponse {
    private Side from;
    private Side to;
    private DiffFormat format;
    private Object diff;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Side {
        private String versionId;
        private Integer versionNumber;
        private String versionName;
        private LocalDateTime createdAt;
        private LocalDateTime publishedAt;
        private boolean draft;

        public static Side of(PageVersion version) {
            return Side.builder()
                    .versionId(String.valueOf(version.getId()))
                    .versionNumber(version.getVersionNumber())
                    .versionName(version.getVersionName())
                    .createdAt(version.getCreatedAt())
                    .publishedAt(version.getPublishedAt())
                    .build();
        }

        public static Side ofDraft() {
            return Side.builder().draft(true).build();
        }

        public String label() {
            return draft ? "draft" : "version_" + versionNumber;
        }
    }
}
