package dev.pagestack.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionHistoryResponse {
    private List<PageVersionResponse> content;
    private int limit;
    private long offset;
    private long totalElements;
    private boolean hasMore;
    private boolean hasUnpublishedChanges;

    public static VersionHistoryResponse of(List<PageVersionResponse> content, int limit, long offset, long totalElements,
                                            boolean hasUnpublishedChanges) {
        return VersionHistoryResponse.builder()
                .content(content)
                .limit(limit)
                .offset(offset)
                .totalElements(totalElements)
                .hasMore(offset + content.size() < totalElements)
                .hasUnpublishedChanges(hasUnpublishedChanges)
                .build();
    }
}
