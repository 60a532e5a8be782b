package dev.pagestack.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of a page's composition. Only {@code publishedAt} changes after insert.
 */
@Table("page_versions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageVersion implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("page_id")
    private Long pageId;

    @Column("version_number")
    private Integer versionNumber;

    @Column("version_name")
    private String versionName;

    @Column("page_json")
    private JsonDocument pageJson;

    @Column("created_by")
    private Long createdBy;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("published_at")
    private LocalDateTime publishedAt;

    private JsonDocument metadata;
}
