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

/**
 * A named site-wide value, exposed to sections as {@code {{globals.<name>}}}.
 */
@Table("cms_global_values")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalValue implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("language_id")
    private Long languageId;

    private String name;

    private String content;
}
