package dev.pagestack.repository;

import dev.pagestack.engine.model.SectionFieldRow;
import dev.pagestack.engine.model.SectionRow;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;

@Repository
@RequiredArgsConstructor
public class SectionRepositoryImpl implements SectionRepository {

    private static final int MAX_DEPTH = 32;

    private final R2dbcEntityTemplate r2dbcTemplate;

    // depth cap stops a cyclic hierarchy from recursing forever
    private static final String FIND_SECTION_ROWS = """
            WITH RECURSIVE tree (id, parent_id, position, depth) AS (
                SELECT ps.section_id, CAST(NULL AS BIGINT), ps.position, 0
                FROM pages_sections ps
                LEFT JOIN sections_hierarchy nested ON nested.child_id = ps.section_id
                WHERE ps.page_id = :pageId AND nested.parent_id IS NULL
                UNION ALL
                SELECT sh.child_id, sh.parent_id, sh.position, t.depth + 1
                FROM sections_hierarchy sh
                JOIN tree t ON sh.parent_id = t.id
                WHERE t.depth < :maxDepth
            )
            SELECT t.id, t.parent_id, t.position, s.name, st.name AS style_name,
                   s.condition, s.data_config, s.css, s.css_mobile, s.debug
            FROM tree t
            JOIN sections s ON s.id = t.id
            JOIN styles st ON st.id = s.style_id
            ORDER BY t.depth, t.position, t.id
            """;

    private static final String FIND_FIELD_ROWS = """
            SELECT sft.section_id, f.name AS field_name, sft.language_id, sft.content, sft.meta, f.display
            FROM sections_fields_translation sft
            JOIN fields f ON f.id = sft.field_id
            WHERE sft.section_id IN (:ids)
            ORDER BY sft.section_id, sft.language_id, f.name
            """;

    @Override
    public Flux<SectionRow> findSectionRows(Long pageId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_SECTION_ROWS)
                .bind("pageId", pageId)
                .bind("maxDepth", MAX_DEPTH)
                .map((row, meta) -> new SectionRow(
                        row.get("id", Long.class),
                        row.get("parent_id", Long.class),
                        row.get("position", Integer.class),
                        row.get("name", String.class),
                        row.get("style_name", String.class),
                        row.get("condition", String.class),
                        row.get("data_config", String.class),
                        row.get("css", String.class),
                        row.get("css_mobile", String.class),
                        Boolean.TRUE.equals(row.get("debug", Boolean.class))))
                .all();
    }

    @Override
    public Flux<SectionFieldRow> findFieldRows(Collection<Long> sectionIds) {
        if (sectionIds.isEmpty()) {
            return Flux.empty();
        }
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_FIELD_ROWS)
                .bind("ids", sectionIds)
                .map((row, meta) -> new SectionFieldRow(
                        row.get("section_id", Long.class),
                        row.get("field_name", String.class),
                        row.get("language_id", Long.class),
                        row.get("content", String.class),
                        row.get("meta", String.class),
                        !Boolean.TRUE.equals(row.get("display", Boolean.class))))
                .all();
    }
}
