package dev.pagestack.repository;

import dev.pagestack.engine.model.SectionFieldRow;
import dev.pagestack.engine.model.SectionRow;
import reactor.core.publisher.Flux;

import java.util.Collection;

/**
 * Read access to a page's sections. Section editing happens elsewhere; this side only
 * needs the flattened tree and the stored field values.
 */
public interface SectionRepository {

    /**
     * Every section reachable from the page's top-level placements, parents before children.
     */
    Flux<SectionRow> findSectionRows(Long pageId);

    /**
     * Stored field values of the given sections in every language.
     */
    Flux<SectionFieldRow> findFieldRows(Collection<Long> sectionIds);
}
