package dev.pagestack.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.pagestack.config.ResilienceConfig;
import dev.pagestack.engine.SectionTreeBuilder;
import dev.pagestack.engine.SnapshotMapper;
import dev.pagestack.engine.TranslationResolver;
import dev.pagestack.engine.model.SectionNode;
import dev.pagestack.engine.model.SectionRow;
import dev.pagestack.entity.Page;
import dev.pagestack.exception.ResourceNotFoundException;
import dev.pagestack.repository.PageRepository;
import dev.pagestack.repository.SectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Loads the current draft of a page from storage: the section tree with every stored language,
 * before any interpolation, retrieval or condition evaluation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageSnapshotService {

    private final PageRepository pageRepository;
    private final SectionRepository sectionRepository;
    private final SectionTreeBuilder sectionTreeBuilder;
    private final TranslationResolver translationResolver;
    private final SnapshotMapper snapshotMapper;
    private final ResilienceConfig resilience;

    public Mono<Page> findPage(Long pageId) {
        return pageRepository.findById(pageId)
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .switchIfEmpty(Mono.error(ResourceNotFoundException.page(pageId)));
    }

    public Mono<DraftPage> loadDraft(Long pageId) {
        return findPage(pageId).flatMap(this::loadDraft);
    }

    public Mono<DraftPage> loadDraft(Page page) {
        return sectionRepository.findSectionRows(page.getId())
                .collectList()
                .flatMap(rows -> {
                    List<SectionNode> tree = sectionTreeBuilder.build(rows);
                    List<Long> sectionIds = rows.stream().map(SectionRow::id).distinct().toList();
                    return sectionRepository.findFieldRows(sectionIds)
                            .collectList()
                            .map(fieldRows -> new DraftPage(page, translationResolver.attachTranslations(tree, fieldRows)));
                })
                .timeout(resilience.getDatabaseTimeout())
                .retryWhen(resilience.databaseRetry())
                .doOnSuccess(draft -> log.debug("Loaded draft of page {} with {} top-level sections",
                        page.getId(), draft.sections().size()));
    }

    public Mono<ObjectNode> buildDraftSnapshot(Long pageId) {
        return loadDraft(pageId).map(this::toSnapshot);
    }

    public ObjectNode toSnapshot(DraftPage draft) {
        return snapshotMapper.toSnapshot(draft.page(), draft.sections());
    }

    /**
     * A page with its draft section tree, all languages attached.
     */
    public record DraftPage(Page page, List<SectionNode> sections) {
    }
}
