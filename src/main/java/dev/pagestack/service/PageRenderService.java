package dev.pagestack.service;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.pagestack.dto.RenderedPageResponse;
import dev.pagestack.engine.CacheDependencyCollector;
import dev.pagestack.engine.ScopeStore;
import dev.pagestack.engine.SectionOrchestrator;
import dev.pagestack.engine.SnapshotMapper;
import dev.pagestack.engine.TranslationResolver;
import dev.pagestack.engine.model.CacheDependencies;
import dev.pagestack.engine.model.RenderContext;
import dev.pagestack.engine.model.RenderedSection;
import dev.pagestack.engine.model.SectionNode;
import dev.pagestack.entity.PageVersion;
import dev.pagestack.metrics.CmsMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Live rendering of pages: loads a section tree (the draft or a stored snapshot), selects the
 * working language, seeds the root scope with system and global variables and hands the tree
 * to the {@link SectionOrchestrator}.
 * <p>
 * Renders of stored versions are cached per version, language, user and data tables read;
 * draft renders always run live.
 */
@Service
@Slf4j
public class PageRenderService {

    private static final TypeReference<RenderedPageResponse> RENDERED_PAGE = new TypeReference<>() {};

    private final PageSnapshotService snapshotService;
    private final PageVersionService versionService;
    private final SnapshotMapper snapshotMapper;
    private final TranslationResolver translationResolver;
    private final SectionOrchestrator orchestrator;
    private final SystemVariableService systemVariableService;
    private final GlobalVariableService globalVariableService;
    private final CacheService cacheService;
    private final CmsMetrics metrics;
    private final long defaultLanguageId;
    private final Duration cacheTtl;

    public PageRenderService(PageSnapshotService snapshotService,
                             PageVersionService versionService,
                             SnapshotMapper snapshotMapper,
                             TranslationResolver translationResolver,
                             SectionOrchestrator orchestrator,
                             SystemVariableService systemVariableService,
                             GlobalVariableService globalVariableService,
                             CacheService cacheService,
                             CmsMetrics metrics,
                             @Value("${app.cms.default-language-id:2}") long defaultLanguageId,
                             @Value("${app.cms.render-cache-ttl-minutes:10}") long cacheTtlMinutes) {
        this.snapshotService = snapshotService;
        this.versionService = versionService;
        this.snapshotMapper = snapshotMapper;
        this.translationResolver = translationResolver;
        this.orchestrator = orchestrator;
        this.systemVariableService = systemVariableService;
        this.globalVariableService = globalVariableService;
        this.cacheService = cacheService;
        this.metrics = metrics;
        this.defaultLanguageId = defaultLanguageId;
        this.cacheTtl = Duration.ofMinutes(cacheTtlMinutes);
    }

    /**
     * Renders the current draft of a page.
     */
    public Mono<RenderedPageResponse> renderPage(Long pageId, RenderContext context) {
        return snapshotService.loadDraft(pageId)
                .flatMap(draft -> {
                    metrics.incrementRender("draft");
                    RenderContext pageContext = context.forPage(draft.page().getKeyword());
                    return renderTree(draft.sections(), pageContext)
                            .map(sections -> new RenderedPageResponse(String.valueOf(pageId),
                                    draft.page().getKeyword(), null, context.languageId(), false, sections));
                })
                .doOnSuccess(page -> log.debug("Rendered draft of page {} in language {}", pageId, context.languageId()));
    }

    /**
     * Renders a stored version from its snapshot.
     */
    public Mono<RenderedPageResponse> renderVersion(Long versionId, RenderContext context) {
        return versionService.getVersion(versionId)
                .flatMap(version -> renderStored(version, context, "version"));
    }

    /**
     * What a visitor sees: the published version when the page has one, otherwise the draft.
     */
    public Mono<RenderedPageResponse> renderForVisitor(Long pageId, RenderContext context) {
        return versionService.findPublishedVersion(pageId)
                .flatMap(version -> renderStored(version, context, "published"))
                .switchIfEmpty(Mono.defer(() -> renderPage(pageId, context)));
    }

    private Mono<RenderedPageResponse> renderStored(PageVersion version, RenderContext context, String mode) {
        SnapshotMapper.Snapshot snapshot = snapshotMapper.fromSnapshot(version.getPageJson().asTree());
        RenderContext pageContext = context.forPage(snapshot.keyword());
        CacheDependencies dependencies = CacheDependencyCollector.collect(snapshot.sections());
        String key = CacheService.renderKey(version.getPageId(), version.getId(), context.languageId(),
                context.userId(), dependencies);
        metrics.incrementRender(mode);

        return cacheService.get(key, RENDERED_PAGE)
                .doOnNext(hit -> metrics.recordRenderCache(true))
                .map(RenderedPageResponse::asCached)
                .switchIfEmpty(Mono.defer(() -> {
                    metrics.recordRenderCache(false);
                    return renderTree(snapshot.sections(), pageContext)
                            .map(sections -> new RenderedPageResponse(String.valueOf(version.getPageId()),
                                    snapshot.keyword(), String.valueOf(version.getId()), context.languageId(), false, sections))
                            .flatMap(rendered -> cacheService.set(key, rendered, cacheTtl).thenReturn(rendered));
                }))
                .doOnSuccess(page -> log.debug("Rendered version {} of page {} ({})", version.getVersionNumber(),
                        version.getPageId(), mode));
    }

    private Mono<List<RenderedSection>> renderTree(List<SectionNode> tree, RenderContext context) {
        List<SectionNode> localized = translationResolver.selectLanguage(tree, context.languageId(), defaultLanguageId);
        return globalVariableService.globals(context.languageId())
                .map(globals -> ScopeStore.root(systemVariableService.systemVariables(context), globals))
                .flatMap(root -> orchestrator.render(localized, root, context));
    }
}
