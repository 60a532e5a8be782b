package dev.pagestack.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagestack.config.ResilienceConfig;
import dev.pagestack.dto.PageVersionResponse;
import dev.pagestack.dto.VersionComparisonResponse;
import dev.pagestack.dto.VersionHistoryResponse;
import dev.pagestack.entity.JsonDocument;
import dev.pagestack.entity.Page;
import dev.pagestack.entity.PageVersion;
import dev.pagestack.exception.InvalidVersionStateException;
import dev.pagestack.exception.ResourceNotFoundException;
import dev.pagestack.exception.VersionOperationException;
import dev.pagestack.metrics.CmsMetrics;
import dev.pagestack.repository.PageRepository;
import dev.pagestack.repository.PageVersionRepository;
import dev.pagestack.util.DigestUtils;
import dev.pagestack.util.JsonNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Page version store: immutable snapshots of a page's draft, the published pointer and
 * retention.
 * <p>
 * Version numbers are allocated per page as {@code max + 1} inside the insert transaction; the
 * unique {@code (page_id, version_number)} constraint rejects a concurrent writer, which then
 * re-runs its whole transaction. Mutating operations are all-or-nothing. Not-found and
 * invalid-state errors reach the caller unchanged, anything else is wrapped in a
 * {@link VersionOperationException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PageVersionService {

    private final PageVersionRepository versionRepository;
    private final PageRepository pageRepository;
    private final PageSnapshotService snapshotService;
    private final VersionDiffService diffService;
    private final IdService idService;
    private final TransactionalOperator transactionalOperator;
    private final ResilienceConfig resilience;
    private final CacheService cacheService;
    private final CmsMetrics metrics;
    private final ObjectMapper objectMapper;

    // ==================== LIFECYCLE ====================

    /**
     * Snapshots the current draft of a page as its next version.
     */
    public Mono<PageVersion> createVersion(Long pageId, String versionName, Long createdBy, Map<String, Object> metadata) {
        return Mono.defer(() -> insertVersion(pageId, versionName, createdBy, metadata))
                .as(transactionalOperator::transactional)
                .retryWhen(resilience.duplicateKeyRetry())
                .doOnSuccess(version -> {
                    metrics.incrementVersionCreated();
                    log.info("Created version {} of page {}", version.getVersionNumber(), pageId);
                })
                .onErrorMap(wrap("create a version of page " + pageId));
    }

    /**
     * Marks a version as published and points the page at it. Any previously published
     * version of the page loses its publication timestamp.
     */
    public Mono<PageVersion> publishVersion(Long pageId, Long versionId) {
        return Mono.defer(() -> markPublished(pageId, versionId))
                .as(transactionalOperator::transactional)
                .flatMap(version -> cacheService.invalidatePage(pageId).thenReturn(version))
                .doOnSuccess(version -> {
                    metrics.incrementVersionPublished();
                    log.info("Published version {} of page {}", version.getVersionNumber(), pageId);
                })
                .onErrorMap(wrap("publish version " + versionId + " of page " + pageId));
    }

    /**
     * Creates a version from the draft and publishes it in one transaction.
     */
    public Mono<PageVersion> createAndPublishVersion(Long pageId, String versionName, Long createdBy, Map<String, Object> metadata) {
        return Mono.defer(() -> insertVersion(pageId, versionName, createdBy, metadata)
                        .flatMap(created -> markPublished(pageId, created.getId())))
                .as(transactionalOperator::transactional)
                .retryWhen(resilience.duplicateKeyRetry())
                .flatMap(version -> cacheService.invalidatePage(pageId).thenReturn(version))
                .doOnSuccess(version -> {
                    metrics.incrementVersionCreated();
                    metrics.incrementVersionPublished();
                    log.info("Created and published version {} of page {}", version.getVersionNumber(), pageId);
                })
                .onErrorMap(wrap("create and publish a version of page " + pageId));
    }

    /**
     * Clears the page's published pointer; visitors get the live draft again.
     */
    public Mono<Void> unpublishPage(Long pageId) {
        return findPage(pageId)
                .flatMap(page -> pageRepository.clearPublishedVersion(pageId)
                        .then(versionRepository.clearPublished(pageId)))
                .as(transactionalOperator::transactional)
                .then(cacheService.invalidatePage(pageId))
                .doOnSuccess(count -> log.info("Unpublished page {}", pageId))
                .onErrorMap(wrap("unpublish page " + pageId))
                .then();
    }

    /**
     * Deletes a version of the page. The published version cannot be deleted.
     */
    public Mono<Void> deleteVersion(Long pageId, Long versionId) {
        return Mono.zip(findPage(pageId), findVersionOfPage(pageId, versionId))
                .flatMap(tuple -> {
                    if (Objects.equals(tuple.getT1().getPublishedVersionId(), versionId)) {
                        return Mono.error(new InvalidVersionStateException("error.delete_published_version",
                                "Version " + versionId + " is the published version of page " + pageId));
                    }
                    return versionRepository.delete(tuple.getT2());
                })
                .as(transactionalOperator::transactional)
                .doOnSuccess(v -> {
                    metrics.incrementVersionDeleted(1);
                    log.info("Deleted version {} of page {}", versionId, pageId);
                })
                .onErrorMap(wrap("delete version " + versionId + " of page " + pageId));
    }

    /**
     * Deletes the oldest versions beyond the newest {@code keep}, never the published one.
     *
     * @return number of deleted versions
     */
    public Mono<Integer> applyRetentionPolicy(Long pageId, int keep) {
        if (keep < 0) {
            return Mono.error(new IllegalArgumentException("Retention count must not be negative, got " + keep));
        }
        return findPage(pageId)
                .flatMap(page -> versionRepository.findByPageIdOrderByVersionNumberDesc(pageId)
                        .skip(keep)
                        .filter(version -> !version.getId().equals(page.getPublishedVersionId()))
                        .collectList()
                        .flatMap(expired -> versionRepository.deleteAll(expired).thenReturn(expired.size())))
                .as(transactionalOperator::transactional)
                .doOnSuccess(count -> {
                    if (count > 0) {
                        metrics.incrementVersionDeleted(count);
                        log.info("Retention removed {} versions of page {} (keep={})", count, pageId, keep);
                    }
                })
                .onErrorMap(wrap("apply retention to page " + pageId));
    }

    private Mono<PageVersion> insertVersion(Long pageId, String versionName, Long createdBy, Map<String, Object> metadata) {
        return snapshotService.loadDraft(pageId)
                .flatMap(draft -> versionRepository.findMaxVersionNumber(pageId)
                        .defaultIfEmpty(0)
                        .flatMap(max -> versionRepository.save(PageVersion.builder()
                                .id(idService.nextId())
                                .pageId(pageId)
                                .versionNumber(max + 1)
                                .versionName(versionName)
                                .pageJson(JsonDocument.of(snapshotService.toSnapshot(draft)))
                                .createdBy(createdBy)
                                .createdAt(LocalDateTime.now())
                                .metadata(metadata == null || metadata.isEmpty()
                                        ? null
                                        : JsonDocument.of(objectMapper.<JsonNode>valueToTree(metadata)))
                                .build())));
    }

    private Mono<PageVersion> markPublished(Long pageId, Long versionId) {
        LocalDateTime now = LocalDateTime.now();
        return findPage(pageId)
                .then(findVersionOfPage(pageId, versionId))
                .flatMap(version -> versionRepository.clearPublishedExcept(pageId, versionId)
                        .then(versionRepository.markPublished(versionId, now))
                        .then(pageRepository.updatePublishedVersion(pageId, versionId))
                        .then(Mono.fromSupplier(() -> {
                            version.setPublishedAt(now);
                            return version;
                        })));
    }

    // ==================== QUERIES ====================

    public Mono<PageVersion> getVersion(Long versionId) {
        return versionRepository.findById(versionId)
                .switchIfEmpty(Mono.error(ResourceNotFoundException.version(versionId)));
    }

    /**
     * The version, provided it belongs to {@code pageId}; a version of another page is rejected
     * as an invalid state.
     */
    public Mono<PageVersion> getVersion(Long pageId, Long versionId) {
        return findVersionOfPage(pageId, versionId);
    }

    public Mono<PageVersion> getPublishedVersion(Long pageId) {
        return findPublishedVersion(pageId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("error.no_published_version",
                        "Page " + pageId + " has no published version")));
    }

    /**
     * Empty when the page exists but has nothing published.
     */
    public Mono<PageVersion> findPublishedVersion(Long pageId) {
        return findPage(pageId)
                .filter(Page::isPublished)
                .flatMap(page -> versionRepository.findById(page.getPublishedVersionId()));
    }

    public Mono<VersionHistoryResponse> getVersionHistory(Long pageId, int limit, long offset) {
        if (limit <= 0 || offset < 0) {
            return Mono.error(new IllegalArgumentException("limit must be positive and offset not negative"));
        }
        return findPage(pageId)
                .flatMap(page -> Mono.zip(
                        versionRepository.findPageOfVersions(pageId, limit, offset)
                                .map(PageVersionResponse::fromEntity)
                                .collectList(),
                        versionRepository.countByPageId(pageId),
                        hasUnpublishedChanges(pageId)))
                .map(tuple -> VersionHistoryResponse.of(tuple.getT1(), limit, offset, tuple.getT2(), tuple.getT3()));
    }

    // ==================== CHANGE DETECTION ====================

    /**
     * True when the draft differs from the published snapshot, or nothing is published.
     * Comparison failures also answer true.
     */
    public Mono<Boolean> hasUnpublishedChanges(Long pageId) {
        return findPage(pageId).flatMap(page -> {
            if (!page.isPublished()) {
                return Mono.just(true);
            }
            return Mono.zip(
                            snapshotService.loadDraft(page).map(snapshotService::toSnapshot),
                            versionRepository.findById(page.getPublishedVersionId()))
                    .map(tuple -> !generateStructureHash(tuple.getT1())
                            .equals(generateStructureHash(tuple.getT2().getPageJson().asTree())))
                    .defaultIfEmpty(true)
                    .onErrorResume(e -> {
                        log.warn("Could not compare draft of page {} with its published version: {}", pageId, e.getMessage());
                        return Mono.just(true);
                    });
        });
    }

    /**
     * MD5 of the key-sorted compact form; an equality check, not a security control.
     */
    public String generateStructureHash(JsonNode snapshot) {
        return DigestUtils.md5Hex(JsonNormalizer.canonical(snapshot));
    }

    // ==================== COMPARISON ====================

    public Mono<VersionComparisonResponse> compareVersions(Long fromVersionId, Long toVersionId, DiffFormat format) {
        return Mono.zip(getVersion(fromVersionId), getVersion(toVersionId))
                .flatMap(tuple -> {
                    PageVersion from = tuple.getT1();
                    PageVersion to = tuple.getT2();
                    if (!from.getPageId().equals(to.getPageId())) {
                        return Mono.error(new InvalidVersionStateException("error.versions_different_pages",
                                "Versions " + fromVersionId + " and " + toVersionId + " belong to different pages"));
                    }
                    return Mono.just(compare(VersionComparisonResponse.Side.of(from), from.getPageJson().asTree(),
                            VersionComparisonResponse.Side.of(to), to.getPageJson().asTree(), format));
                });
    }

    /**
     * Compares a version (old side) with the page's current draft (new side).
     */
    public Mono<VersionComparisonResponse> compareDraftWithVersion(Long pageId, Long versionId, DiffFormat format) {
        return findVersionOfPage(pageId, versionId)
                .flatMap(version -> snapshotService.buildDraftSnapshot(pageId)
                        .map(draft -> compare(VersionComparisonResponse.Side.of(version), version.getPageJson().asTree(),
                                VersionComparisonResponse.Side.ofDraft(), draft, format)));
    }

    private VersionComparisonResponse compare(VersionComparisonResponse.Side from, JsonNode fromJson,
                                              VersionComparisonResponse.Side to, JsonNode toJson,
                                              DiffFormat format) {
        return VersionComparisonResponse.builder()
                .from(from)
                .to(to)
                .format(format)
                .diff(diffService.diff(fromJson, toJson, format, from.label(), to.label()))
                .build();
    }

    // ==================== HELPERS ====================

    private Mono<Page> findPage(Long pageId) {
        return snapshotService.findPage(pageId);
    }

    private Mono<PageVersion> findVersionOfPage(Long pageId, Long versionId) {
        return getVersion(versionId)
                .flatMap(version -> version.getPageId().equals(pageId)
                        ? Mono.just(version)
                        : Mono.error(new InvalidVersionStateException("error.version_wrong_page",
                                "Version " + versionId + " does not belong to page " + pageId)));
    }

    private static Function<Throwable, Throwable> wrap(String operation) {
        return error -> {
            if (error instanceof ResourceNotFoundException
                    || error instanceof InvalidVersionStateException
                    || error instanceof IllegalArgumentException
                    || error instanceof VersionOperationException) {
                return error;
            }
            log.error("Failed to {}: {}", operation, error.getMessage());
            return new VersionOperationException("Failed to " + operation + ": " + error.getMessage(), error);
        };
    }
}
