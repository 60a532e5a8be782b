package dev.pagestack.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.pagestack.config.ResilienceConfig;
import dev.pagestack.dto.VersionComparisonResponse;
import dev.pagestack.entity.JsonDocument;
import dev.pagestack.entity.Page;
import dev.pagestack.entity.PageVersion;
import dev.pagestack.exception.InvalidVersionStateException;
import dev.pagestack.exception.ResourceNotFoundException;
import dev.pagestack.exception.VersionOperationException;
import dev.pagestack.metrics.CmsMetrics;
import dev.pagestack.repository.PageRepository;
import dev.pagestack.repository.PageVersionRepository;
import dev.pagestack.service.PageSnapshotService.DraftPage;
import dev.pagestack.util.JsonNormalizer.DifferenceSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PageVersionServiceTest {

    @Mock
    private PageVersionRepository versionRepository;

    @Mock
    private PageRepository pageRepository;

    @Mock
    private PageSnapshotService snapshotService;

    @Mock
    private IdService idService;

    @Mock
    private TransactionalOperator transactionalOperator;

    @Mock
    private CacheService cacheService;

    @Mock
    private CmsMetrics metrics;

    @Captor
    private ArgumentCaptor<Iterable<PageVersion>> expiredCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PageVersionService versionService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        lenient().when(transactionalOperator.transactional(any(Mono.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        versionService = new PageVersionService(versionRepository, pageRepository, snapshotService,
                new VersionDiffService(), idService, transactionalOperator,
                new ResilienceConfig(10, 3, 100, 1000, 5, 5, 3), cacheService, metrics, objectMapper);
    }

    private static Page page(long id, Long publishedVersionId) {
        return Page.builder().id(id).keyword("page-" + id).publishedVersionId(publishedVersionId).build();
    }

    private static PageVersion version(long id, long pageId, int number, String json) {
        return PageVersion.builder()
                .id(id)
                .pageId(pageId)
                .versionNumber(number)
                .pageJson(JsonDocument.of(json))
                .build();
    }

    private ObjectNode snapshot(String json) {
        try {
            return (ObjectNode) objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private void stubDraft(Page page, String json) {
        DraftPage draft = new DraftPage(page, List.of());
        lenient().when(snapshotService.loadDraft(page.getId())).thenReturn(Mono.just(draft));
        lenient().when(snapshotService.loadDraft(page)).thenReturn(Mono.just(draft));
        lenient().when(snapshotService.toSnapshot(draft)).thenReturn(snapshot(json));
    }

    // ==================== Create ====================

    @Nested
    @DisplayName("createVersion")
    class CreateVersion {

        private final List<PageVersion> store = new ArrayList<>();
        private final AtomicLong ids = new AtomicLong(100);

        @BeforeEach
        void setUpStore() {
            lenient().when(idService.nextId()).thenAnswer(invocation -> ids.incrementAndGet());
            lenient().when(versionRepository.findMaxVersionNumber(anyLong())).thenAnswer(invocation -> {
                Long pageId = invocation.getArgument(0);
                return Mono.fromSupplier(() -> store.stream()
                        .filter(v -> v.getPageId().equals(pageId))
                        .mapToInt(PageVersion::getVersionNumber)
                        .max()
                        .orElse(0));
            });
            lenient().when(versionRepository.save(any(PageVersion.class))).thenAnswer(invocation -> {
                PageVersion saved = invocation.getArgument(0);
                return Mono.fromSupplier(() -> {
                    store.add(saved);
                    return saved;
                });
            });
        }

        @Test
        @DisplayName("Should number versions per page starting at 1")
        void shouldNumberVersionsPerPage() {
            stubDraft(page(1L, null), "{\"page\":{\"id\":1}}");
            stubDraft(page(2L, null), "{\"page\":{\"id\":2}}");

            StepVerifier.create(versionService.createVersion(1L, "first", 9L, Map.of())
                            .then(versionService.createVersion(1L, null, 9L, null))
                            .then(versionService.createVersion(2L, null, 9L, null))
                            .then(versionService.createVersion(1L, null, 9L, null)))
                    .assertNext(last -> assertThat(last.getVersionNumber()).isEqualTo(3))
                    .verifyComplete();

            assertThat(store).extracting(PageVersion::getPageId, PageVersion::getVersionNumber)
                    .containsExactly(tuple(1L, 1), tuple(1L, 2), tuple(2L, 1), tuple(1L, 3));
            assertThat(store.get(0).getVersionName()).isEqualTo("first");
            assertThat(store.get(0).getCreatedBy()).isEqualTo(9L);
            assertThat(store.get(0).getPageJson().asString()).isEqualTo("{\"page\":{\"id\":1}}");
            assertThat(store.get(0).getMetadata()).isNull();
            assertThat(store.get(0).getPublishedAt()).isNull();
            verify(metrics, times(4)).incrementVersionCreated();
        }

        @Test
        @DisplayName("Should store metadata as JSON")
        void shouldStoreMetadata() {
            stubDraft(page(1L, null), "{}");

            StepVerifier.create(versionService.createVersion(1L, "launch", null, Map.of("reason", "launch")))
                    .assertNext(created -> assertThat(created.getMetadata().asString()).isEqualTo("{\"reason\":\"launch\"}"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should re-run the insert when another writer took the number")
        void shouldRetryOnDuplicateVersionNumber() {
            stubDraft(page(1L, null), "{}");
            AtomicInteger attempts = new AtomicInteger();
            doAnswer(invocation -> {
                if (attempts.incrementAndGet() == 1) {
                    store.add(version(99L, 1L, 1, "{}"));
                    return Mono.error(new DuplicateKeyException("uk_page_versions_page_number"));
                }
                PageVersion saved = invocation.getArgument(0);
                return Mono.just(saved);
            }).when(versionRepository).save(any(PageVersion.class));

            StepVerifier.create(versionService.createVersion(1L, null, null, null))
                    .assertNext(created -> assertThat(created.getVersionNumber()).isEqualTo(2))
                    .verifyComplete();

            assertThat(attempts).hasValue(2);
        }

        @Test
        @DisplayName("Should report a missing page unchanged")
        void shouldPropagateNotFound() {
            when(snapshotService.loadDraft(5L)).thenReturn(Mono.error(ResourceNotFoundException.page(5L)));

            StepVerifier.create(versionService.createVersion(5L, null, null, null))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should wrap unexpected failures with the operation")
        void shouldWrapUnexpectedErrors() {
            when(snapshotService.loadDraft(1L)).thenReturn(Mono.error(new IllegalStateException("connection reset")));

            StepVerifier.create(versionService.createVersion(1L, null, null, null))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(VersionOperationException.class)
                                .hasMessage("Failed to create a version of page 1: connection reset");
                        assertThat(error.getCause()).isInstanceOf(IllegalStateException.class);
                    })
                    .verify();
        }

        @Test
        @DisplayName("Should create and publish in one step")
        void shouldCreateAndPublish() {
            Page page = page(1L, null);
            stubDraft(page, "{}");
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page));
            when(versionRepository.findById(101L)).thenAnswer(invocation -> Mono.just(store.get(0)));
            when(versionRepository.clearPublishedExcept(1L, 101L)).thenReturn(Mono.just(0));
            when(versionRepository.markPublished(eq(101L), any())).thenReturn(Mono.just(1));
            when(pageRepository.updatePublishedVersion(1L, 101L)).thenReturn(Mono.just(1));
            when(cacheService.invalidatePage(1L)).thenReturn(Mono.just(0L));

            StepVerifier.create(versionService.createAndPublishVersion(1L, null, null, null))
                    .assertNext(published -> {
                        assertThat(published.getId()).isEqualTo(101L);
                        assertThat(published.getPublishedAt()).isNotNull();
                    })
                    .verifyComplete();

            verify(metrics).incrementVersionCreated();
            verify(metrics).incrementVersionPublished();
        }
    }

    // ==================== Publish ====================

    @Nested
    @DisplayName("publishVersion")
    class PublishVersion {

        @Test
        @DisplayName("Should move the published pointer and invalidate cached renders")
        void shouldPublish() {
            PageVersion version = version(10L, 1L, 2, "{}");
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, 9L)));
            when(versionRepository.findById(10L)).thenReturn(Mono.just(version));
            when(versionRepository.clearPublishedExcept(1L, 10L)).thenReturn(Mono.just(1));
            when(versionRepository.markPublished(eq(10L), any())).thenReturn(Mono.just(1));
            when(pageRepository.updatePublishedVersion(1L, 10L)).thenReturn(Mono.just(1));
            when(cacheService.invalidatePage(1L)).thenReturn(Mono.just(4L));

            StepVerifier.create(versionService.publishVersion(1L, 10L))
                    .assertNext(published -> assertThat(published.getPublishedAt()).isNotNull())
                    .verifyComplete();

            InOrder inOrder = inOrder(versionRepository, pageRepository, cacheService);
            inOrder.verify(versionRepository).clearPublishedExcept(1L, 10L);
            inOrder.verify(versionRepository).markPublished(eq(10L), any());
            inOrder.verify(pageRepository).updatePublishedVersion(1L, 10L);
            inOrder.verify(cacheService).invalidatePage(1L);
        }

        @Test
        @DisplayName("Should reject a version of another page")
        void shouldRejectVersionOfOtherPage() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, null)));
            when(versionRepository.findById(10L)).thenReturn(Mono.just(version(10L, 2L, 1, "{}")));

            StepVerifier.create(versionService.publishVersion(1L, 10L))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(InvalidVersionStateException.class)
                            .extracting("messageKey").isEqualTo("error.version_wrong_page"))
                    .verify();

            verify(pageRepository, never()).updatePublishedVersion(anyLong(), anyLong());
        }

        @Test
        @DisplayName("Should report an unknown version as not found")
        void shouldRejectUnknownVersion() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, null)));
            when(versionRepository.findById(10L)).thenReturn(Mono.empty());

            StepVerifier.create(versionService.publishVersion(1L, 10L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should clear the pointer when unpublishing")
        void shouldUnpublish() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, 10L)));
            when(pageRepository.clearPublishedVersion(1L)).thenReturn(Mono.just(1));
            when(versionRepository.clearPublished(1L)).thenReturn(Mono.just(1));
            when(cacheService.invalidatePage(1L)).thenReturn(Mono.just(2L));

            StepVerifier.create(versionService.unpublishPage(1L))
                    .verifyComplete();

            verify(pageRepository).clearPublishedVersion(1L);
            verify(versionRepository).clearPublished(1L);
        }
    }

    // ==================== Delete & retention ====================

    @Nested
    @DisplayName("deletion")
    class Deletion {

        @Test
        @DisplayName("Should refuse to delete the published version")
        void shouldNotDeletePublishedVersion() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, 10L)));
            when(versionRepository.findById(10L)).thenReturn(Mono.just(version(10L, 1L, 1, "{}")));

            StepVerifier.create(versionService.deleteVersion(1L, 10L))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(InvalidVersionStateException.class)
                            .extracting("messageKey").isEqualTo("error.delete_published_version"))
                    .verify();

            verify(versionRepository, never()).delete(any(PageVersion.class));
        }

        @Test
        @DisplayName("Should delete any other version")
        void shouldDeleteUnpublishedVersion() {
            PageVersion old = version(11L, 1L, 1, "{}");
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, 10L)));
            when(versionRepository.findById(11L)).thenReturn(Mono.just(old));
            when(versionRepository.delete(old)).thenReturn(Mono.empty());

            StepVerifier.create(versionService.deleteVersion(1L, 11L))
                    .verifyComplete();

            verify(metrics).incrementVersionDeleted(1);
        }

        @Test
        @DisplayName("Should keep the newest versions and the published one")
        void shouldApplyRetention() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, 12L)));
            when(versionRepository.findByPageIdOrderByVersionNumberDesc(1L)).thenReturn(Flux.just(
                    version(15L, 1L, 5, "{}"),
                    version(14L, 1L, 4, "{}"),
                    version(13L, 1L, 3, "{}"),
                    version(12L, 1L, 2, "{}"),
                    version(11L, 1L, 1, "{}")));
            when(versionRepository.deleteAll(anyList())).thenReturn(Mono.empty());

            StepVerifier.create(versionService.applyRetentionPolicy(1L, 2))
                    .expectNext(2)
                    .verifyComplete();

            verify(versionRepository).deleteAll(expiredCaptor.capture());
            assertThat(expiredCaptor.getValue()).extracting(PageVersion::getId).containsExactly(13L, 11L);
            verify(metrics).incrementVersionDeleted(2);
        }

        @Test
        @DisplayName("Should reject a negative retention count")
        void shouldRejectNegativeKeep() {
            StepVerifier.create(versionService.applyRetentionPolicy(1L, -1))
                    .expectError(IllegalArgumentException.class)
                    .verify();

            verifyNoInteractions(versionRepository);
        }
    }

    // ==================== Change detection ====================

    @Nested
    @DisplayName("hasUnpublishedChanges")
    class HasUnpublishedChanges {

        @Test
        @DisplayName("Should report changes when nothing is published")
        void shouldReportChangesWhenUnpublished() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, null)));

            StepVerifier.create(versionService.hasUnpublishedChanges(1L))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should ignore property order when comparing with the published snapshot")
        void shouldIgnoreKeyOrder() {
            Page page = page(1L, 10L);
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page));
            stubDraft(page, "{\"page\":{\"keyword\":\"home\",\"id\":1}}");
            when(versionRepository.findById(10L))
                    .thenReturn(Mono.just(version(10L, 1L, 1, "{\"page\":{\"id\":1,\"keyword\":\"home\"}}")));

            StepVerifier.create(versionService.hasUnpublishedChanges(1L))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should report changes when the draft differs")
        void shouldDetectChanges() {
            Page page = page(1L, 10L);
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page));
            stubDraft(page, "{\"page\":{\"id\":1,\"keyword\":\"about\"}}");
            when(versionRepository.findById(10L))
                    .thenReturn(Mono.just(version(10L, 1L, 1, "{\"page\":{\"id\":1,\"keyword\":\"home\"}}")));

            StepVerifier.create(versionService.hasUnpublishedChanges(1L))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should answer true when the comparison fails")
        void shouldAnswerTrueOnFailure() {
            Page page = page(1L, 10L);
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page));
            when(snapshotService.loadDraft(page)).thenReturn(Mono.error(new IllegalStateException("timeout")));
            when(versionRepository.findById(10L)).thenReturn(Mono.empty());

            StepVerifier.create(versionService.hasUnpublishedChanges(1L))
                    .expectNext(true)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should hash equal structures equally")
        void shouldHashIndependentOfKeyOrder() {
            assertThat(versionService.generateStructureHash(snapshot("{\"a\":1,\"b\":[1,2]}")))
                    .isEqualTo(versionService.generateStructureHash(snapshot("{\"b\":[1,2],\"a\":1}")))
                    .isNotEqualTo(versionService.generateStructureHash(snapshot("{\"b\":[2,1],\"a\":1}")))
                    .hasSize(32);
        }

        @Test
        @DisplayName("Should ignore key order at every depth but notice a single changed leaf")
        void shouldHashNestedStructuresByContent() {
            String original = "{\"page\":{\"id\":7,\"sections\":[{\"id\":11,\"translations\":"
                    + "{\"2\":{\"text\":{\"content\":\"Hello\",\"meta\":null}},\"3\":{\"text\":{\"content\":\"Hallo\"}}},"
                    + "\"children\":[{\"id\":12,\"css\":\"a\",\"debug\":false}]}],\"keyword\":\"home\"}}";
            String permuted = "{\"page\":{\"keyword\":\"home\",\"sections\":[{\"children\":[{\"debug\":false,\"css\":\"a\",\"id\":12}],"
                    + "\"translations\":{\"3\":{\"text\":{\"content\":\"Hallo\"}},\"2\":{\"text\":{\"meta\":null,\"content\":\"Hello\"}}},"
                    + "\"id\":11}],\"id\":7}}";
            String leafChanged = permuted.replace("\"css\":\"a\"", "\"css\":\"b\"");

            String hash = versionService.generateStructureHash(snapshot(original));

            assertThat(versionService.generateStructureHash(snapshot(permuted))).isEqualTo(hash);
            assertThat(versionService.generateStructureHash(snapshot(leafChanged))).isNotEqualTo(hash);
            assertThat(versionService.generateStructureHash(snapshot(original.replace("Hallo", "Servus"))))
                    .isNotEqualTo(hash);
        }
    }

    // ==================== Queries & comparison ====================

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("Should report a missing published version")
        void shouldReportNoPublishedVersion() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, null)));

            StepVerifier.create(versionService.getPublishedVersion(1L))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(ResourceNotFoundException.class)
                            .extracting("messageKey").isEqualTo("error.no_published_version"))
                    .verify();
        }

        @Test
        @DisplayName("Should page through history with totals")
        void shouldReturnHistory() {
            when(snapshotService.findPage(1L)).thenReturn(Mono.just(page(1L, null)));
            when(versionRepository.findPageOfVersions(1L, 2, 0L)).thenReturn(Flux.just(
                    version(13L, 1L, 3, "{}"), version(12L, 1L, 2, "{}")));
            when(versionRepository.countByPageId(1L)).thenReturn(Mono.just(3L));

            StepVerifier.create(versionService.getVersionHistory(1L, 2, 0L))
                    .assertNext(history -> {
                        assertThat(history.getContent()).hasSize(2);
                        assertThat(history.getTotalElements()).isEqualTo(3L);
                        assertThat(history.isHasUnpublishedChanges()).isTrue();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should reject invalid paging arguments")
        void shouldRejectInvalidPaging() {
            StepVerifier.create(versionService.getVersionHistory(1L, 0, 0L))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            StepVerifier.create(versionService.getVersionHistory(1L, 10, -1L))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should refuse to compare versions of different pages")
        void shouldNotCompareAcrossPages() {
            when(versionRepository.findById(10L)).thenReturn(Mono.just(version(10L, 1L, 1, "{}")));
            when(versionRepository.findById(20L)).thenReturn(Mono.just(version(20L, 2L, 1, "{}")));

            StepVerifier.create(versionService.compareVersions(10L, 20L, DiffFormat.UNIFIED))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(InvalidVersionStateException.class)
                            .extracting("messageKey").isEqualTo("error.versions_different_pages"))
                    .verify();
        }

        @Test
        @DisplayName("Should compare two versions of one page")
        void shouldCompareVersions() {
            when(versionRepository.findById(10L)).thenReturn(Mono.just(version(10L, 1L, 1, "{\"a\":1}")));
            when(versionRepository.findById(11L)).thenReturn(Mono.just(version(11L, 1L, 2, "{\"a\":2}")));

            StepVerifier.create(versionService.compareVersions(10L, 11L, DiffFormat.SUMMARY))
                    .assertNext(comparison -> {
                        assertThat(comparison.getFrom().label()).isEqualTo("version_1");
                        assertThat(comparison.getTo().label()).isEqualTo("version_2");
                        assertThat(comparison.getFormat()).isEqualTo(DiffFormat.SUMMARY);
                        assertThat(((DifferenceSummary) comparison.getDiff()).changes()).hasSize(1);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should compare a version with the draft as the new side")
        void shouldCompareWithDraft() {
            when(versionRepository.findById(10L)).thenReturn(Mono.just(version(10L, 1L, 1, "{\"a\":1}")));
            when(snapshotService.buildDraftSnapshot(1L)).thenReturn(Mono.just(snapshot("{\"a\":1}")));

            StepVerifier.create(versionService.compareDraftWithVersion(1L, 10L, DiffFormat.UNIFIED))
                    .assertNext(comparison -> {
                        VersionComparisonResponse.Side to = comparison.getTo();
                        assertThat(to.isDraft()).isTrue();
                        assertThat(to.label()).isEqualTo("draft");
                        assertThat(comparison.getDiff()).isEqualTo("");
                    })
                    .verifyComplete();
        }
    }
}
