package dev.pagestack.controller;

import dev.pagestack.dto.CreateVersionRequest;
import dev.pagestack.dto.VersionComparisonResponse;
import dev.pagestack.dto.VersionHistoryResponse;
import dev.pagestack.entity.JsonDocument;
import dev.pagestack.entity.PageVersion;
import dev.pagestack.exception.InvalidVersionStateException;
import dev.pagestack.service.DiffFormat;
import dev.pagestack.service.PageVersionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdminPageVersionControllerTest {

    @Mock
    private PageVersionService versionService;

    @InjectMocks
    private AdminPageVersionController controller;

    private static PageVersion version(long id, int number) {
        return PageVersion.builder()
                .id(id)
                .pageId(1L)
                .versionNumber(number)
                .versionName("v" + number)
                .pageJson(JsonDocument.of("{\"page\":{\"id\":1}}"))
                .createdAt(LocalDateTime.of(2024, 3, 1, 12, 0))
                .build();
    }

    @Nested
    @DisplayName("GET /api/v1/admin/pages/{pageId}/versions")
    class History {

        @Test
        @DisplayName("Should return the version history page")
        void shouldReturnHistory() {
            VersionHistoryResponse history = VersionHistoryResponse.of(List.of(), 20, 0, 0, true);
            when(versionService.getVersionHistory(1L, 20, 0L)).thenReturn(Mono.just(history));

            StepVerifier.create(controller.getVersionHistory(1L, 20, 0L))
                    .assertNext(response -> {
                        assertThat(response.getTotalElements()).isZero();
                        assertThat(response.isHasUnpublishedChanges()).isTrue();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should include the snapshot when fetching a single version")
        void shouldReturnVersionWithSnapshot() {
            when(versionService.getVersion(1L, 10L)).thenReturn(Mono.just(version(10L, 2)));

            StepVerifier.create(controller.getVersion(1L, 10L))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo("10");
                        assertThat(response.getPageJson()).isNotNull();
                        assertThat(response.isPublished()).isFalse();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should leave the snapshot out of the published version summary")
        void shouldReturnPublishedVersion() {
            PageVersion published = version(10L, 2);
            published.setPublishedAt(LocalDateTime.of(2024, 3, 2, 9, 0));
            when(versionService.getPublishedVersion(1L)).thenReturn(Mono.just(published));

            StepVerifier.create(controller.getPublishedVersion(1L))
                    .assertNext(response -> {
                        assertThat(response.isPublished()).isTrue();
                        assertThat(response.getPageJson()).isNull();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("POST /api/v1/admin/pages/{pageId}/versions")
    class Create {

        @Test
        @DisplayName("Should create a version from the draft")
        void shouldCreateVersion() {
            CreateVersionRequest request = CreateVersionRequest.builder().versionName("Spring launch").build();
            when(versionService.createVersion(1L, "Spring launch", 42L, null)).thenReturn(Mono.just(version(10L, 1)));

            StepVerifier.create(controller.createVersion(1L, 42L, request))
                    .assertNext(response -> assertThat(response.getVersionNumber()).isEqualTo(1))
                    .verifyComplete();

            verify(versionService, never()).createAndPublishVersion(anyLong(), any(), any(), any());
        }

        @Test
        @DisplayName("Should create and publish when asked to")
        void shouldCreateAndPublish() {
            CreateVersionRequest request = CreateVersionRequest.builder()
                    .publish(true)
                    .metadata(Map.of("ticket", "CMS-12"))
                    .build();
            PageVersion published = version(10L, 1);
            published.setPublishedAt(LocalDateTime.now());
            when(versionService.createAndPublishVersion(1L, null, null, Map.of("ticket", "CMS-12")))
                    .thenReturn(Mono.just(published));

            StepVerifier.create(controller.createVersion(1L, null, request))
                    .assertNext(response -> assertThat(response.isPublished()).isTrue())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("publication")
    class Publication {

        @Test
        @DisplayName("Should publish a version")
        void shouldPublish() {
            PageVersion published = version(10L, 2);
            published.setPublishedAt(LocalDateTime.now());
            when(versionService.publishVersion(1L, 10L)).thenReturn(Mono.just(published));

            StepVerifier.create(controller.publishVersion(1L, 10L))
                    .assertNext(response -> assertThat(response.isPublished()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should unpublish a page")
        void shouldUnpublish() {
            when(versionService.unpublishPage(1L)).thenReturn(Mono.empty());

            StepVerifier.create(controller.unpublishPage(1L))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode().value()).isEqualTo(200);
                        assertThat(response.getBody()).containsEntry("pageId", "1");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should propagate a refused delete")
        void shouldPropagateRefusedDelete() {
            when(versionService.deleteVersion(1L, 10L)).thenReturn(Mono.error(
                    new InvalidVersionStateException("error.delete_published_version", "published")));

            StepVerifier.create(controller.deleteVersion(1L, 10L))
                    .expectError(InvalidVersionStateException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("comparison")
    class Comparison {

        @Test
        @DisplayName("Should check the old side belongs to the page before comparing")
        void shouldCompareVersions() {
            VersionComparisonResponse comparison = VersionComparisonResponse.builder()
                    .format(DiffFormat.JSON_PATCH)
                    .diff(List.of())
                    .build();
            when(versionService.getVersion(1L, 10L)).thenReturn(Mono.just(version(10L, 1)));
            when(versionService.compareVersions(10L, 11L, DiffFormat.JSON_PATCH)).thenReturn(Mono.just(comparison));

            StepVerifier.create(controller.compareVersions(1L, 10L, 11L, "json_patch"))
                    .expectNext(comparison)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should not compare when the old side belongs to another page")
        void shouldRejectForeignVersion() {
            when(versionService.getVersion(1L, 10L)).thenReturn(Mono.error(
                    new InvalidVersionStateException("error.version_wrong_page", "wrong page")));

            StepVerifier.create(controller.compareVersions(1L, 10L, 11L, "unified"))
                    .expectError(InvalidVersionStateException.class)
                    .verify();

            verify(versionService, never()).compareVersions(anyLong(), anyLong(), any());
        }

        @Test
        @DisplayName("Should fall back to unified diffs for unknown formats")
        void shouldCompareDraft() {
            VersionComparisonResponse comparison = VersionComparisonResponse.builder().format(DiffFormat.UNIFIED).diff("").build();
            when(versionService.compareDraftWithVersion(1L, 10L, DiffFormat.UNIFIED)).thenReturn(Mono.just(comparison));

            StepVerifier.create(controller.compareDraftWithVersion(1L, 10L, "html"))
                    .expectNext(comparison)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should report unpublished changes")
        void shouldReportChanges() {
            when(versionService.hasUnpublishedChanges(1L)).thenReturn(Mono.just(false));

            StepVerifier.create(controller.hasUnpublishedChanges(1L))
                    .assertNext(body -> assertThat(body)
                            .containsEntry("pageId", "1")
                            .containsEntry("hasUnpublishedChanges", false))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("Should report how many versions retention removed")
    void shouldApplyRetention() {
        when(versionService.applyRetentionPolicy(1L, 3)).thenReturn(Mono.just(4));

        StepVerifier.create(controller.applyRetention(1L, 3))
                .assertNext(body -> assertThat(body)
                        .containsEntry("kept", 3)
                        .containsEntry("deleted", 4))
                .verifyComplete();
    }
}
