package dev.pagestack.controller;

import dev.pagestack.dto.CreateVersionRequest;
import dev.pagestack.dto.PageVersionResponse;
import dev.pagestack.dto.VersionComparisonResponse;
import dev.pagestack.dto.VersionHistoryResponse;
import dev.pagestack.entity.PageVersion;
import dev.pagestack.service.DiffFormat;
import dev.pagestack.service.PageVersionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/pages/{pageId}/versions")
@Validated
@RequiredArgsConstructor
@Tag(name = "Admin - Page Versions", description = "Page version history management")
@Slf4j
public class AdminPageVersionController {

    private final PageVersionService versionService;

    @GetMapping
    @Operation(summary = "Get version history", description = "Get a page of versions, newest first")
    public Mono<VersionHistoryResponse> getVersionHistory(
            @PathVariable Long pageId,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "0") @Min(0) long offset) {
        log.debug("Fetching version history for pageId={}, limit={}, offset={}", pageId, limit, offset);
        return versionService.getVersionHistory(pageId, limit, offset);
    }

    @GetMapping("/published")
    @Operation(summary = "Get published version", description = "Get the version visitors currently see")
    public Mono<PageVersionResponse> getPublishedVersion(@PathVariable Long pageId) {
        log.debug("Fetching published version for pageId={}", pageId);
        return versionService.getPublishedVersion(pageId)
                .map(PageVersionResponse::fromEntity);
    }

    @GetMapping("/{versionId}")
    @Operation(summary = "Get version", description = "Get a version including its snapshot")
    public Mono<PageVersionResponse> getVersion(@PathVariable Long pageId, @PathVariable Long versionId) {
        log.debug("Fetching version {} for pageId={}", versionId, pageId);
        return versionService.getVersion(pageId, versionId)
                .map(version -> PageVersionResponse.fromEntity(version, true));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create version", description = "Snapshot the current draft, optionally publishing it")
    public Mono<PageVersionResponse> createVersion(
            @PathVariable Long pageId,
            @Parameter(description = "Id of the editor creating the version")
            @RequestHeader(value = "X-User-Id", required = false) Long userId,
            @Valid @RequestBody CreateVersionRequest request) {
        log.info("Creating version for pageId={}, publish={}", pageId, request.isPublish());
        Mono<PageVersion> created = request.isPublish()
                ? versionService.createAndPublishVersion(pageId, request.getVersionName(), userId, request.getMetadata())
                : versionService.createVersion(pageId, request.getVersionName(), userId, request.getMetadata());
        return created.map(PageVersionResponse::fromEntity);
    }

    @PostMapping("/{versionId}/publish")
    @Operation(summary = "Publish version", description = "Make a version the one visitors see")
    public Mono<PageVersionResponse> publishVersion(@PathVariable Long pageId, @PathVariable Long versionId) {
        log.info("Publishing version {} of pageId={}", versionId, pageId);
        return versionService.publishVersion(pageId, versionId)
                .map(PageVersionResponse::fromEntity);
    }

    @PostMapping("/unpublish")
    @Operation(summary = "Unpublish page", description = "Clear the published version; visitors see the draft")
    public Mono<ResponseEntity<Map<String, Object>>> unpublishPage(@PathVariable Long pageId) {
        log.info("Unpublishing pageId={}", pageId);
        return versionService.unpublishPage(pageId)
                .thenReturn(ResponseEntity.ok(Map.of(
                        "message", "Page unpublished",
                        "pageId", String.valueOf(pageId)
                )));
    }

    @DeleteMapping("/{versionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete version", description = "Delete a version that is not published")
    public Mono<Void> deleteVersion(@PathVariable Long pageId, @PathVariable Long versionId) {
        log.info("Deleting version {} of pageId={}", versionId, pageId);
        return versionService.deleteVersion(pageId, versionId);
    }

    @GetMapping("/compare")
    @Operation(summary = "Compare versions", description = "Diff two versions of the page")
    public Mono<VersionComparisonResponse> compareVersions(
            @PathVariable Long pageId,
            @Parameter(description = "Version id of the old side") @RequestParam Long fromVersion,
            @Parameter(description = "Version id of the new side") @RequestParam Long toVersion,
            @Parameter(description = "unified, side_by_side, json_patch or summary")
            @RequestParam(defaultValue = "unified") String format) {
        log.debug("Comparing versions {} and {} of pageId={}", fromVersion, toVersion, pageId);
        return versionService.getVersion(pageId, fromVersion)
                .then(Mono.defer(() -> versionService.compareVersions(fromVersion, toVersion, DiffFormat.fromWireName(format))));
    }

    @GetMapping("/{versionId}/compare-draft")
    @Operation(summary = "Compare with draft", description = "Diff a version against the current draft")
    public Mono<VersionComparisonResponse> compareDraftWithVersion(
            @PathVariable Long pageId,
            @PathVariable Long versionId,
            @RequestParam(defaultValue = "unified") String format) {
        log.debug("Comparing draft of pageId={} with version {}", pageId, versionId);
        return versionService.compareDraftWithVersion(pageId, versionId, DiffFormat.fromWireName(format));
    }

    @GetMapping("/has-changes")
    @Operation(summary = "Has unpublished changes", description = "Whether the draft differs from the published version")
    public Mono<Map<String, Object>> hasUnpublishedChanges(@PathVariable Long pageId) {
        return versionService.hasUnpublishedChanges(pageId)
                .map(changed -> Map.of(
                        "pageId", String.valueOf(pageId),
                        "hasUnpublishedChanges", changed
                ));
    }

    @PostMapping("/retention")
    @Operation(summary = "Apply retention", description = "Delete all but the newest versions, keeping the published one")
    public Mono<Map<String, Object>> applyRetention(
            @PathVariable Long pageId,
            @RequestParam @Min(0) int keep) {
        log.info("Applying retention to pageId={}, keep={}", pageId, keep);
        return versionService.applyRetentionPolicy(pageId, keep)
                .map(deleted -> Map.of(
                        "pageId", String.valueOf(pageId),
                        "kept", keep,
                        "deleted", deleted
                ));
    }
}
