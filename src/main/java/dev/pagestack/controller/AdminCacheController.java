package dev.pagestack.controller;

import dev.pagestack.service.CacheService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/cache")
@Validated
@RequiredArgsConstructor
@Tag(name = "Admin - Cache", description = "Render cache management endpoints")
@Slf4j
public class AdminCacheController {

    private final CacheService cacheService;

    @DeleteMapping("/pages")
    @Operation(summary = "Invalidate all page renders", description = "Clear every cached page render")
    public Mono<ResponseEntity<Map<String, Object>>> invalidateAllPages() {
        log.info("Invalidating all page renders");
        return cacheService.invalidateAllPages()
                .map(count -> ResponseEntity.ok(Map.of(
                        "message", "Page cache invalidated",
                        "entriesRemoved", count
                )));
    }

    @DeleteMapping("/pages/{pageId}")
    @Operation(summary = "Invalidate page renders", description = "Clear cached renders of one page")
    public Mono<ResponseEntity<Map<String, Object>>> invalidatePage(@PathVariable Long pageId) {
        log.info("Invalidating renders of page {}", pageId);
        return cacheService.invalidatePage(pageId)
                .map(count -> ResponseEntity.ok(Map.of(
                        "message", "Page cache invalidated",
                        "pageId", String.valueOf(pageId),
                        "entriesRemoved", count
                )));
    }

    @DeleteMapping("/tables/{tableName}")
    @Operation(summary = "Invalidate renders by data table", description = "Clear cached renders that read a data table")
    public Mono<ResponseEntity<Map<String, Object>>> invalidateDataTable(@PathVariable @Pattern(regexp = "^[A-Za-z0-9_]+$", message = "Invalid table name") String tableName) {
        log.info("Invalidating renders depending on table '{}'", tableName);
        return cacheService.invalidateDataTable(tableName)
                .map(count -> ResponseEntity.ok(Map.of(
                        "message", "Data table cache invalidated",
                        "tableName", tableName,
                        "entriesRemoved", count
                )));
    }
}
