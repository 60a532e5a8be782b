package dev.pagestack.controller;

import dev.pagestack.dto.RenderedPageResponse;
import dev.pagestack.engine.model.RenderContext;
import dev.pagestack.service.PageRenderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;

/**
 * Renders pages for visitors. Identity comes from the {@code X-User-*} headers set by the
 * fronting gateway; without {@code X-User-Id} the visitor is anonymous.
 */
@RestController
@RequestMapping("/api/v1/pages")
@Validated
@Tag(name = "Pages", description = "Page rendering endpoints")
@Slf4j
public class PageController {

    private final PageRenderService renderService;
    private final long defaultLanguageId;

    public PageController(PageRenderService renderService,
                          @Value("${app.cms.default-language-id:2}") long defaultLanguageId) {
        this.renderService = renderService;
        this.defaultLanguageId = defaultLanguageId;
    }

    @GetMapping("/{pageId}")
    @Operation(summary = "Render page", description = "Render the published version of a page, or its draft when nothing is published")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page rendered"),
            @ApiResponse(responseCode = "404", description = "Page not found")
    })
    public Mono<RenderedPageResponse> renderPage(
            @PathVariable Long pageId,
            @Parameter(description = "Working language id") @RequestParam(required = false) @Min(2) Long languageId,
            @RequestHeader HttpHeaders headers) {
        log.debug("Rendering page {} for visitor", pageId);
        return renderService.renderForVisitor(pageId, context(headers, languageId));
    }

    @GetMapping("/{pageId}/draft")
    @Operation(summary = "Render draft", description = "Render the current draft of a page")
    public Mono<RenderedPageResponse> renderDraft(
            @PathVariable Long pageId,
            @RequestParam(required = false) @Min(2) Long languageId,
            @RequestHeader HttpHeaders headers) {
        log.debug("Rendering draft of page {}", pageId);
        return renderService.renderPage(pageId, context(headers, languageId));
    }

    @GetMapping("/versions/{versionId}")
    @Operation(summary = "Render version", description = "Render a stored page version")
    public Mono<RenderedPageResponse> renderVersion(
            @PathVariable Long versionId,
            @RequestParam(required = false) @Min(2) Long languageId,
            @RequestHeader HttpHeaders headers) {
        log.debug("Rendering version {}", versionId);
        return renderService.renderVersion(versionId, context(headers, languageId));
    }

    RenderContext context(HttpHeaders headers, Long languageId) {
        return RenderContext.builder()
                .userId(parseUserId(headers.getFirst("X-User-Id")))
                .userName(headers.getFirst("X-User-Name"))
                .userEmail(headers.getFirst("X-User-Email"))
                .userCode(headers.getFirst("X-User-Code"))
                .userGroups(parseGroups(headers.getFirst("X-User-Groups")))
                .lastLogin(headers.getFirst("X-User-Last-Login"))
                .languageId(languageId != null ? languageId : defaultLanguageId)
                .languageLocale(headers.getFirst(HttpHeaders.ACCEPT_LANGUAGE))
                .platform(headers.getFirst("X-Platform"))
                .timezone(parseZone(headers.getFirst("X-Timezone")))
                .build();
    }

    private static Long parseUserId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("X-User-Id must be numeric");
        }
    }

    private static List<String> parseGroups(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(group -> !group.isEmpty())
                .toList();
    }

    private static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: " + value);
        }
    }
}
