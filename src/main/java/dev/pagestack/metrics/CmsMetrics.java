package dev.pagestack.metrics;

import dev.pagestack.repository.PageRepository;
import dev.pagestack.repository.PageVersionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class CmsMetrics {

    private final MeterRegistry meterRegistry;
    private final PageRepository pageRepository;
    private final PageVersionRepository pageVersionRepository;

    private final AtomicLong totalPages = new AtomicLong(0);
    private final AtomicLong totalVersions = new AtomicLong(0);

    private Counter renderCacheHitCounter;
    private Counter renderCacheMissCounter;
    private Counter conditionFailedCounter;
    private Counter versionCreatedCounter;
    private Counter versionPublishedCounter;
    private Counter versionDeletedCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("cms.pages.total", totalPages, AtomicLong::get)
                .description("Number of pages")
                .register(meterRegistry);

        Gauge.builder("cms.versions.total", totalVersions, AtomicLong::get)
                .description("Number of stored page versions")
                .register(meterRegistry);

        renderCacheHitCounter = meterRegistry.counter("cms.render.cache", "result", "hit");
        renderCacheMissCounter = meterRegistry.counter("cms.render.cache", "result", "miss");
        conditionFailedCounter = meterRegistry.counter("cms.conditions.failed");
        versionCreatedCounter = meterRegistry.counter("cms.versions.created");
        versionPublishedCounter = meterRegistry.counter("cms.versions.published");
        versionDeletedCounter = meterRegistry.counter("cms.versions.deleted");
    }

    @Scheduled(fixedRateString = "${scheduling.metrics-update-ms:60000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void updateMetrics() {
        Mono.zip(
                pageRepository.count().onErrorReturn(0L),
                pageVersionRepository.count().onErrorReturn(0L)
        ).subscribe(
                tuple -> {
                    totalPages.set(tuple.getT1());
                    totalVersions.set(tuple.getT2());
                },
                error -> log.warn("Failed to update metrics: {}", error.getMessage())
        );
    }

    public void incrementRender(String mode) {
        meterRegistry.counter("cms.render.pages", "mode", mode).increment();
    }

    public void recordRenderCache(boolean hit) {
        (hit ? renderCacheHitCounter : renderCacheMissCounter).increment();
    }

    public void incrementRetrievalFailure(String table) {
        meterRegistry.counter("cms.retrieval.failures", "table", table).increment();
    }

    public void incrementConditionFailed() {
        conditionFailedCounter.increment();
    }

    public void incrementVersionCreated() {
        versionCreatedCounter.increment();
    }

    public void incrementVersionPublished() {
        versionPublishedCounter.increment();
    }

    public void incrementVersionDeleted(long count) {
        versionDeletedCounter.increment(count);
    }
}
