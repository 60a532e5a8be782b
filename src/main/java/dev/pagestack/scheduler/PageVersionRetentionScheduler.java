package dev.pagestack.scheduler;

import dev.pagestack.repository.PageRepository;
import dev.pagestack.service.CacheService;
import dev.pagestack.service.PageVersionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Prunes old page versions on a schedule, keeping the newest {@code app.cms.retention.keep}
 * versions of every page plus its published one.
 */
@Component
@ConditionalOnProperty(name = "app.cms.retention.enabled", havingValue = "true")
@Slf4j
public class PageVersionRetentionScheduler {

    static final String LOCK_KEY = "scheduler:version-retention:lock";
    private static final Duration LOCK_TTL = Duration.ofMinutes(10);

    private final PageRepository pageRepository;
    private final PageVersionService versionService;
    private final CacheService cacheService;
    private final int keep;

    public PageVersionRetentionScheduler(PageRepository pageRepository,
                                         PageVersionService versionService,
                                         CacheService cacheService,
                                         @Value("${app.cms.retention.keep:10}") int keep) {
        this.pageRepository = pageRepository;
        this.versionService = versionService;
        this.cacheService = cacheService;
        this.keep = keep;
    }

    /**
     * Uses a Redis SETNX lock so only one instance prunes at a time.
     */
    @Scheduled(cron = "${app.cms.retention.cron:0 30 3 * * *}")
    public void applyRetention() {
        runRetention().subscribe(
                deleted -> log.info("Version retention removed {} versions (keep={})", deleted, keep),
                error -> log.error("Error applying version retention: {}", error.getMessage())
        );
    }

    Mono<Integer> runRetention() {
        return cacheService.tryLock(LOCK_KEY, LOCK_TTL)
                .flatMap(acquired -> {
                    if (!Boolean.TRUE.equals(acquired)) {
                        log.debug("Skipping version retention, another instance holds the lock");
                        return Mono.just(0);
                    }
                    return pageRepository.findAllIds()
                            .concatMap(pageId -> versionService.applyRetentionPolicy(pageId, keep)
                                    .onErrorResume(e -> {
                                        log.warn("Retention failed for page {}: {}", pageId, e.getMessage());
                                        return Mono.just(0);
                                    }))
                            .reduce(0, Integer::sum);
                });
    }
}
