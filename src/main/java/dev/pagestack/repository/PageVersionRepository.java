package dev.pagestack.repository;

import dev.pagestack.entity.PageVersion;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface PageVersionRepository extends ReactiveCrudRepository<PageVersion, Long> {

    Flux<PageVersion> findByPageIdOrderByVersionNumberDesc(Long pageId);

    @Query("SELECT * FROM page_versions WHERE page_id = :pageId ORDER BY version_number DESC LIMIT :limit OFFSET :offset")
    Flux<PageVersion> findPageOfVersions(Long pageId, int limit, long offset);

    @Query("SELECT COALESCE(MAX(version_number), 0) FROM page_versions WHERE page_id = :pageId")
    Mono<Integer> findMaxVersionNumber(Long pageId);

    @Query("SELECT COUNT(*) FROM page_versions WHERE page_id = :pageId")
    Mono<Long> countByPageId(Long pageId);

    @Modifying
    @Query("UPDATE page_versions SET published_at = :publishedAt WHERE id = :versionId")
    Mono<Integer> markPublished(Long versionId, LocalDateTime publishedAt);

    @Modifying
    @Query("UPDATE page_versions SET published_at = NULL WHERE page_id = :pageId AND id <> :versionId")
    Mono<Integer> clearPublishedExcept(Long pageId, Long versionId);

    @Modifying
    @Query("UPDATE page_versions SET published_at = NULL WHERE page_id = :pageId")
    Mono<Integer> clearPublished(Long pageId);
}
