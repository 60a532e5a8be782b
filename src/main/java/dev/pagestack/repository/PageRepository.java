package dev.pagestack.repository;

import dev.pagestack.entity.Page;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface PageRepository extends ReactiveCrudRepository<Page, Long> {

    @Query("SELECT id FROM pages ORDER BY id")
    Flux<Long> findAllIds();

    @Modifying
    @Query("UPDATE pages SET published_version_id = :versionId, updated_at = CURRENT_TIMESTAMP WHERE id = :pageId")
    Mono<Integer> updatePublishedVersion(Long pageId, Long versionId);

    @Modifying
    @Query("UPDATE pages SET published_version_id = NULL, updated_at = CURRENT_TIMESTAMP WHERE id = :pageId")
    Mono<Integer> clearPublishedVersion(Long pageId);
}
