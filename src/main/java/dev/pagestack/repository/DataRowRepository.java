package dev.pagestack.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Rows of the user-defined data tables sections read through {@code data_config}.
 */
public interface DataRowRepository {

    Mono<Long> findTableId(String tableName);

    /**
     * Rows of one table in insertion order.
     *
     * @param userId     only this user's rows when not null
     * @param languageId rows stored for this language or for no language
     */
    Flux<DataRow> findRows(Long tableId, Long userId, long languageId, boolean excludeDeleted);

    record DataRow(Long id, Long userId, Long languageId, String payload, LocalDateTime createdAt) {
    }
}
