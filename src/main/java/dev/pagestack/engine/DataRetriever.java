package dev.pagestack.engine;

import dev.pagestack.engine.model.RetrievalRequest;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Source of data-table rows for section data declarations.
 * Each row carries at least {@code record_id} and {@code entry_date}.
 */
public interface DataRetriever {

    /** User id that matches no rows; used when an anonymous visitor asks for their own entries. */
    long NO_USER = -1L;

    Flux<Map<String, Object>> retrieve(RetrievalRequest request);
}
