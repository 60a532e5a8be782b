package dev.pagestack.repository;

import dev.pagestack.entity.GlobalValue;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;

@Repository
public interface GlobalValueRepository extends ReactiveCrudRepository<GlobalValue, Long> {

    @Query("SELECT * FROM cms_global_values WHERE language_id IN (:languageIds) ORDER BY name")
    Flux<GlobalValue> findByLanguageIds(Collection<Long> languageIds);
}
