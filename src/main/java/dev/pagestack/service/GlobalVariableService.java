package dev.pagestack.service;

import dev.pagestack.config.ResilienceConfig;
import dev.pagestack.entity.GlobalValue;
import dev.pagestack.repository.GlobalValueRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads the {@code globals} namespace: site-wide named values in the working language,
 * falling back per name to the default language.
 */
@Service
@Slf4j
public class GlobalVariableService {

    private final GlobalValueRepository globalValueRepository;
    private final ResilienceConfig resilience;
    private final long defaultLanguageId;

    public GlobalVariableService(GlobalValueRepository globalValueRepository,
                                 ResilienceConfig resilience,
                                 @Value("${app.cms.default-language-id:2}") long defaultLanguageId) {
        this.globalValueRepository = globalValueRepository;
        this.resilience = resilience;
        this.defaultLanguageId = defaultLanguageId;
    }

    public Mono<Map<String, Object>> globals(long languageId) {
        return globalValueRepository.findByLanguageIds(List.of(languageId, defaultLanguageId))
                .collectList()
                .timeout(resilience.getDatabaseTimeout())
                .map(values -> overlay(values, languageId))
                .onErrorResume(e -> {
                    log.warn("Could not load global values for language {}: {}", languageId, e.getMessage());
                    return Mono.just(Map.of());
                });
    }

    private Map<String, Object> overlay(List<GlobalValue> values, long languageId) {
        Map<String, Object> fallback = new TreeMap<>();
        Map<String, Object> requested = new TreeMap<>();
        for (GlobalValue value : values) {
            if (value.getLanguageId() == languageId) {
                requested.put(value.getName(), value.getContent());
            } else {
                fallback.put(value.getName(), value.getContent());
            }
        }
        Map<String, Object> globals = new LinkedHashMap<>(fallback);
        globals.putAll(requested);
        return globals;
    }
}
