package dev.pagestack.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagestack.config.ResilienceConfig;
import dev.pagestack.engine.model.CacheDependencies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Redis-backed cache for rendered pages.
 * <p>
 * Keys encode everything a render depends on so that invalidation can work by pattern:
 * <pre>
 * pages::p{pageId}:s{draft|v{versionId}}:l{languageId}:u{userId|anon}:t|table1|table2|
 * </pre>
 * Without a Redis connection every read misses and every write is a no-op; Redis errors
 * are logged and treated the same way.
 */
@Service
@Slf4j
public class CacheService {

    static final String PAGES_CACHE_PREFIX = "pages::";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ResilienceConfig resilience;

    public CacheService(
            @Autowired(required = false) ReactiveStringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            ResilienceConfig resilience) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.resilience = resilience;
    }

    public boolean isRedisAvailable() {
        return redisTemplate != null;
    }

    private <T> Mono<T> withRedis(T fallback, Supplier<Mono<T>> operation) {
        if (!isRedisAvailable()) {
            return Mono.just(fallback);
        }
        return operation.get()
                .timeout(resilience.getRedisTimeout())
                .onErrorResume(e -> {
                    log.warn("Redis operation failed, continuing without cache: {}", e.getMessage());
                    return Mono.just(fallback);
                });
    }

    // ==================== KEYS ====================

    public static String renderKey(long pageId, Long versionId, long languageId, Long userId, CacheDependencies dependencies) {
        StringBuilder key = new StringBuilder(PAGES_CACHE_PREFIX)
                .append('p').append(pageId)
                .append(":s").append(versionId == null ? "draft" : "v" + versionId)
                .append(":l").append(languageId)
                .append(":u").append(userId != null ? userId.toString() : "anon")
                .append(":t|");
        dependencies.allTables().forEach(table -> key.append(table).append('|'));
        return key.toString();
    }

    // ==================== GENERIC OPERATIONS ====================

    public <T> Mono<T> get(String key, TypeReference<T> type) {
        if (!isRedisAvailable()) return Mono.empty();
        return redisTemplate.opsForValue().get(key)
                .timeout(resilience.getRedisTimeout())
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, type));
                    } catch (JsonProcessingException e) {
                        log.warn("Failed to deserialize cached value for key {}: {}", key, e.getOriginalMessage());
                        return Mono.<T>empty();
                    }
                })
                .doOnNext(v -> log.trace("Cache hit for key: {}", key))
                .onErrorResume(e -> {
                    log.warn("Cache read failed for key {}: {}", key, e.getMessage());
                    return Mono.empty();
                });
    }

    public <T> Mono<Boolean> set(String key, T value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize value for key {}: {}", key, e.getOriginalMessage());
            return Mono.just(false);
        }
        return withRedis(false, () -> redisTemplate.opsForValue().set(key, json, ttl)
                .doOnSuccess(success -> log.trace("Cached value for key: {} with TTL: {}", key, ttl)));
    }

    /**
     * Takes a short-lived lock; true when this caller obtained it. Without Redis the lock
     * is always granted.
     */
    public Mono<Boolean> tryLock(String key, Duration ttl) {
        return withRedis(true, () -> redisTemplate.opsForValue().setIfAbsent(key, "locked", ttl));
    }

    // ==================== INVALIDATION ====================

    /**
     * Drops every cached render of a page: draft, all versions, all languages and users.
     */
    public Mono<Long> invalidatePage(long pageId) {
        return withRedis(0L, () -> deleteByPattern(PAGES_CACHE_PREFIX + "p" + pageId + ":*")
                .doOnSuccess(count -> log.info("Invalidated {} cached renders of page {}", count, pageId)));
    }

    /**
     * Drops every cached render that read {@code tableName}.
     */
    public Mono<Long> invalidateDataTable(String tableName) {
        return withRedis(0L, () -> deleteByPattern(PAGES_CACHE_PREFIX + "*|" + escapeGlob(tableName) + "|*")
                .doOnSuccess(count -> log.info("Invalidated {} cached renders depending on table '{}'", count, tableName)));
    }

    public Mono<Long> invalidateAllPages() {
        return withRedis(0L, () -> deleteByPattern(PAGES_CACHE_PREFIX + "*")
                .doOnSuccess(count -> log.info("Invalidated {} cached renders", count)));
    }

    // SCAN MATCH treats * ? [ ] as wildcards; a backslash makes them literal
    static String escapeGlob(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private Mono<Long> deleteByPattern(String pattern) {
        return redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(100).build())
                .collectList()
                .flatMap(keys -> {
                    if (keys.isEmpty()) {
                        return Mono.just(0L);
                    }
                    return redisTemplate.delete(keys.toArray(new String[0]));
                });
    }
}
