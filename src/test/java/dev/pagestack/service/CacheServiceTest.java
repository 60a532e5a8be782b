package dev.pagestack.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagestack.config.ResilienceConfig;
import dev.pagestack.engine.model.CacheDependencies;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheServiceTest {

    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};

    @Mock
    private ReactiveStringRedisTemplate redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private ResilienceConfig resilience;

    private CacheService cacheService;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        resilience = new ResilienceConfig(10, 3, 100, 1000, 5, 5, 3);
        cacheService = new CacheService(redisTemplate, objectMapper, resilience);
    }

    // ==================== Keys ====================

    @Nested
    @DisplayName("renderKey")
    class RenderKey {

        @Test
        @DisplayName("Should encode version, language, user and sorted tables")
        void shouldEncodeEverythingARenderDependsOn() {
            CacheDependencies dependencies = new CacheDependencies(Set.of("orders"), Set.of("news", "alerts"));

            assertThat(CacheService.renderKey(7L, 31L, 2L, 42L, dependencies))
                    .isEqualTo("pages::p7:sv31:l2:u42:t|alerts|news|orders|");
        }

        @Test
        @DisplayName("Should mark drafts and anonymous visitors")
        void shouldMarkDraftAndAnonymous() {
            CacheDependencies none = new CacheDependencies(Set.of(), Set.of());

            assertThat(CacheService.renderKey(7L, null, 3L, null, none)).isEqualTo("pages::p7:sdraft:l3:uanon:t|");
        }
    }

    // ==================== Generic operations ====================

    @Nested
    @DisplayName("get")
    class Get {

        @Test
        @DisplayName("Should deserialize cached JSON on hit")
        void shouldReturnCachedValueOnHit() {
            // Given
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.get("my-key")).thenReturn(Mono.just("{\"a\":\"b\"}"));

            // When & Then
            StepVerifier.create(cacheService.get("my-key", MAP_TYPE))
                    .expectNext(Map.of("a", "b"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should treat an unreadable entry as a miss")
        void shouldMissOnCorruptEntry() {
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.get("my-key")).thenReturn(Mono.just("{not json"));

            StepVerifier.create(cacheService.get("my-key", MAP_TYPE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should treat Redis errors as a miss")
        void shouldMissOnRedisError() {
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.get("my-key")).thenReturn(Mono.error(new RuntimeException("Connection refused")));

            StepVerifier.create(cacheService.get("my-key", MAP_TYPE))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return empty when Redis is unavailable")
        void shouldReturnEmptyWhenRedisUnavailable() {
            // Given - no Redis template
            CacheService noRedisService = new CacheService(null, objectMapper, resilience);

            StepVerifier.create(noRedisService.get("any-key", MAP_TYPE))
                    .verifyComplete();
            assertThat(noRedisService.isRedisAvailable()).isFalse();
        }
    }

    @Nested
    @DisplayName("set")
    class SetValue {

        @Test
        @DisplayName("Should store JSON with TTL")
        void shouldStoreJsonWithTtl() {
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.set(eq("k"), anyString(), eq(Duration.ofMinutes(10)))).thenReturn(Mono.just(true));

            StepVerifier.create(cacheService.set("k", Map.of("a", "b"), Duration.ofMinutes(10)))
                    .expectNext(true)
                    .verifyComplete();

            verify(valueOperations).set("k", "{\"a\":\"b\"}", Duration.ofMinutes(10));
        }

        @Test
        @DisplayName("Should report false instead of failing when Redis errors")
        void shouldSwallowRedisErrors() {
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.set(anyString(), anyString(), any(Duration.class)))
                    .thenReturn(Mono.error(new RuntimeException("READONLY")));

            StepVerifier.create(cacheService.set("k", "v", Duration.ofMinutes(1)))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should be a no-op without Redis")
        void shouldNoOpWithoutRedis() {
            StepVerifier.create(new CacheService(null, objectMapper, resilience).set("k", "v", Duration.ofMinutes(1)))
                    .expectNext(false)
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("tryLock")
    class TryLock {

        @Test
        @DisplayName("Should report whether the lock was taken")
        void shouldUseSetIfAbsent() {
            when(redisTemplate.opsForValue()).thenReturn(valueOperations);
            when(valueOperations.setIfAbsent("lock", "locked", Duration.ofMinutes(5))).thenReturn(Mono.just(false));

            StepVerifier.create(cacheService.tryLock("lock", Duration.ofMinutes(5)))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should always grant the lock without Redis")
        void shouldGrantWithoutRedis() {
            StepVerifier.create(new CacheService(null, objectMapper, resilience).tryLock("lock", Duration.ofMinutes(5)))
                    .expectNext(true)
                    .verifyComplete();
        }
    }

    // ==================== Invalidation ====================

    @Nested
    @DisplayName("invalidation")
    class Invalidation {

        @Test
        @DisplayName("Should delete every render of a page by pattern")
        void shouldInvalidatePage() {
            when(redisTemplate.scan(any(ScanOptions.class)))
                    .thenReturn(Flux.just("pages::p7:sdraft:l2:uanon:t|", "pages::p7:sv3:l2:u42:t|orders|"));
            when(redisTemplate.delete(any(String[].class))).thenReturn(Mono.just(2L));

            StepVerifier.create(cacheService.invalidatePage(7L))
                    .expectNext(2L)
                    .verifyComplete();

            ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
            verify(redisTemplate).scan(options.capture());
            assertThat(options.getValue().getPattern()).isEqualTo("pages::p7:*");
        }

        @Test
        @DisplayName("Should match data tables between pipe delimiters")
        void shouldInvalidateByTable() {
            when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(Flux.empty());

            StepVerifier.create(cacheService.invalidateDataTable("orders"))
                    .expectNext(0L)
                    .verifyComplete();

            ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
            verify(redisTemplate).scan(options.capture());
            assertThat(options.getValue().getPattern()).isEqualTo("pages::*|orders|*");
            verify(redisTemplate, never()).delete(any(String[].class));
        }

        @Test
        @DisplayName("Should match wildcard characters in table names literally")
        void shouldEscapeTableNameWildcards() {
            when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(Flux.empty());

            StepVerifier.create(cacheService.invalidateDataTable("ord*rs?[1]"))
                    .expectNext(0L)
                    .verifyComplete();

            ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
            verify(redisTemplate).scan(options.capture());
            assertThat(options.getValue().getPattern()).isEqualTo("pages::*|ord\\*rs\\?\\[1\\]|*");
        }

        @Test
        @DisplayName("Should report zero when Redis fails during a scan")
        void shouldReportZeroOnScanError() {
            when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(Flux.error(new RuntimeException("down")));

            StepVerifier.create(cacheService.invalidateAllPages())
                    .expectNext(0L)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should report zero without Redis")
        void shouldReportZeroWithoutRedis() {
            StepVerifier.create(new CacheService(null, objectMapper, resilience).invalidatePage(7L))
                    .expectNext(0L)
                    .verifyComplete();
        }
    }
}
