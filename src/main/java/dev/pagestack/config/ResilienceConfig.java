package dev.pagestack.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Timeouts and retry strategies shared by the render pipeline and the version store.
 *
 * <pre>
 * return pageRepository.findById(pageId)
 *         .timeout(resilience.getDatabaseTimeout())
 *         .retryWhen(resilience.databaseRetry());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration redisTimeout;
    private final Duration retrievalTimeout;
    private final int databaseRetryMaxAttempts;
    private final Duration databaseRetryMinBackoff;
    private final Duration databaseRetryMaxBackoff;
    private final int versionNumberRetryMaxAttempts;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.database.retry-max-attempts:3}") int databaseRetryMaxAttempts,
            @Value("${resilience.database.retry-min-backoff-ms:100}") int databaseRetryMinBackoffMs,
            @Value("${resilience.database.retry-max-backoff-ms:1000}") int databaseRetryMaxBackoffMs,
            @Value("${resilience.redis.timeout-seconds:5}") int redisTimeoutSeconds,
            @Value("${resilience.retrieval.timeout-seconds:5}") int retrievalTimeoutSeconds,
            @Value("${resilience.version-number.retry-max-attempts:3}") int versionNumberRetryMaxAttempts
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.redisTimeout = Duration.ofSeconds(redisTimeoutSeconds);
        this.retrievalTimeout = Duration.ofSeconds(retrievalTimeoutSeconds);
        this.databaseRetryMaxAttempts = databaseRetryMaxAttempts;
        this.databaseRetryMinBackoff = Duration.ofMillis(databaseRetryMinBackoffMs);
        this.databaseRetryMaxBackoff = Duration.ofMillis(databaseRetryMaxBackoffMs);
        this.versionNumberRetryMaxAttempts = versionNumberRetryMaxAttempts;
        log.info("Resilience configuration initialized (db={}s, retrieval={}s)", databaseTimeoutSeconds, retrievalTimeoutSeconds);
    }

    /**
     * Retry strategy for transient database failures, exponential backoff with jitter.
     */
    public Retry databaseRetry() {
        return Retry.backoff(databaseRetryMaxAttempts, databaseRetryMinBackoff)
                .maxBackoff(databaseRetryMaxBackoff)
                .jitter(0.5)
                .filter(this::isRetryableException)
                .doBeforeRetry(signal -> log.warn("Retrying database operation, attempt {}/{}: {}",
                        signal.totalRetries() + 1,
                        databaseRetryMaxAttempts,
                        signal.failure().getMessage()));
    }

    /**
     * Retry for two writers racing on the same {@code (page_id, version_number)} pair.
     * The whole transaction is re-run so the next number is read again.
     */
    public Retry duplicateKeyRetry() {
        return Retry.max(versionNumberRetryMaxAttempts)
                .filter(DuplicateKeyException.class::isInstance)
                .doBeforeRetry(signal -> log.warn("Version number taken concurrently, retrying ({}/{})",
                        signal.totalRetries() + 1, versionNumberRetryMaxAttempts));
    }

    private boolean isRetryableException(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) return false;

        String lowerMessage = message.toLowerCase();

        if (lowerMessage.contains("connection") ||
            lowerMessage.contains("timeout") ||
            lowerMessage.contains("temporarily unavailable") ||
            lowerMessage.contains("too many connections")) {
            return true;
        }

        // deadlocks
        return lowerMessage.contains("deadlock") || lowerMessage.contains("lock wait timeout");
    }
}
