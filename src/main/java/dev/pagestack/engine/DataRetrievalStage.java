package dev.pagestack.engine;

import dev.pagestack.config.ResilienceConfig;
import dev.pagestack.engine.model.DataSourceDeclaration;
import dev.pagestack.engine.model.RenderContext;
import dev.pagestack.engine.model.RetrievalRequest;
import dev.pagestack.engine.model.RetrievalResult;
import dev.pagestack.engine.model.SectionNode;
import dev.pagestack.metrics.CmsMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Runs the data declarations of one section against a {@link DataRetriever}.
 * <p>
 * Declarations run one after another in declaration order and are interpolated against the
 * scope the section was entered with, so a declaration never sees the result of a sibling
 * declaration. Every declaration yields exactly one {@link RetrievalResult}; a failing read
 * is reported as a failure result rather than an error signal.
 */
@Component
@Slf4j
public class DataRetrievalStage {

    private final DataRetriever dataRetriever;
    private final InterpolationEngine interpolationEngine;
    private final ResilienceConfig resilience;
    private final CmsMetrics metrics;
    private final CircuitBreaker circuitBreaker;

    public DataRetrievalStage(DataRetriever dataRetriever,
                              InterpolationEngine interpolationEngine,
                              ResilienceConfig resilience,
                              CmsMetrics metrics) {
        this.dataRetriever = dataRetriever;
        this.interpolationEngine = interpolationEngine;
        this.resilience = resilience;
        this.metrics = metrics;

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .build();
        this.circuitBreaker = CircuitBreaker.of("section-data-retrieval", cbConfig);
        log.info("Data retrieval circuit breaker initialised (failureRate=50%, window=20, waitOpen=30s)");
    }

    public Flux<RetrievalResult> retrieve(SectionNode node, ScopeStore scope, RenderContext context) {
        List<DataSourceDeclaration> declarations = node.dataSources();
        if (declarations.isEmpty()) {
            return Flux.empty();
        }
        return Flux.fromStream(IntStream.range(0, declarations.size()).boxed())
                .concatMap(index -> retrieveOne(node, declarations.get(index), index, scope, context));
    }

    private Mono<RetrievalResult> retrieveOne(SectionNode node,
                                              DataSourceDeclaration raw,
                                              int index,
                                              ScopeStore scope,
                                              RenderContext context) {
        DataSourceDeclaration declaration = raw.interpolate(text -> interpolationEngine.interpolate(text, scope));
        String scopeName = declaration.scopeName(index);
        RetrievalRequest request = new RetrievalRequest(
                declaration.table(),
                declaration.filter(),
                declaration.requestedFieldNames(),
                true,
                context.languageId(),
                context.timezone() != null ? context.timezone() : ZoneOffset.UTC,
                declaration.currentUser()
                        ? (context.userId() != null ? context.userId() : DataRetriever.NO_USER)
                        : null);

        return Flux.defer(() -> dataRetriever.retrieve(request))
                .collectList()
                .timeout(resilience.getRetrievalTimeout())
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .map(rows -> RetrievalResult.success(scopeName, declaration.retrieve().shape(rows, declaration)))
                .onErrorResume(error -> {
                    log.warn("Data retrieval for section {} ({}) from table '{}' failed: {}",
                            node.id(), node.name(), declaration.table(), error.toString());
                    metrics.incrementRetrievalFailure(declaration.table());
                    return Mono.just(RetrievalResult.failure(scopeName, error));
                });
    }
}
