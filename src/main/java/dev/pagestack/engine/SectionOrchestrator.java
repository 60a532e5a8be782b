package dev.pagestack.engine;

import dev.pagestack.engine.model.ConditionResult;
import dev.pagestack.engine.model.RenderContext;
import dev.pagestack.engine.model.RenderedSection;
import dev.pagestack.engine.model.RetrievalResult;
import dev.pagestack.engine.model.SectionNode;
import dev.pagestack.metrics.CmsMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a language-resolved section tree depth-first and produces the live output.
 * <p>
 * For every section entered with scope {@code S}: its eligible fields are interpolated with
 * {@code S}, its data declarations run against {@code S} and their results are merged over
 * {@code S} (section-local names win). The eligible fields then get a second pass with the merged
 * scope, which only reaches placeholders the first pass left unresolved, and the condition is
 * evaluated against the merged scope. A failing
 * condition removes the section with its whole subtree; otherwise the children are processed
 * with the merged scope. Siblings never see each other's data.
 * <p>
 * Sections flagged {@code debug} are kept when their condition fails, without children, so the
 * editor can inspect the evaluation trace.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionOrchestrator {

    private final InterpolationEngine interpolationEngine;
    private final DataRetrievalStage dataRetrievalStage;
    private final ConditionEvaluator conditionEvaluator;
    private final CmsMetrics metrics;

    public Mono<List<RenderedSection>> render(List<SectionNode> tree, ScopeStore rootScope, RenderContext context) {
        return renderLevel(tree, rootScope, context);
    }

    private Mono<List<RenderedSection>> renderLevel(List<SectionNode> nodes, ScopeStore scope, RenderContext context) {
        return Flux.fromIterable(nodes)
                .concatMap(node -> renderNode(node, scope, context))
                .collectList();
    }

    private Mono<RenderedSection> renderNode(SectionNode node, ScopeStore inherited, RenderContext context) {
        SectionNode inheritedPass = interpolationEngine.interpolateSection(node, inherited);
        return dataRetrievalStage.retrieve(inheritedPass, inherited, context)
                // failed declarations are dropped here on purpose: their scope stays absent
                .filter(RetrievalResult::isSuccess)
                .collect(LinkedHashMap<String, Object>::new, (locals, result) -> locals.put(result.scope(), result.value()))
                .flatMap(locals -> {
                    ScopeStore merged = inherited.merge(locals);
                    SectionNode interpolated = interpolationEngine.interpolateSection(inheritedPass, merged);
                    ConditionResult condition = evaluate(interpolated, context, merged);

                    if (!condition.result()) {
                        metrics.incrementConditionFailed();
                        if (node.debug()) {
                            log.debug("Section {} ({}) failed its condition, kept for debugging", node.id(), node.name());
                            return Mono.just(RenderedSection.of(interpolated, sectionData(locals), condition, List.of()));
                        }
                        log.debug("Section {} ({}) failed its condition, dropping subtree", node.id(), node.name());
                        return Mono.empty();
                    }

                    ConditionResult trace = interpolated.hasCondition() ? condition : null;
                    return renderLevel(inheritedPass.children(), merged, context)
                            .map(children -> RenderedSection.of(interpolated, sectionData(locals), trace, children));
                });
    }

    private ConditionResult evaluate(SectionNode section, RenderContext context, ScopeStore scope) {
        if (!section.hasCondition()) {
            return ConditionResult.passed();
        }
        try {
            return conditionEvaluator.evaluate(section.condition(), context.userId(), section.name(), scope);
        } catch (RuntimeException e) {
            log.warn("Condition evaluator failed for section {} ({}): {}", section.id(), section.name(), e.getMessage());
            return ConditionResult.failed(e.getMessage());
        }
    }

    private static Map<String, Object> sectionData(Map<String, Object> locals) {
        return locals.isEmpty() ? null : locals;
    }
}
