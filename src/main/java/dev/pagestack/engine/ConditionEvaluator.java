package dev.pagestack.engine;

import dev.pagestack.engine.model.ConditionResult;

/**
 * Decides whether a section is included in the rendered output.
 */
public interface ConditionEvaluator {

    /**
     * @param condition      the section's condition after interpolation, never blank
     * @param userId         requesting user, null for anonymous visitors
     * @param sectionKeyword section name, used in error messages
     * @param scope          the section's merged scope
     */
    ConditionResult evaluate(String condition, Long userId, String sectionKeyword, ScopeStore scope);
}
