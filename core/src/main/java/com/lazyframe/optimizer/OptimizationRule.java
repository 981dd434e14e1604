package com.lazyframe.optimizer;

import com.lazyframe.logical.LogicalPlan;

/**
 * Interface for logical rewrite rules.
 *
 * <p>A rule transforms a logical plan into an equivalent plan that should
 * execute with less work or less data movement. Rules are applied
 * repeatedly by {@link QueryOptimizer} until the plan stops changing.
 *
 * <p>Rules must preserve query semantics: the rewritten plan produces the
 * same multiset of rows as the input plan.
 */
public interface OptimizationRule {

    /**
     * Applies this rule to a logical plan.
     *
     * <p>Returns the input instance (or an equal plan) when the rule has
     * nothing to do, so that the optimizer can detect a fixed point.
     *
     * @param plan the input plan
     * @return the rewritten plan
     */
    LogicalPlan apply(LogicalPlan plan);

    /**
     * Returns the name of this rule, used for logging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
