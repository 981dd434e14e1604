package com.lazyframe.optimizer;

import com.lazyframe.exception.OptimizerDivergedException;
import com.lazyframe.logical.LogicalPlan;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based optimizer that rewrites logical plans to a fixed point.
 *
 * <p>Each pass applies every rule in order. The loop stops after the first
 * pass that leaves the plan unchanged. If the plan is still changing after
 * the last allowed pass, an {@link OptimizerDivergedException} carrying the
 * last plan is thrown.
 *
 * <p>Example usage:
 * <pre>
 *   QueryOptimizer optimizer = new QueryOptimizer(20);
 *   LogicalPlan optimized = optimizer.optimize(plan);
 * </pre>
 *
 * <p>Default rules, in order:
 * <ul>
 *   <li>{@link CombineFiltersRule} - merge adjacent filters</li>
 *   <li>{@link FilterPushdownRule} - move filters towards the scans</li>
 *   <li>{@link AggregateFusionRule} - merge self-joined aggregates</li>
 *   <li>{@link TopNRule} - replace sort+limit and rank filters with top-N</li>
 *   <li>{@link CollapseRepartitionRule} - drop shadowed repartitions</li>
 *   <li>{@link ColumnPruningRule} - read and carry only needed columns</li>
 * </ul>
 */
public class QueryOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryOptimizer.class);

    private final List<OptimizationRule> rules;
    private final int maxPasses;

    /**
     * Creates an optimizer with the default rules.
     *
     * @param maxPasses the maximum number of passes
     */
    public QueryOptimizer(int maxPasses) {
        this(defaultRules(), maxPasses);
    }

    /**
     * Creates an optimizer with custom rules.
     *
     * @param rules the rules to apply, in order
     * @param maxPasses the maximum number of passes
     */
    public QueryOptimizer(List<OptimizationRule> rules, int maxPasses) {
        this.rules = new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null"));
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1: " + maxPasses);
        }
        this.maxPasses = maxPasses;
    }

    /**
     * Optimizes a logical plan.
     *
     * @param plan the input plan
     * @return the optimized plan
     * @throws OptimizerDivergedException if no fixed point is reached within the pass limit
     */
    public LogicalPlan optimize(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        LogicalPlan currentPlan = plan;

        for (int pass = 1; pass <= maxPasses; pass++) {
            LogicalPlan passInput = currentPlan;

            for (OptimizationRule rule : rules) {
                LogicalPlan before = currentPlan;
                currentPlan = Objects.requireNonNull(rule.apply(currentPlan),
                    () -> rule.name() + " returned null");
                if (currentPlan != before && !currentPlan.equals(before)) {
                    logger.debug("Pass {}: {} rewrote plan\n{}", pass, rule.name(), currentPlan.treeString());
                }
            }

            if (currentPlan == passInput || currentPlan.equals(passInput)) {
                logger.debug("Optimizer reached a fixed point after {} pass(es)", pass);
                return currentPlan;
            }
        }

        throw new OptimizerDivergedException(maxPasses, currentPlan);
    }

    /**
     * Creates the default rule list.
     *
     * @return the default rules
     */
    public static List<OptimizationRule> defaultRules() {
        return Arrays.asList(
            new CombineFiltersRule(),
            new FilterPushdownRule(),
            new AggregateFusionRule(),
            new TopNRule(),
            new CollapseRepartitionRule(),
            new ColumnPruningRule()
        );
    }

    public List<OptimizationRule> rules() {
        return new ArrayList<>(rules);
    }

    public int maxPasses() {
        return maxPasses;
    }
}
