package com.lazyframe.optimizer;

import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.LogicalPlan;

/**
 * Merges directly stacked filters into one.
 *
 * <pre>
 *   Filter(Filter(x, a), b)  -&gt;  Filter(x, b AND a)
 * </pre>
 */
public class CombineFiltersRule implements OptimizationRule {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> {
            if (node instanceof Filter && ((Filter) node).child() instanceof Filter) {
                Filter outer = (Filter) node;
                Filter inner = (Filter) outer.child();
                return new Filter(inner.child(), BinaryExpression.and(outer.condition(), inner.condition()));
            }
            return node;
        });
    }
}
