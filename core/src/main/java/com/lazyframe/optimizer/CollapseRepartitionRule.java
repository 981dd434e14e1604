package com.lazyframe.optimizer;

import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Repartition;

/**
 * Removes a repartition whose output is immediately redistributed again.
 *
 * <pre>
 *   Repartition(Repartition(x, k1), k2)  -&gt;  Repartition(x, k2)
 * </pre>
 */
public class CollapseRepartitionRule implements OptimizationRule {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> {
            if (node instanceof Repartition && ((Repartition) node).child() instanceof Repartition) {
                Repartition outer = (Repartition) node;
                Repartition inner = (Repartition) outer.child();
                return new Repartition(inner.child(), outer.keys(), outer.numPartitions());
            }
            return node;
        });
    }
}
