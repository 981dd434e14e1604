package com.lazyframe.explain;

import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Repartition;
import com.lazyframe.metrics.ExecutionStats;
import com.lazyframe.metrics.StageMetrics;
import com.lazyframe.physical.ExchangeExec;
import com.lazyframe.physical.PhysicalPlan;
import com.lazyframe.physical.SizeEstimator;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Builds {@link PlanDescription}s for logical and physical plans.
 *
 * <p>Example usage:
 * <pre>
 *   PlanDescription description = PlanExplainer.explain(physicalPlan, stream.stats());
 *   assertThat(description.exchangeCount()).isEqualTo(2);
 * </pre>
 */
public final class PlanExplainer {

    private PlanExplainer() {}

    public static PlanDescription explain(LogicalPlan plan) {
        List<PlanNodeDescription> nodes = new ArrayList<>();
        describe(plan, 0, nodes);
        return new PlanDescription(nodes);
    }

    public static PlanDescription explain(PhysicalPlan plan) {
        return explain(plan, null);
    }

    /**
     * Describes a physical plan, with actual row counts when stats are given.
     *
     * @param plan the physical plan
     * @param stats the run's statistics, or null before execution
     * @return the description
     */
    public static PlanDescription explain(PhysicalPlan plan, ExecutionStats stats) {
        List<PlanNodeDescription> nodes = new ArrayList<>();
        describe(plan, 0, stats, nodes);
        return new PlanDescription(nodes);
    }

    private static void describe(LogicalPlan node, int depth, List<PlanNodeDescription> out) {
        BoundaryKind boundary = node instanceof Repartition ? BoundaryKind.SHUFFLE : BoundaryKind.NONE;
        out.add(new PlanNodeDescription(depth, -1, node.nodeName(), node.toString(), "-",
            SizeEstimator.estimatedRows(node), OptionalLong.empty(), OptionalLong.empty(), boundary));
        for (LogicalPlan child : node.children()) {
            describe(child, depth + 1, out);
        }
    }

    private static void describe(PhysicalPlan node, int depth, ExecutionStats stats,
                                 List<PlanNodeDescription> out) {
        BoundaryKind boundary = BoundaryKind.NONE;
        if (node instanceof ExchangeExec) {
            boundary = ((ExchangeExec) node).isBroadcast() ? BoundaryKind.BROADCAST : BoundaryKind.SHUFFLE;
        }
        OptionalLong rowsIn = OptionalLong.empty();
        OptionalLong rowsOut = OptionalLong.empty();
        if (stats != null) {
            StageMetrics metrics = stats.stage(node.id());
            rowsIn = OptionalLong.of(metrics.rowsIn());
            rowsOut = OptionalLong.of(metrics.rowsOut());
        }
        out.add(new PlanNodeDescription(depth, node.id(), node.nodeName(), node.toString(),
            node.outputPartitioning().toString(), node.estimatedRows(), rowsIn, rowsOut, boundary));
        for (PhysicalPlan child : node.children()) {
            describe(child, depth + 1, stats, out);
        }
    }
}
