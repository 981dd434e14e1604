package com.lazyframe.optimizer;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.Repartition;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.Window;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Optimization rule that pushes filters down towards data sources.
 *
 * <p>Moving filters closer to table scans reduces the rows every later
 * operator, and every exchange, has to handle. The filter is split into
 * conjuncts and each conjunct moves independently:
 * <pre>
 *   // Through project, rewriting aliases to the expressions they name
 *   Filter(Project(x, a + 1 AS b), b &gt; 5)  -&gt;  Project(Filter(x, a + 1 &gt; 5), a + 1 AS b)
 *
 *   // Through repartition and sort
 *   Filter(Repartition(x))  -&gt;  Repartition(Filter(x))
 *
 *   // Into the join side that owns the referenced columns
 *   Filter(Join(l, r), p(l))  -&gt;  Join(Filter(l, p), r)
 *
 *   // Through aggregation, only when the conjunct uses grouping keys
 *   Filter(Aggregate(x, k), p(k))  -&gt;  Aggregate(Filter(x, p), k)
 * </pre>
 *
 * <p>Right-side conjuncts only move below INNER joins: below a LEFT join they
 * would turn filtered-out matches into null-extended rows. Conjuncts that
 * read an aggregate result stay above their aggregate, and nothing moves
 * through a limit or top-N since that would change which rows are kept.
 */
public class FilterPushdownRule implements OptimizationRule {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformDown(node -> node instanceof Filter ? pushDown((Filter) node) : node);
    }

    private LogicalPlan pushDown(Filter filter) {
        LogicalPlan child = filter.child();
        if (child instanceof Project) {
            return pushThroughProject(filter, (Project) child);
        }
        if (child instanceof Repartition || child instanceof Sort) {
            return child.withNewChildren(List.of(new Filter(child.children().get(0), filter.condition())));
        }
        if (child instanceof Join) {
            return pushIntoJoin(filter, (Join) child);
        }
        if (child instanceof Window) {
            Window window = (Window) child;
            return pushThroughUnary(filter, window, window.partitionKeys());
        }
        if (child instanceof Aggregate && ((Aggregate) child).isGrouped()) {
            Aggregate aggregate = (Aggregate) child;
            return pushThroughUnary(filter, aggregate, aggregate.groupingKeys());
        }
        return filter;
    }

    private LogicalPlan pushThroughProject(Filter filter, Project project) {
        Map<String, Expression> aliases = new HashMap<>();
        for (Expression projection : project.projections()) {
            aliases.put(ExpressionUtils.outputName(projection), ExpressionUtils.stripAlias(projection));
        }
        Expression rewritten = ExpressionUtils.substitute(filter.condition(), aliases);
        return new Project(new Filter(project.child(), rewritten), project.projections());
    }

    /**
     * Pushes the conjuncts that only reference {@code allowedColumns} below a
     * single-child node.
     */
    private LogicalPlan pushThroughUnary(Filter filter, LogicalPlan node, Collection<String> allowedColumns) {
        List<Expression> pushed = new ArrayList<>();
        List<Expression> kept = new ArrayList<>();
        for (Expression conjunct : ExpressionUtils.splitConjuncts(filter.condition())) {
            if (allowedColumns.containsAll(ExpressionUtils.referencedColumns(conjunct))) {
                pushed.add(conjunct);
            } else {
                kept.add(conjunct);
            }
        }
        if (pushed.isEmpty()) {
            return filter;
        }
        LogicalPlan grandChild = node.children().get(0);
        LogicalPlan rewritten = node.withNewChildren(
            List.of(new Filter(grandChild, ExpressionUtils.combineConjuncts(pushed))));
        return kept.isEmpty() ? rewritten : new Filter(rewritten, ExpressionUtils.combineConjuncts(kept));
    }

    private LogicalPlan pushIntoJoin(Filter filter, Join join) {
        Set<String> leftColumns = Set.copyOf(join.left().schema().fieldNames());
        Set<String> rightColumns = Set.copyOf(join.right().schema().fieldNames());
        boolean canPushRight = join.joinType() == Join.JoinType.INNER;

        List<Expression> toLeft = new ArrayList<>();
        List<Expression> toRight = new ArrayList<>();
        List<Expression> kept = new ArrayList<>();
        for (Expression conjunct : ExpressionUtils.splitConjuncts(filter.condition())) {
            Set<String> refs = ExpressionUtils.referencedColumns(conjunct);
            if (leftColumns.containsAll(refs)) {
                toLeft.add(conjunct);
            } else if (canPushRight && rightColumns.containsAll(refs)) {
                toRight.add(conjunct);
            } else {
                kept.add(conjunct);
            }
        }
        if (toLeft.isEmpty() && toRight.isEmpty()) {
            return filter;
        }
        LogicalPlan left = toLeft.isEmpty()
            ? join.left() : new Filter(join.left(), ExpressionUtils.combineConjuncts(toLeft));
        LogicalPlan right = toRight.isEmpty()
            ? join.right() : new Filter(join.right(), ExpressionUtils.combineConjuncts(toRight));
        LogicalPlan rewritten = join.withNewChildren(List.of(left, right));
        return kept.isEmpty() ? rewritten : new Filter(rewritten, ExpressionUtils.combineConjuncts(kept));
    }
}
