package com.lazyframe.optimizer;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.Limit;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.Repartition;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.logical.TableScan;
import com.lazyframe.logical.TopN;
import com.lazyframe.logical.Window;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Optimization rule that removes columns no operator above needs.
 *
 * <p>Walks the plan top-down carrying the set of required column names:
 * scans read only those columns, projections drop unused expressions and
 * grouped aggregations drop unused aggregates. A global aggregation keeps
 * all its aggregates since it always produces one row.
 *
 * <p>Nodes that pass their child's columns through may end up wider than
 * strictly required, for example a filter keeps the column it tests. Every
 * column the root outputs is required, so the root schema never changes.
 */
public class ColumnPruningRule implements OptimizationRule {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return prune(plan, new LinkedHashSet<>(plan.schema().fieldNames()));
    }

    private LogicalPlan prune(LogicalPlan plan, Set<String> required) {
        if (plan instanceof TableScan) {
            TableScan scan = (TableScan) plan;
            List<String> columns = new ArrayList<>();
            for (String name : scan.requiredColumns()) {
                if (required.contains(name)) {
                    columns.add(name);
                }
            }
            return columns.equals(scan.requiredColumns()) ? scan : new TableScan(scan.source(), columns);
        }
        if (plan instanceof Filter) {
            Filter filter = (Filter) plan;
            return withChild(filter, prune(filter.child(),
                union(required, ExpressionUtils.referencedColumns(filter.condition()))));
        }
        if (plan instanceof Project) {
            return pruneProject((Project) plan, required);
        }
        if (plan instanceof Aggregate) {
            return pruneAggregate((Aggregate) plan, required);
        }
        if (plan instanceof Join) {
            return pruneJoin((Join) plan, required);
        }
        if (plan instanceof Sort) {
            Sort sort = (Sort) plan;
            return withChild(sort, prune(sort.child(), union(required, orderColumns(sort.sortOrders()))));
        }
        if (plan instanceof Limit) {
            Limit limit = (Limit) plan;
            return withChild(limit, prune(limit.child(), required));
        }
        if (plan instanceof TopN) {
            TopN topN = (TopN) plan;
            Set<String> childRequired = union(required, orderColumns(topN.sortOrders()));
            childRequired.addAll(topN.partitionKeys());
            childRequired.remove(topN.rankColumn());
            return withChild(topN, prune(topN.child(), childRequired));
        }
        if (plan instanceof Window) {
            Window window = (Window) plan;
            Set<String> childRequired = union(required, orderColumns(window.orderBy()));
            childRequired.addAll(window.partitionKeys());
            childRequired.remove(window.rankColumn());
            return withChild(window, prune(window.child(), childRequired));
        }
        if (plan instanceof Repartition) {
            Repartition repartition = (Repartition) plan;
            return withChild(repartition, prune(repartition.child(), union(required, repartition.keys())));
        }
        // Unknown node: require everything below it
        List<LogicalPlan> children = new ArrayList<>();
        for (LogicalPlan child : plan.children()) {
            children.add(prune(child, new LinkedHashSet<>(child.schema().fieldNames())));
        }
        return children.equals(plan.children()) ? plan : plan.withNewChildren(children);
    }

    private LogicalPlan pruneProject(Project project, Set<String> required) {
        List<Expression> kept = new ArrayList<>();
        for (Expression projection : project.projections()) {
            if (required.contains(ExpressionUtils.outputName(projection))) {
                kept.add(projection);
            }
        }
        LogicalPlan child = prune(project.child(), ExpressionUtils.referencedColumns(kept));
        if (kept.size() == project.projections().size()) {
            return withChild(project, child);
        }
        return new Project(child, kept);
    }

    private LogicalPlan pruneAggregate(Aggregate aggregate, Set<String> required) {
        List<AggregateExpression> kept = new ArrayList<>();
        for (AggregateExpression agg : aggregate.aggregateExpressions()) {
            if (!aggregate.isGrouped() || required.contains(agg.alias())) {
                kept.add(agg);
            }
        }
        Set<String> childRequired = new LinkedHashSet<>(aggregate.groupingKeys());
        childRequired.addAll(ExpressionUtils.referencedColumns(kept));
        LogicalPlan child = prune(aggregate.child(), childRequired);
        if (kept.size() == aggregate.aggregateExpressions().size()) {
            return withChild(aggregate, child);
        }
        return new Aggregate(child, aggregate.groupingKeys(), kept);
    }

    private LogicalPlan pruneJoin(Join join, Set<String> required) {
        Set<String> leftRequired = new LinkedHashSet<>(join.leftKeys());
        for (String name : join.left().schema().fieldNames()) {
            if (required.contains(name)) {
                leftRequired.add(name);
            }
        }
        Set<String> rightRequired = new LinkedHashSet<>(join.rightKeys());
        if (join.joinType().outputsRight()) {
            Set<String> merged = join.mergedRightKeys();
            for (String name : join.right().schema().fieldNames()) {
                if (required.contains(name) && !merged.contains(name)) {
                    rightRequired.add(name);
                }
            }
        }
        LogicalPlan left = prune(join.left(), leftRequired);
        LogicalPlan right = prune(join.right(), rightRequired);
        if (left == join.left() && right == join.right()) {
            return join;
        }
        return join.withNewChildren(List.of(left, right));
    }

    private static LogicalPlan withChild(LogicalPlan node, LogicalPlan newChild) {
        return newChild == node.children().get(0) ? node : node.withNewChildren(List.of(newChild));
    }

    private static Set<String> union(Set<String> required, Iterable<String> more) {
        Set<String> result = new LinkedHashSet<>(required);
        for (String name : more) {
            result.add(name);
        }
        return result;
    }

    private static Set<String> orderColumns(List<SortOrder> orders) {
        Set<String> columns = new LinkedHashSet<>();
        for (SortOrder order : orders) {
            columns.addAll(ExpressionUtils.referencedColumns(order.expression()));
        }
        return columns;
    }
}
