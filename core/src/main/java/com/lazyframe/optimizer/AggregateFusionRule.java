package com.lazyframe.optimizer;

import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.types.StructField;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a join of two aggregations over the same input and grouping keys
 * with a single aggregation computing both sets of aggregates.
 *
 * <pre>
 *   Join(Aggregate(x, g, A1), Aggregate(x, g, A2), on g)
 *     -&gt;  Aggregate(Filter(x, g IS NOT NULL), g, A1 ++ A2)
 * </pre>
 *
 * <p>The join never matches null keys, so the fused form drops null groups
 * explicitly. A LEFT join would keep the left null group with null right
 * aggregates, so LEFT joins are only fused when no grouping key is nullable.
 */
public class AggregateFusionRule implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(AggregateFusionRule.class);

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> node instanceof Join ? fuse((Join) node) : node);
    }

    private LogicalPlan fuse(Join join) {
        if (join.joinType() != Join.JoinType.INNER && join.joinType() != Join.JoinType.LEFT) {
            return join;
        }
        if (!(join.left() instanceof Aggregate) || !(join.right() instanceof Aggregate)) {
            return join;
        }
        Aggregate left = (Aggregate) join.left();
        Aggregate right = (Aggregate) join.right();
        List<String> keys = left.groupingKeys();
        if (keys.isEmpty()
                || !keys.equals(right.groupingKeys())
                || !join.leftKeys().equals(join.rightKeys())
                || !new HashSet<>(join.leftKeys()).equals(new HashSet<>(keys))
                || !left.child().equals(right.child())) {
            return join;
        }

        LogicalPlan input = left.child();
        List<Expression> notNull = new ArrayList<>();
        for (String key : keys) {
            StructField field = input.schema().fieldByName(key);
            if (field.nullable()) {
                notNull.add(UnaryExpression.isNotNull(
                    new ColumnReference(key, field.dataType(), field.nullable())));
            }
        }
        if (!notNull.isEmpty() && join.joinType() == Join.JoinType.LEFT) {
            return join;
        }

        List<AggregateExpression> aggregates = new ArrayList<>(left.aggregateExpressions());
        aggregates.addAll(right.aggregateExpressions());
        LogicalPlan fusedInput = notNull.isEmpty()
            ? input : new Filter(input, ExpressionUtils.combineConjuncts(notNull));
        logger.debug("Fusing {} join of two aggregates on {}", join.joinType(), keys);
        return new Aggregate(fusedInput, keys, aggregates);
    }
}
