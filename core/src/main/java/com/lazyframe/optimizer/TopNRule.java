package com.lazyframe.optimizer;

import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.Literal;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Limit;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.TopN;
import com.lazyframe.logical.Window;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces full sorts that only feed a bounded number of rows with top-N.
 *
 * <pre>
 *   Limit(Sort(x, o), n)                       -&gt;  TopN(x, o, n)
 *   Filter(Window(x, p, o, rn), rn &lt;= k)       -&gt;  TopN(x, o, k, p, rn)
 * </pre>
 *
 * <p>The rank filter may be written as {@code rn <= k}, {@code rn < k},
 * {@code k >= rn}, {@code k > rn} or {@code rn = 1}; other conjuncts of the
 * same filter stay above the top-N.
 */
public class TopNRule implements OptimizationRule {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> {
            if (node instanceof Limit && ((Limit) node).child() instanceof Sort) {
                Limit limit = (Limit) node;
                Sort sort = (Sort) limit.child();
                return new TopN(sort.child(), sort.sortOrders(), limit.limit());
            }
            if (node instanceof Filter && ((Filter) node).child() instanceof Window) {
                return rankFilter((Filter) node);
            }
            return node;
        });
    }

    private LogicalPlan rankFilter(Filter filter) {
        Window window = (Window) filter.child();
        List<Expression> kept = new ArrayList<>();
        long bound = -1;
        for (Expression conjunct : ExpressionUtils.splitConjuncts(filter.condition())) {
            long k = bound < 0 ? rankBound(conjunct, window.rankColumn()) : -1;
            if (k >= 0) {
                bound = k;
            } else {
                kept.add(conjunct);
            }
        }
        if (bound < 0) {
            return filter;
        }
        LogicalPlan topN = new TopN(window.child(), window.orderBy(), bound,
            window.partitionKeys(), window.rankColumn());
        return kept.isEmpty() ? topN : new Filter(topN, ExpressionUtils.combineConjuncts(kept));
    }

    /**
     * Returns the number of ranks a conjunct keeps, or -1 when it is not a
     * rank bound on {@code rankColumn}.
     */
    private static long rankBound(Expression conjunct, String rankColumn) {
        if (!(conjunct instanceof BinaryExpression)) {
            return -1;
        }
        BinaryExpression bin = (BinaryExpression) conjunct;
        if (!bin.operator().isComparison()) {
            return -1;
        }
        BinaryExpression.Operator op;
        Expression literalSide;
        if (isRankColumn(bin.left(), rankColumn)) {
            op = bin.operator();
            literalSide = bin.right();
        } else if (isRankColumn(bin.right(), rankColumn)) {
            op = bin.operator().flip();
            literalSide = bin.left();
        } else {
            return -1;
        }
        if (!(literalSide instanceof Literal)) {
            return -1;
        }
        Object value = ((Literal) literalSide).value();
        if (!(value instanceof Long) && !(value instanceof Integer)) {
            return -1;
        }
        long k = ((Number) value).longValue();
        switch (op) {
            case LESS_THAN_OR_EQUAL:
                return Math.max(k, 0);
            case LESS_THAN:
                return Math.max(k - 1, 0);
            case EQUAL:
                return k == 1 ? 1 : -1;
            default:
                return -1;
        }
    }

    private static boolean isRankColumn(Expression expr, String rankColumn) {
        return expr instanceof ColumnReference && ((ColumnReference) expr).columnName().equals(rankColumn);
    }
}
