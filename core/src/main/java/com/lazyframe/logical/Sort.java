package com.lazyframe.logical;

import com.lazyframe.expression.Expression;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a global sort (ORDER BY clause).
 *
 * <p>The sort is stable: rows with equal keys keep their input order.
 */
public final class Sort extends LogicalPlan {

    private final List<SortOrder> sortOrders;

    /**
     * Creates a sort node.
     *
     * @param child the child node
     * @param sortOrders the sort keys, most significant first
     */
    public Sort(LogicalPlan child, List<SortOrder> sortOrders) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.sortOrders = List.copyOf(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));
        if (this.sortOrders.isEmpty()) {
            throw new IllegalArgumentException("Sort requires at least one sort order");
        }
    }

    public List<SortOrder> sortOrders() {
        return sortOrders;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new Sort(newChildren.get(0), sortOrders);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sort)) return false;
        Sort that = (Sort) obj;
        return sortOrders.equals(that.sortOrders) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(sortOrders, child());
    }

    @Override
    public String toString() {
        return String.format("Sort(%s)", sortOrders);
    }

    /**
     * Represents a sort order (expression + direction + null handling).
     */
    public static final class SortOrder {
        private final Expression expression;
        private final SortDirection direction;
        private final NullOrdering nullOrdering;

        public SortOrder(Expression expression, SortDirection direction, NullOrdering nullOrdering) {
            this.expression = Objects.requireNonNull(expression, "expression must not be null");
            this.direction = Objects.requireNonNull(direction, "direction must not be null");
            this.nullOrdering = Objects.requireNonNull(nullOrdering, "nullOrdering must not be null");
        }

        public SortOrder(Expression expression, SortDirection direction) {
            this(expression, direction,
                 direction == SortDirection.ASCENDING ? NullOrdering.NULLS_FIRST : NullOrdering.NULLS_LAST);
        }

        public Expression expression() {
            return expression;
        }

        public SortDirection direction() {
            return direction;
        }

        public NullOrdering nullOrdering() {
            return nullOrdering;
        }

        public SortOrder withExpression(Expression newExpression) {
            return new SortOrder(newExpression, direction, nullOrdering);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof SortOrder)) return false;
            SortOrder that = (SortOrder) obj;
            return direction == that.direction && nullOrdering == that.nullOrdering
                && expression.equals(that.expression);
        }

        @Override
        public int hashCode() {
            return Objects.hash(expression, direction, nullOrdering);
        }

        @Override
        public String toString() {
            return String.format("%s %s %s", expression.toSQL(),
                direction == SortDirection.ASCENDING ? "ASC" : "DESC",
                nullOrdering == NullOrdering.NULLS_FIRST ? "NULLS FIRST" : "NULLS LAST");
        }
    }

    /**
     * Sort direction.
     */
    public enum SortDirection {
        ASCENDING,
        DESCENDING
    }

    /**
     * Null ordering.
     */
    public enum NullOrdering {
        NULLS_FIRST,
        NULLS_LAST
    }
}
