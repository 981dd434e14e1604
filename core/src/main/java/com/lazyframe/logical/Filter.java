package com.lazyframe.logical;

import com.lazyframe.expression.Expression;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node representing a filter (WHERE or HAVING clause).
 *
 * <p>This node keeps the rows of its child for which the condition
 * evaluates to TRUE; rows where it is FALSE or NULL are dropped.
 *
 * <p>Examples:
 * <pre>
 *   df.filter(col("state").isin("NY", "CA"))
 *   df.where(col("cases").geq(10))
 * </pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the resolved filter condition (must evaluate to boolean)
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
    }

    /**
     * Returns the filter condition.
     *
     * @return the condition expression
     */
    public Expression condition() {
        return condition;
    }

    /**
     * Returns the child node.
     *
     * @return the child
     */
    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected StructType inferSchema() {
        // Filter doesn't change the schema
        return child().schema();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new Filter(newChildren.get(0), condition);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Filter)) return false;
        Filter that = (Filter) obj;
        return condition.equals(that.condition) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, child());
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition.toSQL());
    }
}
