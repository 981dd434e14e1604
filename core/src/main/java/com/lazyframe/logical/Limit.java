package com.lazyframe.logical;

import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node keeping the first {@code n} rows of its child.
 */
public final class Limit extends LogicalPlan {

    private final long limit;

    public Limit(LogicalPlan child, long limit) {
        super(Objects.requireNonNull(child, "child must not be null"));
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + limit);
        }
        this.limit = limit;
    }

    public long limit() {
        return limit;
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
        return new Limit(newChildren.get(0), limit);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Limit)) return false;
        Limit that = (Limit) obj;
        return limit == that.limit && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, child());
    }

    @Override
    public String toString() {
        return "Limit(" + limit + ")";
    }
}
