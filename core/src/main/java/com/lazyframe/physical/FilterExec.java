package com.lazyframe.physical;

import com.lazyframe.expression.Expression;
import java.util.List;
import java.util.OptionalLong;

public final class FilterExec extends PhysicalPlan {

    private final Expression condition;

    public FilterExec(int id, PhysicalPlan child, Expression condition, OptionalLong estimatedRows) {
        super(id, List.of(child), child.schema(), estimatedRows);
        this.condition = condition;
    }

    public Expression condition() {
        return condition;
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    protected String argumentString() {
        return condition.toSQL();
    }
}
