package com.lazyframe.physical;

import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;

public final class ProjectExec extends PhysicalPlan {

    private final List<Expression> projections;

    public ProjectExec(int id, PhysicalPlan child, List<Expression> projections, StructType schema,
                       OptionalLong estimatedRows) {
        super(id, List.of(child), schema, estimatedRows);
        this.projections = List.copyOf(projections);
    }

    public List<Expression> projections() {
        return projections;
    }

    @Override
    public Partitioning outputPartitioning() {
        Partitioning input = child().outputPartitioning();
        if (input instanceof HashPartitioning) {
            // Hash clustering survives only if every key passes through unchanged
            for (String key : ((HashPartitioning) input).keys()) {
                boolean kept = projections.stream().anyMatch(p ->
                    p instanceof ColumnReference && ((ColumnReference) p).columnName().equals(key));
                if (!kept) {
                    return new UnknownPartitioning(input.numPartitions());
                }
            }
        }
        return input;
    }

    @Override
    protected String argumentString() {
        return projections.stream().map(Expression::toSQL).collect(Collectors.joining(", "));
    }
}
