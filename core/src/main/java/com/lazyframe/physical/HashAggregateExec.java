package com.lazyframe.physical;

import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Hash aggregation over input already clustered by the grouping keys, or
 * over a single partition for a global aggregate.
 */
public final class HashAggregateExec extends PhysicalPlan {

    private final List<String> groupingKeys;
    private final List<AggregateExpression> aggregates;

    public HashAggregateExec(int id, PhysicalPlan child, List<String> groupingKeys,
                             List<AggregateExpression> aggregates, StructType schema, OptionalLong estimatedRows) {
        super(id, List.of(child), schema, estimatedRows);
        this.groupingKeys = List.copyOf(groupingKeys);
        this.aggregates = List.copyOf(aggregates);
    }

    public List<String> groupingKeys() {
        return groupingKeys;
    }

    public List<AggregateExpression> aggregates() {
        return aggregates;
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    protected String argumentString() {
        return "keys=" + groupingKeys + ", aggs=["
            + aggregates.stream().map(AggregateExpression::toSQL).collect(Collectors.joining(", ")) + "]";
    }
}
