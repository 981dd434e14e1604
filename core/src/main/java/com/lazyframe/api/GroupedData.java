package com.lazyframe.api;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionResolver;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A DataFrame grouped by key columns, waiting for its aggregates.
 */
public class GroupedData {

    private static final Logger logger = LoggerFactory.getLogger(GroupedData.class);

    private final DataFrame df;
    private final List<String> keys;

    GroupedData(DataFrame df, List<String> keys) {
        this.df = df;
        this.keys = List.copyOf(keys);
    }

    /**
     * Computes aggregates per group. The output has the grouping keys
     * followed by one column per aggregate.
     *
     * @param aggregates aggregate columns such as {@code max(col("cases")).as("max_cases")}
     * @return the aggregated DataFrame
     * @throws IllegalArgumentException if a column is not an aggregate
     * @throws com.lazyframe.exception.TypeMismatchException if SUM or AVG gets a non-numeric argument
     */
    public DataFrame agg(Column... aggregates) {
        List<AggregateExpression> resolved = new ArrayList<>(aggregates.length);
        for (Column column : aggregates) {
            if (!(column.expr() instanceof AggregateExpression)) {
                throw new IllegalArgumentException("Not an aggregate: " + column);
            }
            Expression bound = ExpressionResolver.resolve(column.expr(), df.schema());
            AggregateExpression aggregate = (AggregateExpression) bound;
            aggregate.validate();
            resolved.add(aggregate);
        }
        logger.debug("Grouping by {} with {} aggregate(s)", keys, resolved.size());
        return df.derive(new Aggregate(df.logicalPlan(), keys, resolved));
    }

    public List<String> keys() {
        return keys;
    }
}
