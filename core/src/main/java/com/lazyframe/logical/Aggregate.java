package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.exception.TypeMismatchException;
import com.lazyframe.expression.Expression;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeInferenceEngine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logical plan node representing an aggregation (GROUP BY clause).
 *
 * <p>The output contains the grouping columns, in order, followed by one
 * column per aggregate expression named by its alias. Without grouping
 * columns the node produces exactly one row, even over empty input.
 *
 * <p>Examples:
 * <pre>
 *   df.groupBy("state").agg(max(col("cases")).as("max_cases"))
 *   df.groupBy().agg(countStar().as("n"))
 * </pre>
 */
public class Aggregate extends LogicalPlan {

    private final List<String> groupingKeys;
    private final List<AggregateExpression> aggregateExpressions;

    /**
     * Creates an aggregate node.
     *
     * @param child the child node
     * @param groupingKeys the grouping column names (empty for a global aggregate)
     * @param aggregateExpressions the resolved aggregate expressions
     * @throws SchemaException if a grouping key is missing or output names clash
     */
    public Aggregate(LogicalPlan child, List<String> groupingKeys,
                     List<AggregateExpression> aggregateExpressions) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.groupingKeys = List.copyOf(Objects.requireNonNull(groupingKeys, "groupingKeys must not be null"));
        this.aggregateExpressions = List.copyOf(
            Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null"));
        StructType childSchema = child.schema();
        Set<String> names = new HashSet<>();
        for (String key : this.groupingKeys) {
            if (!childSchema.contains(key)) {
                throw SchemaException.columnNotFound(key, childSchema);
            }
            if (!names.add(key)) {
                throw new SchemaException("Duplicate grouping key '" + key + "'", key);
            }
        }
        for (AggregateExpression agg : this.aggregateExpressions) {
            if (!names.add(agg.alias())) {
                throw new SchemaException("Ambiguous output column '" + agg.alias() + "' in aggregation",
                    agg.alias());
            }
        }
    }

    /**
     * Returns the grouping column names.
     *
     * @return an unmodifiable list of grouping keys
     */
    public List<String> groupingKeys() {
        return groupingKeys;
    }

    /**
     * Returns the aggregate expressions.
     *
     * @return an unmodifiable list of aggregate expressions
     */
    public List<AggregateExpression> aggregateExpressions() {
        return aggregateExpressions;
    }

    public boolean isGrouped() {
        return !groupingKeys.isEmpty();
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected StructType inferSchema() {
        StructType childSchema = child().schema();
        List<StructField> fields = new ArrayList<>();
        for (String key : groupingKeys) {
            fields.add(childSchema.fieldByName(key));
        }
        for (AggregateExpression agg : aggregateExpressions) {
            fields.add(new StructField(agg.alias(), agg.dataType(), agg.nullable()));
        }
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new Aggregate(newChildren.get(0), groupingKeys, aggregateExpressions);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Aggregate)) return false;
        Aggregate that = (Aggregate) obj;
        return groupingKeys.equals(that.groupingKeys)
            && aggregateExpressions.equals(that.aggregateExpressions)
            && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupingKeys, aggregateExpressions, child());
    }

    @Override
    public String toString() {
        return String.format("Aggregate(keys=%s, aggs=[%s])", groupingKeys,
            aggregateExpressions.stream().map(AggregateExpression::toSQL).collect(Collectors.joining(", ")));
    }

    /**
     * Aggregate function applied to an input expression.
     *
     * <p>Supports COUNT, SUM, AVG, MIN and MAX, with an optional DISTINCT
     * modifier:
     * <pre>
     *   COUNT(*)
     *   COUNT(DISTINCT county)
     *   MAX(cases)
     * </pre>
     *
     * <p>Nulls are skipped by every function except COUNT(*). COUNT of an
     * empty group is 0; the others yield null.
     */
    public static final class AggregateExpression implements Expression {

        private static final Set<String> FUNCTIONS = Set.of("COUNT", "SUM", "AVG", "MIN", "MAX");

        private final String function;
        private final Expression argument;
        private final String alias;
        private final boolean distinct;

        /**
         * Creates an aggregate expression.
         *
         * @param function the aggregate function name (COUNT, SUM, AVG, MIN, MAX)
         * @param argument the expression to aggregate (null for COUNT(*))
         * @param alias the result column name
         * @param distinct whether to aggregate only distinct values
         */
        public AggregateExpression(String function, Expression argument, String alias, boolean distinct) {
            Objects.requireNonNull(function, "function must not be null");
            this.function = function.toUpperCase();
            if (!FUNCTIONS.contains(this.function)) {
                throw new IllegalArgumentException("Unknown aggregate function: " + function);
            }
            if (argument == null && !this.function.equals("COUNT")) {
                throw new IllegalArgumentException(this.function + " requires an argument");
            }
            if (argument == null && distinct) {
                throw new IllegalArgumentException("COUNT(DISTINCT *) is not supported");
            }
            this.argument = argument;
            this.alias = Objects.requireNonNull(alias, "alias must not be null");
            this.distinct = distinct;
        }

        public AggregateExpression(String function, Expression argument, String alias) {
            this(function, argument, alias, false);
        }

        /**
         * Returns the upper-case aggregate function name.
         *
         * @return the function name (e.g., "COUNT", "SUM", "AVG")
         */
        public String function() {
            return function;
        }

        /**
         * Returns the expression being aggregated.
         *
         * @return the argument expression, or null for COUNT(*)
         */
        public Expression argument() {
            return argument;
        }

        public String alias() {
            return alias;
        }

        public boolean isDistinct() {
            return distinct;
        }

        public boolean isCountStar() {
            return argument == null;
        }

        public AggregateExpression withAlias(String newAlias) {
            return new AggregateExpression(function, argument, newAlias, distinct);
        }

        /**
         * Checks that the argument type suits the function.
         *
         * @throws TypeMismatchException if SUM or AVG is applied to a non-numeric column
         */
        public void validate() {
            if ((function.equals("SUM") || function.equals("AVG"))
                    && !TypeInferenceEngine.isNumeric(argument.dataType())) {
                throw new TypeMismatchException(function + " requires a numeric argument: " + toSQL(),
                    argument.dataType(), null);
            }
        }

        @Override
        public DataType dataType() {
            return TypeInferenceEngine.resolveAggregateReturnType(function,
                argument == null ? null : argument.dataType());
        }

        @Override
        public boolean nullable() {
            // COUNT always returns non-null (0 for empty groups)
            return !function.equals("COUNT");
        }

        @Override
        public List<Expression> children() {
            return argument == null ? Collections.emptyList() : Collections.singletonList(argument);
        }

        @Override
        public Expression withNewChildren(List<Expression> newChildren) {
            return new AggregateExpression(function, newChildren.isEmpty() ? null : newChildren.get(0),
                alias, distinct);
        }

        @Override
        public String toSQL() {
            StringBuilder sql = new StringBuilder();
            sql.append(function.toLowerCase()).append('(');
            if (distinct) {
                sql.append("DISTINCT ");
            }
            sql.append(argument == null ? "*" : argument.toSQL());
            sql.append(") AS ").append(alias);
            return sql.toString();
        }

        @Override
        public String toString() {
            return toSQL();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof AggregateExpression)) return false;
            AggregateExpression that = (AggregateExpression) obj;
            return distinct == that.distinct && function.equals(that.function)
                && Objects.equals(argument, that.argument) && alias.equals(that.alias);
        }

        @Override
        public int hashCode() {
            return Objects.hash(function, argument, alias, distinct);
        }
    }
}
