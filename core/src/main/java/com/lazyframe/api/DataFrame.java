package com.lazyframe.api;

import com.lazyframe.data.Row;
import com.lazyframe.explain.PlanDescription;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionResolver;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.Join.JoinHint;
import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.logical.Limit;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.Repartition;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.logical.Window;
import com.lazyframe.source.Sink;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A lazy, immutable table expression.
 *
 * <p>Transformations build a new DataFrame around a larger logical plan and
 * never read data. Column references and types are checked as each
 * transformation is added, so errors surface at build time. Data is read
 * only by the actions: {@link #collect()}, {@link #write(Sink)} and
 * {@link #materialize(boolean)}'s {@code execute()}.
 *
 * <p>Example usage:
 * <pre>
 *   DataFrame maxCases = engine.read(covid)
 *       .filter(col("state").isin("Ohio", "Texas"))
 *       .withColumn("cases", col("cases").tryCast(LongType.get()))
 *       .groupBy("state")
 *       .agg(max(col("cases")).as("max_cases"));
 * </pre>
 */
public class DataFrame {

    private static final Logger logger = LoggerFactory.getLogger(DataFrame.class);

    private final QueryEngine engine;
    private final LogicalPlan logicalPlan;

    DataFrame(QueryEngine engine, LogicalPlan logicalPlan) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.logicalPlan = Objects.requireNonNull(logicalPlan, "logicalPlan must not be null");
    }

    // ==================== Transformations ====================

    /**
     * Keeps rows for which the condition is TRUE.
     *
     * @param condition a boolean column
     * @return the filtered DataFrame
     * @throws com.lazyframe.exception.SchemaException if the condition references an unknown column
     * @throws com.lazyframe.exception.TypeMismatchException if the condition is not boolean
     */
    public DataFrame filter(Column condition) {
        Expression resolved = ExpressionResolver.resolvePredicate(condition.expr(), schema());
        logger.debug("Adding filter: {}", resolved.toSQL());
        return derive(new Filter(logicalPlan, resolved));
    }

    public DataFrame where(Column condition) {
        return filter(condition);
    }

    public DataFrame select(Column... columns) {
        List<Expression> projections = new ArrayList<>(columns.length);
        for (Column column : columns) {
            projections.add(resolveScalar(column));
        }
        logger.debug("Selecting {} columns", projections.size());
        return derive(new Project(logicalPlan, projections));
    }

    public DataFrame select(String column, String... columns) {
        Column[] all = new Column[columns.length + 1];
        all[0] = functions.col(column);
        for (int i = 0; i < columns.length; i++) {
            all[i + 1] = functions.col(columns[i]);
        }
        return select(all);
    }

    /**
     * Adds a column, or replaces the column of the same name in place.
     *
     * @param name the output column name
     * @param column the value
     * @return the new DataFrame
     */
    public DataFrame withColumn(String name, Column column) {
        Expression value = resolveScalar(column);
        List<Expression> projections = new ArrayList<>();
        boolean replaced = false;
        for (StructField field : schema().fields()) {
            if (field.name().equals(name)) {
                projections.add(new AliasExpression(value, name));
                replaced = true;
            } else {
                projections.add(new ColumnReference(field.name(), field.dataType(), field.nullable()));
            }
        }
        if (!replaced) {
            projections.add(new AliasExpression(value, name));
        }
        logger.debug("{} column {}: {}", replaced ? "Replacing" : "Adding", name, value.toSQL());
        return derive(new Project(logicalPlan, projections));
    }

    // ==================== Joins ====================

    /**
     * Inner join on same-named key columns, emitted once in the output.
     */
    public DataFrame join(DataFrame right, String... keys) {
        return join(right, Arrays.asList(keys), JoinType.INNER);
    }

    public DataFrame join(DataFrame right, List<String> keys, JoinType joinType) {
        return join(right, keys, joinType, JoinHint.NONE);
    }

    public DataFrame join(DataFrame right, List<String> keys, JoinType joinType, JoinHint hint) {
        return join(right, keys, keys, joinType, hint);
    }

    /**
     * Equi-join on pairwise key columns.
     *
     * @param right the right side
     * @param leftKeys key columns of this DataFrame
     * @param rightKeys key columns of {@code right}, pairwise with {@code leftKeys}
     * @param joinType the join type
     * @param hint the strategy hint
     * @return the joined DataFrame
     * @throws com.lazyframe.exception.SchemaException on unknown keys or ambiguous output columns
     * @throws com.lazyframe.exception.TypeMismatchException if paired keys are not comparable
     */
    public DataFrame join(DataFrame right, List<String> leftKeys, List<String> rightKeys,
                          JoinType joinType, JoinHint hint) {
        Objects.requireNonNull(right, "right must not be null");
        logger.debug("Adding {} join on {} = {} (hint {})", joinType, leftKeys, rightKeys, hint);
        return derive(new Join(logicalPlan, right.logicalPlan, leftKeys, rightKeys, joinType, hint));
    }

    // ==================== Aggregation ====================

    public GroupedData groupBy(String... keys) {
        return new GroupedData(this, Arrays.asList(keys));
    }

    /**
     * Aggregates the whole DataFrame into one row.
     */
    public DataFrame agg(Column... aggregates) {
        return groupBy().agg(aggregates);
    }

    // ==================== Ordering ====================

    public DataFrame orderBy(Column... orders) {
        return derive(new Sort(logicalPlan, sortOrders(orders)));
    }

    public DataFrame orderBy(String column, String... columns) {
        Column[] all = new Column[columns.length + 1];
        all[0] = functions.col(column);
        for (int i = 0; i < columns.length; i++) {
            all[i + 1] = functions.col(columns[i]);
        }
        return orderBy(all);
    }

    public DataFrame limit(long n) {
        logger.debug("Adding limit: {}", n);
        return derive(new Limit(logicalPlan, n));
    }

    /**
     * Sorts and keeps the first {@code n} rows.
     *
     * @param n the number of rows
     * @param orders the sort orders
     * @return the new DataFrame
     */
    public DataFrame sortLimit(long n, Column... orders) {
        logger.debug("Adding sort with limit {}", n);
        return derive(new Limit(new Sort(logicalPlan, sortOrders(orders)), n));
    }

    /**
     * Appends {@code row_number()} over the partition keys and order.
     *
     * @param rankColumn the name of the new column
     * @param partitionKeys the window partition columns, may be empty
     * @param orders the window order
     * @return the new DataFrame
     */
    public DataFrame withRowNumber(String rankColumn, List<String> partitionKeys, Column... orders) {
        logger.debug("Adding row_number {} over {}", rankColumn, partitionKeys);
        return derive(new Window(logicalPlan, partitionKeys, sortOrders(orders), rankColumn));
    }

    // ==================== Partitioning ====================

    public DataFrame repartition(String... keys) {
        return repartition(0, keys);
    }

    /**
     * Redistributes rows round-robin into {@code numPartitions} partitions.
     */
    public DataFrame repartition(int numPartitions) {
        logger.debug("Adding round-robin repartition into {}", numPartitions);
        return derive(new Repartition(logicalPlan, List.of(), numPartitions));
    }

    /**
     * Hash-partitions rows by {@code keys}.
     *
     * @param numPartitions the partition count, or 0 for the configured default
     * @param keys the key columns
     * @return the new DataFrame
     */
    public DataFrame repartition(int numPartitions, String... keys) {
        logger.debug("Adding hash repartition on {}", Arrays.toString(keys));
        return derive(new Repartition(logicalPlan, Arrays.asList(keys), numPartitions));
    }

    // ==================== Actions ====================

    /**
     * Plans this DataFrame.
     *
     * @param optimize whether to run the optimizer and cost-based join selection
     * @return the planned query
     */
    public QueryExecution materialize(boolean optimize) {
        return new QueryExecution(engine, logicalPlan, optimize);
    }

    public QueryExecution materialize() {
        return materialize(true);
    }

    public List<Row> collect() {
        return materialize(true).collect();
    }

    public List<Row> collect(boolean optimize) {
        return materialize(optimize).collect();
    }

    public void write(Sink sink) {
        materialize(true).write(sink);
    }

    /**
     * Describes the optimized physical plan without running it.
     */
    public PlanDescription explain() {
        return materialize(true).explain();
    }

    public StructType schema() {
        return logicalPlan.schema();
    }

    public LogicalPlan logicalPlan() {
        return logicalPlan;
    }

    QueryEngine engine() {
        return engine;
    }

    // ==================== Helpers ====================

    DataFrame derive(LogicalPlan plan) {
        return new DataFrame(engine, plan);
    }

    private Expression resolveScalar(Column column) {
        if (column.expr() instanceof AggregateExpression) {
            throw new IllegalArgumentException("Aggregate " + column
                + " is only allowed in groupBy(...).agg(...)");
        }
        return ExpressionResolver.resolve(column.expr(), schema());
    }

    private List<SortOrder> sortOrders(Column... columns) {
        List<SortOrder> orders = new ArrayList<>(columns.length);
        for (Column column : columns) {
            orders.add(column.toSortOrder(resolveScalar(column)));
        }
        return orders;
    }

    @Override
    public String toString() {
        return "DataFrame" + schema().fieldNames();
    }
}
