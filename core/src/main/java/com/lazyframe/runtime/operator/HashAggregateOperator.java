package com.lazyframe.runtime.operator;

import com.lazyframe.data.GroupKey;
import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.runtime.CompiledExpression;
import com.lazyframe.runtime.ExpressionCompiler;
import com.lazyframe.runtime.operator.Accumulators.Accumulator;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups all input rows by key and computes the aggregates per group.
 *
 * <p>Groups are emitted in first-seen order. A global aggregation (no
 * grouping keys) always emits exactly one row, even over empty input.
 */
public final class HashAggregateOperator implements Operator {

    private final Operator child;
    private final int[] keyOrdinals;
    private final List<AggregateExpression> aggregates;
    private final CompiledExpression[] arguments;
    private final StructType schema;
    private final int batchSize;
    private Iterator<RowBatch> output;

    public HashAggregateOperator(Operator child, List<String> groupingKeys,
                                 List<AggregateExpression> aggregates, StructType schema, int batchSize) {
        this.child = child;
        this.schema = schema;
        this.batchSize = batchSize;
        this.aggregates = aggregates;
        StructType input = child.schema();
        this.keyOrdinals = new int[groupingKeys.size()];
        for (int i = 0; i < keyOrdinals.length; i++) {
            keyOrdinals[i] = input.fieldIndex(groupingKeys.get(i));
            if (keyOrdinals[i] < 0) {
                throw SchemaException.columnNotFound(groupingKeys.get(i), input);
            }
        }
        this.arguments = new CompiledExpression[aggregates.size()];
        for (int i = 0; i < arguments.length; i++) {
            AggregateExpression aggregate = aggregates.get(i);
            arguments[i] = aggregate.argument() == null
                ? row -> null
                : ExpressionCompiler.compile(aggregate.argument(), input);
        }
    }

    @Override
    public void open() {
        child.open();
        Map<GroupKey, Group> groups = new LinkedHashMap<>();
        RowBatch batch;
        while ((batch = child.next()) != null) {
            for (Row row : batch) {
                GroupKey key = GroupKey.of(row, keyOrdinals);
                Group group = groups.computeIfAbsent(key, k -> newGroup(row));
                for (int i = 0; i < arguments.length; i++) {
                    group.accumulators[i].add(arguments[i].eval(row));
                }
            }
        }
        if (groups.isEmpty() && keyOrdinals.length == 0) {
            groups.put(GroupKey.of(Row.of(), keyOrdinals), newGroup(Row.of()));
        }
        RowBatch.Builder builder = RowBatch.builder(schema, batchSize);
        for (Group group : groups.values()) {
            Object[] values = new Object[keyOrdinals.length + aggregates.size()];
            System.arraycopy(group.keyValues, 0, values, 0, keyOrdinals.length);
            for (int i = 0; i < aggregates.size(); i++) {
                values[keyOrdinals.length + i] = group.accumulators[i].result();
            }
            builder.add(Row.wrap(values));
        }
        output = builder.build().iterator();
    }

    private Group newGroup(Row first) {
        Object[] keyValues = new Object[keyOrdinals.length];
        for (int i = 0; i < keyOrdinals.length; i++) {
            keyValues[i] = first.get(keyOrdinals[i]);
        }
        Accumulator[] accumulators = new Accumulator[aggregates.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = Accumulators.create(aggregates.get(i));
        }
        return new Group(keyValues, accumulators);
    }

    @Override
    public RowBatch next() {
        while (output.hasNext()) {
            RowBatch batch = output.next();
            if (!batch.isEmpty()) {
                return batch;
            }
        }
        return null;
    }

    @Override
    public void close() {
        output = null;
        child.close();
    }

    @Override
    public StructType schema() {
        return schema;
    }

    private static final class Group {
        final Object[] keyValues;
        final Accumulator[] accumulators;

        Group(Object[] keyValues, Accumulator[] accumulators) {
            this.keyValues = keyValues;
            this.accumulators = accumulators;
        }
    }
}
