package com.lazyframe.runtime.operator;

import com.lazyframe.data.GroupKey;
import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Keeps the first {@code limit} rows of each group under the sort order,
 * holding at most {@code limit} rows per group in memory.
 *
 * <p>Ties are broken by arrival order, so the result equals a stable sort
 * followed by a per-group cut. When a rank column is requested, each kept
 * row gets its 1-based position within the group.
 */
public final class TopNOperator implements Operator {

    private final Operator child;
    private final long limit;
    private final int[] partitionOrdinals;
    private final boolean addRank;
    private final StructType schema;
    private final int batchSize;
    private final Comparator<Ranked> order;
    private Iterator<RowBatch> output;

    public TopNOperator(Operator child, List<SortOrder> orders, long limit, List<String> partitionKeys,
                        boolean addRank, StructType schema, int batchSize) {
        this.child = child;
        this.limit = limit;
        this.addRank = addRank;
        this.schema = schema;
        this.batchSize = batchSize;
        this.partitionOrdinals = new int[partitionKeys.size()];
        for (int i = 0; i < partitionOrdinals.length; i++) {
            partitionOrdinals[i] = child.schema().fieldIndex(partitionKeys.get(i));
        }
        RowComparator rows = new RowComparator(orders, child.schema());
        this.order = Comparator.<Ranked, Row>comparing(r -> r.row, rows).thenComparingLong(r -> r.sequence);
    }

    @Override
    public void open() {
        child.open();
        Map<GroupKey, PriorityQueue<Ranked>> groups = new LinkedHashMap<>();
        long sequence = 0;
        RowBatch batch;
        while ((batch = child.next()) != null) {
            for (Row row : batch) {
                Ranked candidate = new Ranked(row, sequence++);
                if (limit == 0) {
                    continue;
                }
                // max-heap: the head is the worst row kept so far
                PriorityQueue<Ranked> heap = groups.computeIfAbsent(GroupKey.of(row, partitionOrdinals),
                    k -> new PriorityQueue<>(order.reversed()));
                if (heap.size() < limit) {
                    heap.add(candidate);
                } else if (order.compare(candidate, heap.peek()) < 0) {
                    heap.poll();
                    heap.add(candidate);
                }
            }
        }
        RowBatch.Builder builder = RowBatch.builder(schema, batchSize);
        for (PriorityQueue<Ranked> heap : groups.values()) {
            List<Ranked> kept = new ArrayList<>(heap);
            kept.sort(order);
            long rank = 1;
            for (Ranked ranked : kept) {
                builder.add(addRank ? withRank(ranked.row, rank++) : ranked.row);
            }
        }
        output = builder.build().iterator();
    }

    static Row withRank(Row row, long rank) {
        Object[] values = new Object[row.size() + 1];
        for (int i = 0; i < row.size(); i++) {
            values[i] = row.get(i);
        }
        values[row.size()] = rank;
        return Row.wrap(values);
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

    private static final class Ranked {
        final Row row;
        final long sequence;

        Ranked(Row row, long sequence) {
            this.row = row;
            this.sequence = sequence;
        }
    }
}
