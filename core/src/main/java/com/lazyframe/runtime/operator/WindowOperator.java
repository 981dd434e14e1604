package com.lazyframe.runtime.operator;

import com.lazyframe.data.GroupKey;
import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends {@code row_number()} within each group of the partition keys,
 * numbering rows in sort order starting at 1.
 *
 * <p>Groups are emitted in first-seen order, each group's rows sorted.
 * Input must be clustered so that every group is in a single partition.
 */
public final class WindowOperator implements Operator {

    private final Operator child;
    private final int[] partitionOrdinals;
    private final RowComparator comparator;
    private final StructType schema;
    private final int batchSize;
    private Iterator<RowBatch> output;

    public WindowOperator(Operator child, List<String> partitionKeys, List<SortOrder> orderBy,
                          StructType schema, int batchSize) {
        this.child = child;
        this.schema = schema;
        this.batchSize = batchSize;
        this.comparator = new RowComparator(orderBy, child.schema());
        this.partitionOrdinals = new int[partitionKeys.size()];
        for (int i = 0; i < partitionOrdinals.length; i++) {
            partitionOrdinals[i] = child.schema().fieldIndex(partitionKeys.get(i));
        }
    }

    @Override
    public void open() {
        child.open();
        Map<GroupKey, List<Row>> groups = new LinkedHashMap<>();
        RowBatch batch;
        while ((batch = child.next()) != null) {
            for (Row row : batch) {
                groups.computeIfAbsent(GroupKey.of(row, partitionOrdinals), k -> new ArrayList<>()).add(row);
            }
        }
        RowBatch.Builder builder = RowBatch.builder(schema, batchSize);
        for (List<Row> rows : groups.values()) {
            rows.sort(comparator);
            long rank = 1;
            for (Row row : rows) {
                builder.add(TopNOperator.withRank(row, rank++));
            }
        }
        output = builder.build().iterator();
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
}
