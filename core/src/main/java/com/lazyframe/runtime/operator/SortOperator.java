package com.lazyframe.runtime.operator;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Buffers its whole input and emits it sorted. The sort is stable.
 */
public final class SortOperator implements Operator {

    private final Operator child;
    private final RowComparator comparator;
    private final int batchSize;
    private Iterator<RowBatch> output;

    public SortOperator(Operator child, List<SortOrder> orders, int batchSize) {
        this.child = child;
        this.comparator = new RowComparator(orders, child.schema());
        this.batchSize = batchSize;
    }

    @Override
    public void open() {
        child.open();
        List<Row> rows = new ArrayList<>();
        RowBatch batch;
        while ((batch = child.next()) != null) {
            rows.addAll(batch.rows());
        }
        rows.sort(comparator);
        output = RowBatch.builder(schema(), batchSize).addAll(rows).build().iterator();
    }

    @Override
    public RowBatch next() {
        return output.hasNext() ? output.next() : null;
    }

    @Override
    public void close() {
        output = null;
        child.close();
    }

    @Override
    public StructType schema() {
        return child.schema();
    }
}
