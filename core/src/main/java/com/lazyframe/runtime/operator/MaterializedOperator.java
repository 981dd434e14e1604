package com.lazyframe.runtime.operator;

import com.lazyframe.data.RowBatch;
import com.lazyframe.types.StructType;
import java.util.Iterator;
import java.util.List;

/**
 * Replays batches that an exchange has already materialized.
 */
public final class MaterializedOperator implements Operator {

    private final StructType schema;
    private final List<RowBatch> batches;
    private Iterator<RowBatch> iterator;

    public MaterializedOperator(StructType schema, List<RowBatch> batches) {
        this.schema = schema;
        this.batches = batches;
    }

    @Override
    public void open() {
        iterator = batches.iterator();
    }

    @Override
    public RowBatch next() {
        while (iterator.hasNext()) {
            RowBatch batch = iterator.next();
            if (!batch.isEmpty()) {
                return batch;
            }
        }
        return null;
    }

    @Override
    public void close() {
        iterator = null;
    }

    @Override
    public StructType schema() {
        return schema;
    }
}
