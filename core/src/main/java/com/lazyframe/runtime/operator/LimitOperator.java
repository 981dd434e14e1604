package com.lazyframe.runtime.operator;

import com.lazyframe.data.RowBatch;
import com.lazyframe.types.StructType;

/**
 * Passes through the first {@code limit} rows and stops pulling afterwards.
 */
public final class LimitOperator implements Operator {

    private final Operator child;
    private final long limit;
    private long emitted;

    public LimitOperator(Operator child, long limit) {
        this.child = child;
        this.limit = limit;
    }

    @Override
    public void open() {
        emitted = 0;
        child.open();
    }

    @Override
    public RowBatch next() {
        if (emitted >= limit) {
            return null;
        }
        RowBatch batch = child.next();
        if (batch == null) {
            return null;
        }
        long remaining = limit - emitted;
        if (batch.size() > remaining) {
            batch = RowBatch.adopt(batch.schema(), batch.rows().subList(0, (int) remaining));
        }
        emitted += batch.size();
        return batch;
    }

    @Override
    public void close() {
        child.close();
    }

    @Override
    public StructType schema() {
        return child.schema();
    }
}
