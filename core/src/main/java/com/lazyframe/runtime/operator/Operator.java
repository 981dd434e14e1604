package com.lazyframe.runtime.operator;

import com.lazyframe.data.RowBatch;
import com.lazyframe.types.StructType;

/**
 * Pull-based physical operator producing row batches.
 *
 * <p>Callers invoke {@link #open()} once, then {@link #next()} until it
 * returns null, then {@link #close()}. Operators own their children and
 * open and close them.
 */
public interface Operator extends AutoCloseable {

    void open();

    /**
     * Returns the next non-empty batch.
     *
     * @return the batch, or null when exhausted
     */
    RowBatch next();

    @Override
    void close();

    StructType schema();
}
