package com.lazyframe.source;

import com.lazyframe.data.RowBatch;
import java.util.Iterator;

/**
 * Destination for query results.
 */
public interface Sink {

    /**
     * Consumes every batch of a result.
     *
     * @param batches the result batches
     */
    void write(Iterator<RowBatch> batches);
}
