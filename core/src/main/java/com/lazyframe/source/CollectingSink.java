package com.lazyframe.source;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Sink that keeps every written row in memory.
 */
public final class CollectingSink implements Sink {

    private final List<Row> rows = new ArrayList<>();
    private int batchCount;

    @Override
    public synchronized void write(Iterator<RowBatch> batches) {
        while (batches.hasNext()) {
            RowBatch batch = batches.next();
            rows.addAll(batch.rows());
            batchCount++;
        }
    }

    public synchronized List<Row> rows() {
        return Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public synchronized int batchCount() {
        return batchCount;
    }
}
