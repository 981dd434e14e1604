package com.lazyframe.runtime.operator;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.source.Source;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads one split of a source and narrows its batches to the required columns.
 * Batches larger than the engine's batch size are split.
 */
public final class ScanOperator implements Operator {

    private final Source source;
    private final StructType requiredSchema;
    private final int partition;
    private final int batchSize;
    private Iterator<RowBatch> batches;
    private List<Row> remainder = List.of();

    public ScanOperator(Source source, StructType requiredSchema, int partition, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.source = source;
        this.requiredSchema = requiredSchema;
        this.partition = partition;
        this.batchSize = batchSize;
    }

    @Override
    public void open() {
        batches = source.scanPartition(requiredSchema, partition);
    }

    @Override
    public RowBatch next() {
        if (remainder.isEmpty()) {
            RowBatch batch = nextNonEmpty();
            if (batch == null) {
                return null;
            }
            if (batch.size() <= batchSize) {
                return batch;
            }
            remainder = batch.rows();
        }
        int end = Math.min(batchSize, remainder.size());
        RowBatch slice = RowBatch.adopt(requiredSchema, new ArrayList<>(remainder.subList(0, end)));
        remainder = remainder.subList(end, remainder.size());
        return slice;
    }

    private RowBatch nextNonEmpty() {
        while (batches.hasNext()) {
            RowBatch batch = batches.next();
            if (!batch.isEmpty()) {
                return project(batch);
            }
        }
        return null;
    }

    private RowBatch project(RowBatch batch) {
        if (batch.schema().equals(requiredSchema)) {
            return batch;
        }
        int[] ordinals = new int[requiredSchema.size()];
        for (int i = 0; i < ordinals.length; i++) {
            String name = requiredSchema.fieldAt(i).name();
            ordinals[i] = batch.schema().fieldIndex(name);
            if (ordinals[i] < 0) {
                throw SchemaException.columnNotFound(name, batch.schema());
            }
        }
        List<Row> rows = new ArrayList<>(batch.size());
        for (Row row : batch) {
            Object[] values = new Object[ordinals.length];
            for (int i = 0; i < ordinals.length; i++) {
                values[i] = row.get(ordinals[i]);
            }
            rows.add(Row.wrap(values));
        }
        return RowBatch.adopt(requiredSchema, rows);
    }

    @Override
    public void close() {
        batches = null;
        remainder = List.of();
    }

    @Override
    public StructType schema() {
        return requiredSchema;
    }
}
