package com.lazyframe.source;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Source over rows already held in memory, split into one or more partitions.
 *
 * <p>Rows are validated against the schema once, at construction. Scans
 * return batches of at most the source's batch size; the scan operator
 * splits them further if the engine is configured with a smaller one.
 */
public final class InMemorySource implements Source {

    public static final int DEFAULT_BATCH_SIZE = 4096;

    private final String name;
    private final StructType schema;
    private final List<List<Row>> partitions;
    private final boolean reportRowCount;
    private final long rowCount;
    private final int batchSize;

    private InMemorySource(String name, StructType schema, List<List<Row>> partitions, boolean reportRowCount,
                           int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(partitions, "partitions must not be null");
        if (partitions.isEmpty()) {
            throw new IllegalArgumentException("at least one partition is required");
        }
        List<List<Row>> copies = new ArrayList<>(partitions.size());
        long count = 0;
        for (List<Row> partition : partitions) {
            // Validates arity and types
            RowBatch validated = new RowBatch(schema, partition);
            copies.add(validated.rows());
            count += validated.size();
        }
        this.partitions = Collections.unmodifiableList(copies);
        this.reportRowCount = reportRowCount;
        this.rowCount = count;
        this.batchSize = batchSize;
    }

    public static InMemorySource of(String name, StructType schema, List<Row> rows) {
        return of(name, schema, rows, DEFAULT_BATCH_SIZE);
    }

    public static InMemorySource of(String name, StructType schema, List<Row> rows, int batchSize) {
        return new InMemorySource(name, schema, Collections.singletonList(rows), true, batchSize);
    }

    public static InMemorySource partitioned(String name, StructType schema, List<List<Row>> partitions) {
        return partitioned(name, schema, partitions, DEFAULT_BATCH_SIZE);
    }

    /**
     * Creates a source with one split per list.
     *
     * @param name the source name
     * @param schema the row schema
     * @param partitions the rows of each split
     * @param batchSize the largest batch a scan returns
     * @return the source
     */
    public static InMemorySource partitioned(String name, StructType schema, List<List<Row>> partitions,
                                             int batchSize) {
        return new InMemorySource(name, schema, partitions, true, batchSize);
    }

    /**
     * Returns a copy of this source that does not report a row count, so
     * planners treat its size as unknown.
     *
     * @return a source without statistics
     */
    public InMemorySource withoutStatistics() {
        return new InMemorySource(name, schema, partitions, false, batchSize);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StructType schema() {
        return schema;
    }

    @Override
    public Iterator<RowBatch> scan(StructType requiredSchema) {
        List<Row> all = new ArrayList<>();
        for (List<Row> partition : partitions) {
            all.addAll(partition);
        }
        return batches(all);
    }

    @Override
    public int partitionCount() {
        return partitions.size();
    }

    @Override
    public Iterator<RowBatch> scanPartition(StructType requiredSchema, int partition) {
        if (partition < 0 || partition >= partitions.size()) {
            throw new IllegalArgumentException("Source " + name + " has no partition " + partition);
        }
        return batches(partitions.get(partition));
    }

    public int batchSize() {
        return batchSize;
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return reportRowCount ? OptionalLong.of(rowCount) : OptionalLong.empty();
    }

    private Iterator<RowBatch> batches(List<Row> rows) {
        return RowBatch.builder(schema, batchSize).addAll(rows).build().iterator();
    }

    @Override
    public String toString() {
        return "InMemorySource(" + name + ", rows=" + rowCount + ", partitions=" + partitions.size() + ")";
    }
}
