package com.lazyframe.data;

import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, ordered batch of rows sharing one schema.
 *
 * <p>RowBatch is the unit of data moved between operators and across exchange
 * boundaries. Operators never modify a batch; they build new ones. Because of
 * that, a batch may be read concurrently by any number of consumers, which is
 * what allows a broadcast join side to be shared by all workers without locking.
 *
 * <p>Every row must have exactly as many values as the schema has fields, and
 * every non-null value must match its field's type.
 */
public final class RowBatch implements Iterable<Row> {

    private final StructType schema;
    private final List<Row> rows;

    /**
     * Creates a batch, validating each row against the schema.
     *
     * @param schema the batch schema
     * @param rows the rows
     * @throws IllegalArgumentException if a row does not match the schema
     */
    public RowBatch(StructType schema, List<Row> rows) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.rows = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(rows, "rows must not be null")));
        for (Row row : this.rows) {
            validate(row);
        }
    }

    private RowBatch(StructType schema, List<Row> rows, boolean trusted) {
        this.schema = schema;
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Creates a batch from rows produced by an operator that already guarantees
     * the layout. The list is adopted without copying and must not be modified
     * afterwards.
     *
     * @param schema the batch schema
     * @param rows the rows, owned by the new batch from now on
     * @return the batch
     */
    public static RowBatch adopt(StructType schema, List<Row> rows) {
        return new RowBatch(schema, rows, true);
    }

    /**
     * Creates an empty batch.
     *
     * @param schema the batch schema
     * @return the empty batch
     */
    public static RowBatch empty(StructType schema) {
        return new RowBatch(schema, Collections.emptyList(), true);
    }

    private void validate(Row row) {
        if (row.size() != schema.size()) {
            throw new IllegalArgumentException(String.format(
                "Row has %d values but schema has %d fields: %s", row.size(), schema.size(), row));
        }
        for (int i = 0; i < schema.size(); i++) {
            Object value = row.get(i);
            StructField field = schema.fieldAt(i);
            if (value == null) {
                if (!field.nullable()) {
                    throw new IllegalArgumentException("Null value in non-nullable field " + field.name());
                }
            } else if (!field.dataType().accepts(value)) {
                throw new IllegalArgumentException(String.format(
                    "Value %s (%s) does not match field %s", value, value.getClass().getSimpleName(), field));
            }
        }
    }

    public StructType schema() {
        return schema;
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Row row(int index) {
        return rows.get(index);
    }

    /**
     * Estimated size of this batch in bytes: row count times the schema's
     * estimated row width.
     *
     * @return the estimated size
     */
    public long estimatedSizeInBytes() {
        return (long) rows.size() * schema.estimatedRowWidth();
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }

    @Override
    public String toString() {
        return String.format("RowBatch(rows=%d, schema=%s)", rows.size(), schema.fieldNames());
    }

    /**
     * Returns a builder that splits appended rows into batches of a fixed size.
     *
     * @param schema the schema of the produced batches
     * @param batchSize the maximum rows per batch
     * @return the builder
     */
    public static Builder builder(StructType schema, int batchSize) {
        return new Builder(schema, batchSize);
    }

    /**
     * Accumulates rows and cuts them into batches of at most {@code batchSize}
     * rows. Not thread-safe; each worker uses its own builder.
     */
    public static final class Builder {
        private final StructType schema;
        private final int batchSize;
        private final List<RowBatch> batches = new ArrayList<>();
        private List<Row> current;

        private Builder(StructType schema, int batchSize) {
            this.schema = Objects.requireNonNull(schema, "schema must not be null");
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
            }
            this.batchSize = batchSize;
            this.current = new ArrayList<>(Math.min(batchSize, 1024));
        }

        public Builder add(Row row) {
            current.add(row);
            if (current.size() >= batchSize) {
                flush();
            }
            return this;
        }

        public Builder addAll(Iterable<Row> rows) {
            for (Row row : rows) {
                add(row);
            }
            return this;
        }

        private void flush() {
            if (!current.isEmpty()) {
                batches.add(RowBatch.adopt(schema, current));
                current = new ArrayList<>(Math.min(batchSize, 1024));
            }
        }

        /**
         * Returns all batches built so far, including a trailing partial batch.
         *
         * @return the batches
         */
        public List<RowBatch> build() {
            flush();
            return new ArrayList<>(batches);
        }
    }
}
