package com.lazyframe.runtime.operator;

import com.lazyframe.data.GroupKey;
import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Build side of a hash join: rows grouped by their join key.
 *
 * <p>Rows with a null in any key column are counted but not stored, since
 * they can never match. A table is not modified after it is built, so one
 * table built from a broadcast can be probed by every partition at once.
 */
public final class JoinHashTable {

    private final StructType schema;
    private final Map<GroupKey, List<Row>> buckets;
    private final long rowCount;

    private JoinHashTable(StructType schema, Map<GroupKey, List<Row>> buckets, long rowCount) {
        this.schema = schema;
        this.buckets = Collections.unmodifiableMap(buckets);
        this.rowCount = rowCount;
    }

    /**
     * Builds a table from rows already in memory.
     *
     * @param schema the schema of the rows
     * @param rows the build rows
     * @param keys the key column names
     * @return the table
     * @throws SchemaException if a key is not in the schema
     */
    public static JoinHashTable build(StructType schema, Iterable<Row> rows, List<String> keys) {
        int[] ordinals = keyOrdinals(schema, keys);
        Map<GroupKey, List<Row>> buckets = new HashMap<>();
        long count = 0;
        for (Row row : rows) {
            add(buckets, row, ordinals);
            count++;
        }
        return new JoinHashTable(schema, buckets, count);
    }

    /**
     * Drains an operator into a table. The operator is opened and closed here.
     */
    static JoinHashTable build(Operator input, int[] ordinals) {
        Map<GroupKey, List<Row>> buckets = new HashMap<>();
        long count = 0;
        input.open();
        try {
            RowBatch batch;
            while ((batch = input.next()) != null) {
                for (Row row : batch) {
                    add(buckets, row, ordinals);
                }
                count += batch.size();
            }
        } finally {
            input.close();
        }
        return new JoinHashTable(input.schema(), buckets, count);
    }

    private static void add(Map<GroupKey, List<Row>> buckets, Row row, int[] ordinals) {
        GroupKey key = GroupKey.of(row, ordinals);
        if (!key.hasNull()) {
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
    }

    static int[] keyOrdinals(StructType schema, List<String> keys) {
        int[] ordinals = new int[keys.size()];
        for (int i = 0; i < ordinals.length; i++) {
            ordinals[i] = schema.fieldIndex(keys.get(i));
            if (ordinals[i] < 0) {
                throw SchemaException.columnNotFound(keys.get(i), schema);
            }
        }
        return ordinals;
    }

    /**
     * Returns the build rows with the given key; none for a key containing null.
     *
     * @param key the probe key
     * @return the matching rows, possibly empty
     */
    public List<Row> matches(GroupKey key) {
        if (key.hasNull()) {
            return Collections.emptyList();
        }
        return buckets.getOrDefault(key, Collections.emptyList());
    }

    public StructType schema() {
        return schema;
    }

    /**
     * Returns the number of rows read while building, including null-keyed ones.
     *
     * @return the row count
     */
    public long rowCount() {
        return rowCount;
    }
}
