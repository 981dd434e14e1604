package com.lazyframe.shuffle;

import com.lazyframe.data.GroupKey;
import com.lazyframe.data.Row;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.StructType;
import java.util.List;

/**
 * Partitions rows by a hash of their key columns.
 *
 * <p>Each key value's hash code is passed through the MurmurHash3 finalizer
 * and combined; a null value hashes to a fixed constant. The result is
 * stable across runs and JVMs for the same key values, so two inputs hashed
 * on equal keys land in matching partitions.
 */
public final class HashPartitionFunction implements PartitionFunction {

    private static final int SEED = 42;
    private static final int NULL_HASH = 0x5bd1e995;

    private final int[] keyOrdinals;

    public HashPartitionFunction(int[] keyOrdinals) {
        if (keyOrdinals.length == 0) {
            throw new IllegalArgumentException("Hash partitioning requires at least one key");
        }
        this.keyOrdinals = keyOrdinals.clone();
    }

    /**
     * Creates a function hashing the named columns of a schema.
     *
     * @param schema the row schema
     * @param keys the key column names
     * @return the partition function
     */
    public static HashPartitionFunction forKeys(StructType schema, List<String> keys) {
        int[] ordinals = new int[keys.size()];
        for (int i = 0; i < ordinals.length; i++) {
            ordinals[i] = schema.fieldIndex(keys.get(i));
            if (ordinals[i] < 0) {
                throw SchemaException.columnNotFound(keys.get(i), schema);
            }
        }
        return new HashPartitionFunction(ordinals);
    }

    @Override
    public int partition(Row row, int numPartitions) {
        return Math.floorMod(hash(row), numPartitions);
    }

    int hash(Row row) {
        int h = SEED;
        for (int ordinal : keyOrdinals) {
            Object value = GroupKey.normalize(row.get(ordinal));
            int valueHash = value == null ? NULL_HASH : fmix(value.hashCode());
            h = 31 * h + valueHash;
        }
        return fmix(h);
    }

    private static int fmix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
