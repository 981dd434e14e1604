package com.lazyframe.physical;

import java.util.List;
import java.util.Objects;

/**
 * Rows are placed by hashing the key columns modulo the partition count.
 */
public record HashPartitioning(List<String> keys, int numPartitions) implements Partitioning {

    public HashPartitioning {
        keys = List.copyOf(Objects.requireNonNull(keys, "keys must not be null"));
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("Hash partitioning requires at least one key");
        }
        if (numPartitions < 1) {
            throw new IllegalArgumentException("numPartitions must be positive: " + numPartitions);
        }
    }

    @Override
    public boolean satisfiesClustering(List<String> required) {
        // Hashing on a subset of the grouping keys still co-locates each group
        return required.containsAll(keys);
    }

    @Override
    public boolean isSingle() {
        return numPartitions == 1;
    }

    @Override
    public String toString() {
        return "hash(" + String.join(", ", keys) + ") x " + numPartitions;
    }
}
