package com.lazyframe.physical;

import java.util.List;

/**
 * Rows are spread over partitions with no known relationship to their values.
 */
public record UnknownPartitioning(int numPartitions) implements Partitioning {

    public UnknownPartitioning {
        if (numPartitions < 1) {
            throw new IllegalArgumentException("numPartitions must be positive: " + numPartitions);
        }
    }

    @Override
    public boolean satisfiesClustering(List<String> keys) {
        return numPartitions == 1;
    }

    @Override
    public boolean isSingle() {
        return numPartitions == 1;
    }

    @Override
    public String toString() {
        return "unknown x " + numPartitions;
    }
}
