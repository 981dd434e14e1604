package com.lazyframe.shuffle;

import com.lazyframe.data.Row;

/**
 * Maps a row to a target partition.
 */
@FunctionalInterface
public interface PartitionFunction {

    /**
     * Returns the target partition of a row.
     *
     * @param row the row
     * @param numPartitions the number of target partitions
     * @return a partition index in {@code [0, numPartitions)}
     */
    int partition(Row row, int numPartitions);
}
