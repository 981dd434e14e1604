package com.lazyframe.physical;

import java.util.List;

/**
 * Describes how the rows of a physical node's output are spread over
 * partitions.
 */
public sealed interface Partitioning
    permits HashPartitioning, SinglePartition, BroadcastPartitioning, UnknownPartitioning {

    /**
     * Returns the number of output partitions.
     *
     * @return the partition count
     */
    int numPartitions();

    /**
     * Returns whether all rows sharing the same values of {@code keys} are
     * guaranteed to be in the same partition.
     *
     * @param keys the grouping columns
     * @return true if the rows are clustered by the keys
     */
    boolean satisfiesClustering(List<String> keys);

    /**
     * Returns whether every row is in one partition.
     *
     * @return true for a single partition
     */
    default boolean isSingle() {
        return false;
    }
}
