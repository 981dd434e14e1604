package com.lazyframe.physical;

import java.util.List;

/**
 * The full data set is materialized once and shared read-only with every
 * consumer partition.
 */
public final class BroadcastPartitioning implements Partitioning {

    private static final BroadcastPartitioning INSTANCE = new BroadcastPartitioning();

    private BroadcastPartitioning() {}

    public static BroadcastPartitioning get() {
        return INSTANCE;
    }

    @Override
    public int numPartitions() {
        return 1;
    }

    @Override
    public boolean satisfiesClustering(List<String> keys) {
        return false;
    }

    @Override
    public String toString() {
        return "broadcast";
    }
}
