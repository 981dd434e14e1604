package com.lazyframe.physical;

import java.util.List;

/**
 * All rows are in one partition.
 */
public final class SinglePartition implements Partitioning {

    private static final SinglePartition INSTANCE = new SinglePartition();

    private SinglePartition() {}

    public static SinglePartition get() {
        return INSTANCE;
    }

    @Override
    public int numPartitions() {
        return 1;
    }

    @Override
    public boolean satisfiesClustering(List<String> keys) {
        return true;
    }

    @Override
    public boolean isSingle() {
        return true;
    }

    @Override
    public String toString() {
        return "single";
    }
}
