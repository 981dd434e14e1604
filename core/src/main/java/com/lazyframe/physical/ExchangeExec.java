package com.lazyframe.physical;

import java.util.List;
import java.util.OptionalLong;

/**
 * Stage boundary that redistributes its input.
 *
 * <p>At run time the exchange drains every upstream partition, then routes
 * rows to their target partitions through the shuffle engine, or
 * materializes them once for broadcast.
 */
public final class ExchangeExec extends PhysicalPlan {

    /**
     * How rows are redistributed.
     */
    public enum Mode {
        HASH,
        ROUND_ROBIN,
        SINGLE,
        BROADCAST
    }

    private final Mode mode;
    private final List<String> keys;
    private final int numPartitions;
    private final long maxBroadcastBytes;

    private ExchangeExec(int id, PhysicalPlan child, Mode mode, List<String> keys, int numPartitions,
                         long maxBroadcastBytes) {
        super(id, List.of(child), child.schema(), child.estimatedRows());
        this.mode = mode;
        this.keys = List.copyOf(keys);
        this.numPartitions = numPartitions;
        this.maxBroadcastBytes = maxBroadcastBytes;
    }

    public static ExchangeExec hash(int id, PhysicalPlan child, List<String> keys, int numPartitions) {
        return new ExchangeExec(id, child, Mode.HASH, keys, numPartitions, -1);
    }

    public static ExchangeExec roundRobin(int id, PhysicalPlan child, int numPartitions) {
        return new ExchangeExec(id, child, Mode.ROUND_ROBIN, List.of(), numPartitions, -1);
    }

    public static ExchangeExec single(int id, PhysicalPlan child) {
        return new ExchangeExec(id, child, Mode.SINGLE, List.of(), 1, -1);
    }

    public static ExchangeExec broadcast(int id, PhysicalPlan child, long maxBytes) {
        return new ExchangeExec(id, child, Mode.BROADCAST, List.of(), 1, maxBytes);
    }

    public Mode mode() {
        return mode;
    }

    public List<String> keys() {
        return keys;
    }

    public int numPartitions() {
        return numPartitions;
    }

    /**
     * Returns the size limit enforced when a broadcast is materialized.
     *
     * @return the limit in bytes, or -1 for non-broadcast exchanges
     */
    public long maxBroadcastBytes() {
        return maxBroadcastBytes;
    }

    public boolean isBroadcast() {
        return mode == Mode.BROADCAST;
    }

    @Override
    public Partitioning outputPartitioning() {
        switch (mode) {
            case HASH:
                return new HashPartitioning(keys, numPartitions);
            case ROUND_ROBIN:
                return new UnknownPartitioning(numPartitions);
            case SINGLE:
                return SinglePartition.get();
            default:
                return BroadcastPartitioning.get();
        }
    }

    @Override
    protected String argumentString() {
        switch (mode) {
            case HASH:
                return "hash" + keys + ", " + numPartitions;
            case ROUND_ROBIN:
                return "roundrobin, " + numPartitions;
            case SINGLE:
                return "single";
            default:
                return "broadcast";
        }
    }
}
