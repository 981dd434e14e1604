package com.lazyframe.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-node runtime counters for a single query run.
 *
 * <p>Worker threads update the counters concurrently; readers take
 * point-in-time {@link StageMetrics} snapshots. Each run owns its own
 * instance.
 */
public final class ExecutionStats {

    private final Map<Integer, Counters> counters = new ConcurrentHashMap<>();
    private volatile boolean complete;

    public void addRowsIn(int nodeId, long rows) {
        counters(nodeId).rowsIn.add(rows);
    }

    public void addOutput(int nodeId, long rows) {
        Counters c = counters(nodeId);
        c.rowsOut.add(rows);
        c.batchesOut.increment();
    }

    public void addShuffle(int nodeId, long rows, long bytes) {
        Counters c = counters(nodeId);
        c.shuffledRows.add(rows);
        c.shuffleBytes.add(bytes);
    }

    public void addElapsedNanos(int nodeId, long nanos) {
        counters(nodeId).elapsedNanos.add(nanos);
    }

    /**
     * Returns a snapshot of one node's counters.
     *
     * @param nodeId the physical node id
     * @return the counters, all zero if the node never ran
     */
    public StageMetrics stage(int nodeId) {
        Counters c = counters.get(nodeId);
        return c == null ? StageMetrics.empty(nodeId) : c.snapshot(nodeId);
    }

    /**
     * Returns a snapshot of every node's counters, ordered by node id.
     *
     * @return node id to counters
     */
    public Map<Integer, StageMetrics> snapshot() {
        Map<Integer, StageMetrics> result = new TreeMap<>();
        counters.forEach((id, c) -> result.put(id, c.snapshot(id)));
        return Collections.unmodifiableMap(result);
    }

    public long totalShuffleBytes() {
        long total = 0;
        for (Counters c : counters.values()) {
            total += c.shuffleBytes.sum();
        }
        return total;
    }

    /**
     * Marks the run as finished; counters no longer change afterwards.
     */
    public void complete() {
        complete = true;
    }

    public boolean isComplete() {
        return complete;
    }

    private Counters counters(int nodeId) {
        return counters.computeIfAbsent(nodeId, id -> new Counters());
    }

    private static final class Counters {
        final LongAdder rowsIn = new LongAdder();
        final LongAdder rowsOut = new LongAdder();
        final LongAdder batchesOut = new LongAdder();
        final LongAdder shuffledRows = new LongAdder();
        final LongAdder shuffleBytes = new LongAdder();
        final LongAdder elapsedNanos = new LongAdder();

        StageMetrics snapshot(int nodeId) {
            return new StageMetrics(nodeId, rowsIn.sum(), rowsOut.sum(), batchesOut.sum(),
                shuffledRows.sum(), shuffleBytes.sum(), elapsedNanos.sum());
        }
    }
}
