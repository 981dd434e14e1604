package com.lazyframe.metrics;

/**
 * Read-only counters of one physical node for one run.
 *
 * @param nodeId the physical node id
 * @param rowsIn rows consumed from the node's children
 * @param rowsOut rows produced
 * @param batchesOut batches produced
 * @param shuffledRows rows moved by an exchange
 * @param shuffleBytes estimated bytes moved by an exchange
 * @param elapsedNanos time spent inside the node, children excluded where measurable
 */
public record StageMetrics(int nodeId, long rowsIn, long rowsOut, long batchesOut,
                           long shuffledRows, long shuffleBytes, long elapsedNanos) {

    public static StageMetrics empty(int nodeId) {
        return new StageMetrics(nodeId, 0, 0, 0, 0, 0, 0);
    }
}
