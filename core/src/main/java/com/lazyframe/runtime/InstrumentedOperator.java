package com.lazyframe.runtime;

import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.LazyFrameException;
import com.lazyframe.exception.QueryExecutionException;
import com.lazyframe.metrics.ExecutionStats;
import com.lazyframe.runtime.operator.Operator;
import com.lazyframe.types.StructType;

/**
 * Wraps an operator to record row counts and time against its plan node,
 * observe cancellation, and attach the node label to failures.
 *
 * <p>A negative {@code nodeId} records nothing for the wrapped operator
 * itself; it is used for reads of already-materialized exchange output.
 */
final class InstrumentedOperator implements Operator {

    private final Operator delegate;
    private final int nodeId;
    private final int parentId;
    private final String label;
    private final ExecutionContext context;
    private final ExecutionStats stats;

    InstrumentedOperator(Operator delegate, int nodeId, int parentId, String label, ExecutionContext context) {
        this.delegate = delegate;
        this.nodeId = nodeId;
        this.parentId = parentId;
        this.label = label;
        this.context = context;
        this.stats = context.stats();
    }

    @Override
    public void open() {
        context.checkCancelled();
        long start = System.nanoTime();
        try {
            delegate.open();
        } catch (RuntimeException e) {
            throw attachNode(e, label);
        } finally {
            recordTime(start);
        }
    }

    @Override
    public RowBatch next() {
        context.checkCancelled();
        long start = System.nanoTime();
        RowBatch batch;
        try {
            batch = delegate.next();
        } catch (RuntimeException e) {
            throw attachNode(e, label);
        } finally {
            recordTime(start);
        }
        if (batch != null) {
            if (nodeId >= 0) {
                stats.addOutput(nodeId, batch.size());
            }
            if (parentId >= 0) {
                stats.addRowsIn(parentId, batch.size());
            }
        }
        return batch;
    }

    private void recordTime(long start) {
        if (nodeId >= 0) {
            stats.addElapsedNanos(nodeId, System.nanoTime() - start);
        }
    }

    @Override
    public void close() {
        delegate.close();
    }

    @Override
    public StructType schema() {
        return delegate.schema();
    }

    /**
     * Returns the exception to propagate for a failure inside a node. Engine
     * exceptions pass through; a {@link QueryExecutionException} without a
     * node gets this one; anything else is wrapped.
     */
    static RuntimeException attachNode(RuntimeException e, String label) {
        if (e instanceof QueryExecutionException) {
            QueryExecutionException qee = (QueryExecutionException) e;
            if (qee.getFailedNode() != null) {
                return qee;
            }
            return new QueryExecutionException(qee.getMessage(), qee.getCause() != null ? qee.getCause() : qee,
                label);
        }
        if (e instanceof LazyFrameException) {
            return e;
        }
        return new QueryExecutionException("Execution failed in " + label + ": " + e.getMessage(), e, label);
    }
}
