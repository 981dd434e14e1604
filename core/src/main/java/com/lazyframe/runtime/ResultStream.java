package com.lazyframe.runtime;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.QueryExecutionException;
import com.lazyframe.metrics.ExecutionStats;
import com.lazyframe.physical.ExchangeExec;
import com.lazyframe.physical.PhysicalPlan;
import com.lazyframe.runtime.operator.Operator;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Future;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazy stream of result batches for one run.
 *
 * <p>The first pull runs the plan's exchanges, then starts every partition
 * of the final stage on the worker pool. Each partition feeds a small
 * bounded queue, and batches are returned in partition order, so a slow
 * consumer holds the workers back instead of buffering the whole result.
 *
 * <p>The stream is single-use; closing it (or exhausting it) releases the
 * run's worker threads. Statistics remain readable afterwards.
 */
public final class ResultStream implements Iterator<RowBatch>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResultStream.class);

    private static final int QUEUE_CAPACITY = 4;

    private final PhysicalPlan plan;
    private final ExecutionContext context;
    private final Runnable prepare;
    private final IntFunction<Operator> partitionReader;
    private final int numPartitions;
    private final List<PartitionFeed> feeds = new ArrayList<>();
    private final List<Future<?>> tasks = new ArrayList<>();
    private long startNanos;
    private int currentFeed;
    private RowBatch pending;
    private long rowsReturned;
    private boolean started;
    private boolean finished;

    ResultStream(PhysicalPlan plan, ExecutionContext context, Runnable prepare,
                 IntFunction<Operator> partitionReader, int numPartitions) {
        this.plan = plan;
        this.context = context;
        this.prepare = prepare;
        this.partitionReader = partitionReader;
        this.numPartitions = numPartitions;
    }

    public StructType schema() {
        return plan.schema();
    }

    public ExecutionStats stats() {
        return context.stats();
    }

    public String runId() {
        return context.runId();
    }

    /**
     * Requests cancellation; the next pull throws
     * {@link com.lazyframe.exception.QueryCancelledException}.
     */
    public void cancel() {
        context.cancel();
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        try {
            if (!started) {
                start();
            }
            while (currentFeed < feeds.size()) {
                Item item = take(feeds.get(currentFeed));
                if (item.failure() != null) {
                    throw item.failure();
                }
                if (item.batch() == null) {
                    currentFeed++;
                    continue;
                }
                pending = item.batch();
                rowsReturned += pending.size();
                return true;
            }
            finish();
            return false;
        } catch (RuntimeException e) {
            logger.warn("Run {} failed: {}", context.runId(), e.getMessage());
            close();
            throw e;
        }
    }

    private void start() {
        started = true;
        startNanos = System.nanoTime();
        context.checkCancelled();
        prepare.run();
        for (int p = 0; p < numPartitions; p++) {
            PartitionFeed feed = new PartitionFeed(p);
            feeds.add(feed);
            tasks.add(context.workers().submit(feed));
        }
    }

    private Item take(PartitionFeed feed) {
        try {
            return feed.queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while reading " + plan.label(), e, plan.label());
        }
    }

    @Override
    public RowBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RowBatch batch = pending;
        pending = null;
        return batch;
    }

    /**
     * Drains the stream into a list of rows and closes it.
     *
     * @return all remaining rows
     */
    public List<Row> collectRows() {
        List<Row> rows = new ArrayList<>();
        try {
            while (hasNext()) {
                rows.addAll(next().rows());
            }
        } finally {
            close();
        }
        return rows;
    }

    private void finish() {
        finished = true;
        context.stats().complete();
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        long exchanges = plan.collectNodes().stream().filter(node -> node instanceof ExchangeExec).count();
        logger.info("Run {} finished: {} rows, {} exchanges, {} shuffle bytes in {} ms", context.runId(),
            rowsReturned, exchanges, context.stats().totalShuffleBytes(), elapsedMs);
        context.close();
    }

    @Override
    public void close() {
        finished = true;
        pending = null;
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
        context.close();
    }

    /**
     * One queued result of a partition: a batch, a failure, or the end marker.
     */
    private record Item(RowBatch batch, RuntimeException failure) {
        static final Item END = new Item(null, null);
    }

    /**
     * Runs one partition of the final stage on a worker thread.
     */
    private final class PartitionFeed implements Runnable {

        private final int partition;
        private final BlockingQueue<Item> queue = new ArrayBlockingQueue<>(QUEUE_CAPACITY);

        PartitionFeed(int partition) {
            this.partition = partition;
        }

        @Override
        public void run() {
            try {
                Operator operator = partitionReader.apply(partition);
                operator.open();
                try {
                    RowBatch batch;
                    while ((batch = operator.next()) != null) {
                        queue.put(new Item(batch, null));
                    }
                } finally {
                    operator.close();
                }
                queue.put(Item.END);
            } catch (InterruptedException e) {
                // Stream closed while this partition was blocked on a full queue
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                fail(e);
            } catch (Error e) {
                fail(new QueryExecutionException("Partition " + partition + " failed: " + e, e, plan.label()));
                throw e;
            }
        }

        private void fail(RuntimeException failure) {
            try {
                queue.put(new Item(null, failure));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
