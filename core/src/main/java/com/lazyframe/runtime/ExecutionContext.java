package com.lazyframe.runtime;

import com.lazyframe.exception.QueryCancelledException;
import com.lazyframe.metrics.ExecutionStats;
import com.lazyframe.shuffle.ShuffleEngine;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State for one execution run: configuration, worker pool, shuffle engine,
 * statistics and the cancellation flag.
 *
 * <p>A context is created per run and closed when the run's result stream
 * is closed. Closing shuts the worker pool down.
 */
public final class ExecutionContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionContext.class);

    private final String runId;
    private final EngineConfig config;
    private final ExecutionStats stats;
    private final ShuffleEngine shuffleEngine;
    private final ExecutorService workers;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ExecutionContext(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.runId = UUID.randomUUID().toString().substring(0, 8);
        this.stats = new ExecutionStats();
        this.shuffleEngine = new ShuffleEngine(config.batchSize());
        this.workers = Executors.newFixedThreadPool(config.defaultPartitionCount(), workerThreadFactory());
    }

    public String runId() {
        return runId;
    }

    public EngineConfig config() {
        return config;
    }

    public ExecutionStats stats() {
        return stats;
    }

    public ShuffleEngine shuffleEngine() {
        return shuffleEngine;
    }

    ExecutorService workers() {
        return workers;
    }

    /**
     * Requests cancellation. Operators observe the flag between batches.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("Run {} cancelled", runId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Throws if the run has been cancelled.
     *
     * @throws QueryCancelledException if {@link #cancel()} was called
     */
    public void checkCancelled() {
        if (cancelled.get()) {
            throw new QueryCancelledException(runId);
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Workers for run {} did not terminate within 5 seconds", runId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "lazyframe-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
