package com.lazyframe.api;

import com.lazyframe.logical.TableScan;
import com.lazyframe.optimizer.QueryOptimizer;
import com.lazyframe.physical.PhysicalPlanner;
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.runtime.Executor;
import com.lazyframe.source.Source;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates {@link DataFrame}s over sources and owns the
 * optimizer, planner and executor that materialize them.
 *
 * <p>An engine holds no per-query state; every run gets its own
 * execution context.
 *
 * <p>Example usage:
 * <pre>
 *   QueryEngine engine = QueryEngine.create();
 *   List&lt;Row&gt; rows = engine.read(source)
 *       .filter(col("state").equalTo("Ohio"))
 *       .collect();
 * </pre>
 */
public class QueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final EngineConfig config;
    private final QueryOptimizer optimizer;
    private final PhysicalPlanner planner;
    private final Executor executor;

    public QueryEngine(EngineConfig config) {
        this(config, new QueryOptimizer(config.maxOptimizerPasses()));
    }

    /**
     * Creates an engine with a custom optimizer.
     *
     * @param config the configuration
     * @param optimizer the optimizer to apply in optimized mode
     */
    public QueryEngine(EngineConfig config, QueryOptimizer optimizer) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.planner = new PhysicalPlanner(config);
        this.executor = new Executor();
        logger.debug("Created query engine with {}", config);
    }

    /**
     * Creates an engine configured from defaults and system properties.
     *
     * @return the engine
     */
    public static QueryEngine create() {
        return new QueryEngine(EngineConfig.fromSystemProperties());
    }

    /**
     * Creates a DataFrame reading all columns of a source.
     *
     * @param source the source
     * @return the DataFrame
     */
    public DataFrame read(Source source) {
        Objects.requireNonNull(source, "source must not be null");
        return new DataFrame(this, new TableScan(source));
    }

    public EngineConfig config() {
        return config;
    }

    QueryOptimizer optimizer() {
        return optimizer;
    }

    PhysicalPlanner planner() {
        return planner;
    }

    Executor executor() {
        return executor;
    }
}
