package com.lazyframe.api;

import com.lazyframe.data.Row;
import com.lazyframe.explain.PlanDescription;
import com.lazyframe.explain.PlanExplainer;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.metrics.ExecutionStats;
import com.lazyframe.physical.PhysicalPlan;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.runtime.ResultStream;
import com.lazyframe.source.Sink;
import java.util.List;

/**
 * A planned query: the analyzed, optimized and physical plans of one
 * DataFrame in one mode. Each {@link #execute()} is a separate run.
 */
public final class QueryExecution {

    private final QueryEngine engine;
    private final LogicalPlan analyzedPlan;
    private final LogicalPlan optimizedPlan;
    private final PhysicalPlan physicalPlan;
    private final boolean optimized;
    private volatile ExecutionStats lastStats;

    QueryExecution(QueryEngine engine, LogicalPlan analyzedPlan, boolean optimized) {
        this.engine = engine;
        this.analyzedPlan = analyzedPlan;
        this.optimized = optimized;
        this.optimizedPlan = optimized ? engine.optimizer().optimize(analyzedPlan) : analyzedPlan;
        this.physicalPlan = engine.planner().plan(optimizedPlan, optimized);
    }

    public LogicalPlan analyzedPlan() {
        return analyzedPlan;
    }

    public LogicalPlan optimizedPlan() {
        return optimizedPlan;
    }

    public PhysicalPlan physicalPlan() {
        return physicalPlan;
    }

    public boolean isOptimized() {
        return optimized;
    }

    /**
     * Starts a run. The caller must close or exhaust the stream.
     *
     * @return the result stream
     */
    public ResultStream execute() {
        ExecutionContext context = new ExecutionContext(engine.config());
        ResultStream stream = engine.executor().execute(physicalPlan, context);
        lastStats = stream.stats();
        return stream;
    }

    /**
     * Runs the query and returns all rows.
     *
     * @return the rows
     */
    public List<Row> collect() {
        return execute().collectRows();
    }

    /**
     * Runs the query and writes every batch to the sink.
     *
     * @param sink the sink
     */
    public void write(Sink sink) {
        try (ResultStream stream = execute()) {
            sink.write(stream);
        }
    }

    /**
     * Returns the statistics of the most recent run.
     *
     * @return the stats, or null if the query has not run
     */
    public ExecutionStats lastStats() {
        return lastStats;
    }

    /**
     * Describes the physical plan, with actual row counts from the most
     * recent run if there was one.
     *
     * @return the description
     */
    public PlanDescription explain() {
        return PlanExplainer.explain(physicalPlan, lastStats);
    }

    public PlanDescription explainLogical() {
        return PlanExplainer.explain(optimizedPlan);
    }

    @Override
    public String toString() {
        return "== Optimized Logical Plan ==\n" + optimizedPlan.treeString()
            + "== Physical Plan ==\n" + PlanExplainer.explain(physicalPlan, lastStats);
    }
}
