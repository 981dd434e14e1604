package com.lazyframe.exception;

import com.lazyframe.logical.LogicalPlan;

/**
 * Thrown when the optimizer's fixed-point loop is still changing the plan after
 * the configured maximum number of passes.
 *
 * <p>This is fatal: callers must not fall back to the unoptimized plan without
 * surfacing the failure.
 */
public class OptimizerDivergedException extends LazyFrameException {

    private final int passes;
    private final transient LogicalPlan lastPlan;

    public OptimizerDivergedException(int passes, LogicalPlan lastPlan) {
        super(String.format("Optimizer did not reach a fixed point after %d passes; last plan: %s",
            passes, lastPlan));
        this.passes = passes;
        this.lastPlan = lastPlan;
    }

    public int passes() {
        return passes;
    }

    /**
     * Returns the plan produced by the last pass.
     *
     * @return the partially rewritten plan
     */
    public LogicalPlan lastPlan() {
        return lastPlan;
    }
}
