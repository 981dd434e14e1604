package com.lazyframe.physical;

import java.util.List;
import java.util.OptionalLong;

/**
 * Keeps the first {@code limit} rows of each input partition. The partial
 * phase runs before the single-partition exchange; the final phase after it.
 */
public final class LimitExec extends PhysicalPlan {

    private final long limit;
    private final boolean partial;

    public LimitExec(int id, PhysicalPlan child, long limit, boolean partial, OptionalLong estimatedRows) {
        super(id, List.of(child), child.schema(), estimatedRows);
        this.limit = limit;
        this.partial = partial;
    }

    public long limit() {
        return limit;
    }

    public boolean isPartial() {
        return partial;
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    protected String argumentString() {
        return limit + (partial ? ", partial" : "");
    }
}
