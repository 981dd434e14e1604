package com.lazyframe.physical;

import com.lazyframe.logical.Join;
import com.lazyframe.logical.Limit;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.TableScan;
import com.lazyframe.logical.TopN;
import java.util.OptionalLong;

/**
 * Row and byte estimates for logical plans.
 *
 * <p>Only source row counts are used; there are no column statistics.
 * Filters, projections and aggregations keep their input estimate as an
 * upper bound, limits cap it, and an unknown estimate anywhere below a node
 * makes that node unknown too.
 */
public final class SizeEstimator {

    private SizeEstimator() {}

    /**
     * Estimates the number of rows a plan produces.
     *
     * @param plan the plan
     * @return the estimate, or empty if unknown
     */
    public static OptionalLong estimatedRows(LogicalPlan plan) {
        if (plan instanceof TableScan) {
            return ((TableScan) plan).source().estimatedRowCount();
        }
        if (plan instanceof Limit) {
            return cap(estimatedRows(((Limit) plan).child()), ((Limit) plan).limit());
        }
        if (plan instanceof TopN) {
            TopN topN = (TopN) plan;
            OptionalLong child = estimatedRows(topN.child());
            // A per-group limit bounds nothing overall
            return topN.isGlobal() ? cap(child, topN.limit()) : child;
        }
        if (plan instanceof Join) {
            Join join = (Join) plan;
            OptionalLong left = estimatedRows(join.left());
            if (join.joinType() != Join.JoinType.INNER) {
                return left;
            }
            OptionalLong right = estimatedRows(join.right());
            if (left.isEmpty() || right.isEmpty()) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(Math.max(left.getAsLong(), right.getAsLong()));
        }
        if (plan.children().size() == 1) {
            return estimatedRows(plan.children().get(0));
        }
        return OptionalLong.empty();
    }

    /**
     * Estimates the bytes a plan produces: rows times estimated row width.
     *
     * @param plan the plan
     * @return the estimate, or empty if unknown
     */
    public static OptionalLong estimatedSizeInBytes(LogicalPlan plan) {
        OptionalLong rows = estimatedRows(plan);
        if (rows.isEmpty()) {
            return OptionalLong.empty();
        }
        long width = plan.schema().estimatedRowWidth();
        long bytes = rows.getAsLong() > Long.MAX_VALUE / Math.max(width, 1)
            ? Long.MAX_VALUE : rows.getAsLong() * width;
        return OptionalLong.of(bytes);
    }

    private static OptionalLong cap(OptionalLong rows, long limit) {
        return rows.isPresent() ? OptionalLong.of(Math.min(rows.getAsLong(), limit)) : OptionalLong.of(limit);
    }
}
