package com.lazyframe.explain;

import java.util.OptionalLong;

/**
 * One node of a described plan.
 *
 * @param depth the depth below the root (the root is 0)
 * @param nodeId the physical node id, or -1 for logical plans
 * @param operator the operator name
 * @param details the node's full description
 * @param partitioning the output partitioning, or "-" for logical plans
 * @param estimatedRows the estimated output rows, empty if unknown
 * @param actualRowsIn the rows the node consumed, empty before execution
 * @param actualRowsOut the rows the node produced, empty before execution
 * @param boundary whether the node moves data between partitions
 */
public record PlanNodeDescription(int depth, int nodeId, String operator, String details, String partitioning,
                                  OptionalLong estimatedRows, OptionalLong actualRowsIn,
                                  OptionalLong actualRowsOut, BoundaryKind boundary) {

    /**
     * Renders the node as one line, without indentation.
     *
     * @return the line
     */
    public String render() {
        StringBuilder sb = new StringBuilder(details);
        sb.append(" [partitioning=").append(partitioning);
        sb.append(", est=").append(estimatedRows.isPresent() ? String.valueOf(estimatedRows.getAsLong()) : "?");
        if (actualRowsOut.isPresent()) {
            sb.append(", in=").append(actualRowsIn.orElse(0));
            sb.append(", out=").append(actualRowsOut.getAsLong());
        }
        if (boundary != BoundaryKind.NONE) {
            sb.append(", boundary=").append(boundary);
        }
        return sb.append(']').toString();
    }
}
