package com.lazyframe.explain;

import java.util.List;

/**
 * Pre-order description of a plan, with exchange counts.
 */
public final class PlanDescription {

    private final List<PlanNodeDescription> nodes;

    PlanDescription(List<PlanNodeDescription> nodes) {
        this.nodes = List.copyOf(nodes);
    }

    public List<PlanNodeDescription> nodes() {
        return nodes;
    }

    public long shuffleCount() {
        return count(BoundaryKind.SHUFFLE);
    }

    public long broadcastCount() {
        return count(BoundaryKind.BROADCAST);
    }

    /**
     * Returns the number of nodes that move data between partitions.
     *
     * @return shuffles plus broadcasts
     */
    public long exchangeCount() {
        return shuffleCount() + broadcastCount();
    }

    /**
     * Returns the first node with the given operator name.
     *
     * @param operator the operator name, for example {@code "FilterExec"}
     * @return the node
     * @throws IllegalArgumentException if no node has that name
     */
    public PlanNodeDescription find(String operator) {
        for (PlanNodeDescription node : nodes) {
            if (node.operator().equals(operator)) {
                return node;
            }
        }
        throw new IllegalArgumentException("No " + operator + " in plan");
    }

    private long count(BoundaryKind kind) {
        return nodes.stream().filter(node -> node.boundary() == kind).count();
    }

    /**
     * Renders the plan as indented text, one node per line.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (PlanNodeDescription node : nodes) {
            for (int i = 0; i < node.depth(); i++) {
                sb.append("  ");
            }
            if (node.depth() > 0) {
                sb.append("+- ");
            }
            sb.append(node.render()).append('\n');
        }
        return sb.toString();
    }
}
