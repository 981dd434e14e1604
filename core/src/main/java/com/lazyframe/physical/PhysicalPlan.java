package com.lazyframe.physical;

import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Base class for executable plan nodes.
 *
 * <p>A physical node fixes the algorithm for its operation and declares how
 * its output is partitioned. Every node carries an id unique within its plan,
 * used to attach runtime counters, and the row estimate the planner used.
 */
public abstract class PhysicalPlan {

    private final int id;
    private final List<PhysicalPlan> children;
    private final StructType schema;
    private final OptionalLong estimatedRows;

    protected PhysicalPlan(int id, List<PhysicalPlan> children, StructType schema, OptionalLong estimatedRows) {
        this.id = id;
        this.children = new ArrayList<>(Objects.requireNonNull(children, "children must not be null"));
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.estimatedRows = Objects.requireNonNull(estimatedRows, "estimatedRows must not be null");
    }

    public int id() {
        return id;
    }

    public List<PhysicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    public PhysicalPlan child() {
        return children.get(0);
    }

    public StructType schema() {
        return schema;
    }

    public OptionalLong estimatedRows() {
        return estimatedRows;
    }

    /**
     * Returns how this node's output is spread over partitions.
     *
     * @return the output partitioning
     */
    public abstract Partitioning outputPartitioning();

    public String nodeName() {
        return getClass().getSimpleName();
    }

    /**
     * Returns the node's parameters for plan descriptions, without the node name.
     *
     * @return the argument text, possibly empty
     */
    protected abstract String argumentString();

    /**
     * Returns all nodes of this tree in pre-order.
     *
     * @return the nodes
     */
    public List<PhysicalPlan> collectNodes() {
        List<PhysicalPlan> nodes = new ArrayList<>();
        collect(this, nodes);
        return nodes;
    }

    private static void collect(PhysicalPlan node, List<PhysicalPlan> out) {
        out.add(node);
        for (PhysicalPlan child : node.children) {
            collect(child, out);
        }
    }

    /**
     * Returns a label naming this node and its id, for error messages.
     *
     * @return the label
     */
    public String label() {
        return nodeName() + "#" + id;
    }

    @Override
    public String toString() {
        String args = argumentString();
        return args.isEmpty() ? label() : label() + "(" + args + ")";
    }
}
