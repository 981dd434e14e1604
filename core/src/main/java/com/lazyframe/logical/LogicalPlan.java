package com.lazyframe.logical;

import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Base class for all logical plan nodes.
 *
 * <p>This represents a node in the deferred query plan tree built by the
 * {@link com.lazyframe.api.DataFrame} API. Each node can have zero or more
 * children and defines a schema (output columns and types).
 *
 * <p>Nodes are immutable. Optimizer rules never modify a node; they build a
 * new tree through {@link #withNewChildren(List)} and the node constructors.
 * Two plans are equal when they have the same shape, the same node
 * parameters and the same sources.
 */
public abstract class LogicalPlan {

    /** Child nodes in the plan tree */
    protected final List<LogicalPlan> children;

    /** Output schema of this node, computed on first access */
    private StructType schema;

    /**
     * Creates a logical plan node with no children.
     */
    protected LogicalPlan() {
        this.children = Collections.emptyList();
    }

    /**
     * Creates a logical plan node with a single child.
     *
     * @param child the child node
     */
    protected LogicalPlan(LogicalPlan child) {
        this.children = Collections.singletonList(child);
    }

    /**
     * Creates a logical plan node with multiple children.
     *
     * @param children the child nodes
     */
    protected LogicalPlan(List<LogicalPlan> children) {
        this.children = new ArrayList<>(children);
    }

    /**
     * Infers the output schema for this logical plan node.
     *
     * @return the output schema
     */
    protected abstract StructType inferSchema();

    /**
     * Returns a copy of this node over different children.
     *
     * @param newChildren the replacement children, same arity as {@link #children()}
     * @return the new node
     */
    public abstract LogicalPlan withNewChildren(List<LogicalPlan> newChildren);

    /**
     * Returns the child nodes of this plan.
     *
     * @return an unmodifiable list of children
     */
    public List<LogicalPlan> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns the output schema of this plan node.
     *
     * @return the output schema
     */
    public StructType schema() {
        if (schema == null) {
            schema = inferSchema();
        }
        return schema;
    }

    /**
     * Returns the operator name shown in plan descriptions.
     *
     * @return the node name
     */
    public String nodeName() {
        return getClass().getSimpleName();
    }

    /**
     * Rewrites this tree bottom-up. Subtrees the rule leaves untouched keep
     * their identity.
     *
     * @param rule the rewrite applied to each node after its children
     * @return the rewritten plan
     */
    public LogicalPlan transformUp(Function<LogicalPlan, LogicalPlan> rule) {
        LogicalPlan withChildren = mapChildren(child -> child.transformUp(rule));
        return rule.apply(withChildren);
    }

    /**
     * Rewrites this tree top-down: the rule runs on a node first, then on the
     * children of whatever it returned.
     *
     * @param rule the rewrite applied to each node before its children
     * @return the rewritten plan
     */
    public LogicalPlan transformDown(Function<LogicalPlan, LogicalPlan> rule) {
        LogicalPlan rewritten = rule.apply(this);
        return rewritten.mapChildren(child -> child.transformDown(rule));
    }

    private LogicalPlan mapChildren(Function<LogicalPlan, LogicalPlan> fn) {
        if (children.isEmpty()) {
            return this;
        }
        List<LogicalPlan> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (LogicalPlan child : children) {
            LogicalPlan mapped = fn.apply(child);
            changed |= mapped != child;
            newChildren.add(mapped);
        }
        return changed ? withNewChildren(newChildren) : this;
    }

    /**
     * Renders the whole tree, one node per line, children indented.
     *
     * @return the tree text
     */
    public String treeString() {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, 0);
        return sb.toString();
    }

    private void appendTree(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(depth == 0 ? "" : "+- ").append(this).append('\n');
        for (LogicalPlan child : children) {
            child.appendTree(sb, depth + 1);
        }
    }

    protected void checkArity(List<LogicalPlan> newChildren) {
        if (newChildren.size() != children.size()) {
            throw new IllegalArgumentException(String.format("%s expects %d children, got %d",
                nodeName(), children.size(), newChildren.size()));
        }
    }

    /**
     * Returns a one-line description of this node (without its children).
     *
     * @return a string representation
     */
    @Override
    public abstract String toString();
}
