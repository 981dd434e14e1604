package com.lazyframe.logical;

import com.lazyframe.source.Source;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Leaf node reading a {@link Source}.
 *
 * <p>The required column list starts as the full source schema and is
 * narrowed by column pruning; the scan's output keeps the source's column
 * order.
 */
public final class TableScan extends LogicalPlan {

    private final Source source;
    private final List<String> requiredColumns;

    public TableScan(Source source) {
        this(source, Objects.requireNonNull(source, "source must not be null").schema().fieldNames());
    }

    public TableScan(Source source, List<String> requiredColumns) {
        super();
        this.source = Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(requiredColumns, "requiredColumns must not be null");
        List<String> ordered = new ArrayList<>();
        for (String name : source.schema().fieldNames()) {
            if (requiredColumns.contains(name)) {
                ordered.add(name);
            }
        }
        if (ordered.size() != requiredColumns.size()) {
            List<String> missing = new ArrayList<>(requiredColumns);
            missing.removeAll(ordered);
            throw new IllegalArgumentException("Source " + source.name() + " has no columns " + missing);
        }
        this.requiredColumns = List.copyOf(ordered);
    }

    public Source source() {
        return source;
    }

    public List<String> requiredColumns() {
        return requiredColumns;
    }

    @Override
    protected StructType inferSchema() {
        return source.schema().select(requiredColumns);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return this;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableScan)) return false;
        TableScan that = (TableScan) obj;
        return source == that.source && requiredColumns.equals(that.requiredColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(source), requiredColumns);
    }

    @Override
    public String toString() {
        return String.format("TableScan(%s, %s)", source.name(), requiredColumns);
    }
}
