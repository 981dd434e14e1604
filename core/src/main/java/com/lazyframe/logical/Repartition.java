package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Objects;

/**
 * User-requested redistribution of rows, either by hashing key columns or
 * round-robin into a fixed number of partitions.
 *
 * <p>A partition count of 0 means "use the engine default".
 */
public final class Repartition extends LogicalPlan {

    private final List<String> keys;
    private final int numPartitions;

    public Repartition(LogicalPlan child, List<String> keys, int numPartitions) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.keys = List.copyOf(Objects.requireNonNull(keys, "keys must not be null"));
        if (numPartitions < 0) {
            throw new IllegalArgumentException("numPartitions must be non-negative: " + numPartitions);
        }
        if (this.keys.isEmpty() && numPartitions == 0) {
            throw new IllegalArgumentException("Round-robin repartition requires a partition count");
        }
        StructType childSchema = child.schema();
        for (String key : this.keys) {
            if (!childSchema.contains(key)) {
                throw SchemaException.columnNotFound(key, childSchema);
            }
        }
        this.numPartitions = numPartitions;
    }

    public List<String> keys() {
        return keys;
    }

    public int numPartitions() {
        return numPartitions;
    }

    public boolean isHash() {
        return !keys.isEmpty();
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new Repartition(newChildren.get(0), keys, numPartitions);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Repartition)) return false;
        Repartition that = (Repartition) obj;
        return numPartitions == that.numPartitions && keys.equals(that.keys) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, numPartitions, child());
    }

    @Override
    public String toString() {
        if (keys.isEmpty()) {
            return "Repartition(" + numPartitions + ")";
        }
        return numPartitions == 0
            ? "Repartition(" + keys + ")"
            : "Repartition(" + keys + ", " + numPartitions + ")";
    }
}
