package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends {@code row_number() OVER (PARTITION BY ... ORDER BY ...)} as a new
 * column. Row numbers start at 1 in every partition.
 */
public final class Window extends LogicalPlan {

    private final List<String> partitionKeys;
    private final List<SortOrder> orderBy;
    private final String rankColumn;

    public Window(LogicalPlan child, List<String> partitionKeys, List<SortOrder> orderBy, String rankColumn) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.partitionKeys = List.copyOf(Objects.requireNonNull(partitionKeys, "partitionKeys must not be null"));
        this.orderBy = List.copyOf(Objects.requireNonNull(orderBy, "orderBy must not be null"));
        this.rankColumn = Objects.requireNonNull(rankColumn, "rankColumn must not be null");
        StructType childSchema = child.schema();
        for (String key : this.partitionKeys) {
            if (!childSchema.contains(key)) {
                throw SchemaException.columnNotFound(key, childSchema);
            }
        }
        if (childSchema.contains(rankColumn)) {
            throw new SchemaException("Column '" + rankColumn + "' already exists", rankColumn);
        }
    }

    public List<String> partitionKeys() {
        return partitionKeys;
    }

    public List<SortOrder> orderBy() {
        return orderBy;
    }

    public String rankColumn() {
        return rankColumn;
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>(child().schema().fields());
        fields.add(new StructField(rankColumn, LongType.get(), false));
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new Window(newChildren.get(0), partitionKeys, orderBy, rankColumn);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Window)) return false;
        Window that = (Window) obj;
        return partitionKeys.equals(that.partitionKeys) && orderBy.equals(that.orderBy)
            && rankColumn.equals(that.rankColumn) && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(partitionKeys, orderBy, rankColumn, child());
    }

    @Override
    public String toString() {
        return String.format("Window(row_number() AS %s, partitionBy=%s, orderBy=%s)",
            rankColumn, partitionKeys, orderBy);
    }
}
