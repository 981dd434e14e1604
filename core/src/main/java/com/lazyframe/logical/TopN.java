package com.lazyframe.logical;

import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The first {@code limit} rows by a sort order, either globally or within
 * each group of partition keys.
 *
 * <p>Produced by the optimizer from {@code Limit(Sort(x))} and from a
 * row-number window followed by a rank filter. In the second form a rank
 * column holding the 1-based position inside the group is appended to the
 * output.
 */
public final class TopN extends LogicalPlan {

    private final List<SortOrder> sortOrders;
    private final long limit;
    private final List<String> partitionKeys;
    private final String rankColumn;

    /**
     * Creates a top-N node.
     *
     * @param child the child node
     * @param sortOrders the ordering that defines "top"
     * @param limit rows kept per group (or overall when there are no partition keys)
     * @param partitionKeys the grouping columns, empty for a global top-N
     * @param rankColumn the name of the appended rank column, or null for none
     */
    public TopN(LogicalPlan child, List<SortOrder> sortOrders, long limit,
                List<String> partitionKeys, String rankColumn) {
        super(Objects.requireNonNull(child, "child must not be null"));
        this.sortOrders = List.copyOf(Objects.requireNonNull(sortOrders, "sortOrders must not be null"));
        this.partitionKeys = List.copyOf(Objects.requireNonNull(partitionKeys, "partitionKeys must not be null"));
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + limit);
        }
        this.limit = limit;
        this.rankColumn = rankColumn;
    }

    public TopN(LogicalPlan child, List<SortOrder> sortOrders, long limit) {
        this(child, sortOrders, limit, List.of(), null);
    }

    public List<SortOrder> sortOrders() {
        return sortOrders;
    }

    public long limit() {
        return limit;
    }

    public List<String> partitionKeys() {
        return partitionKeys;
    }

    public String rankColumn() {
        return rankColumn;
    }

    public boolean isGlobal() {
        return partitionKeys.isEmpty();
    }

    public LogicalPlan child() {
        return children.get(0);
    }

    @Override
    protected StructType inferSchema() {
        StructType childSchema = child().schema();
        if (rankColumn == null) {
            return childSchema;
        }
        List<StructField> fields = new ArrayList<>(childSchema.fields());
        fields.add(new StructField(rankColumn, LongType.get(), false));
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new TopN(newChildren.get(0), sortOrders, limit, partitionKeys, rankColumn);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TopN)) return false;
        TopN that = (TopN) obj;
        return limit == that.limit && sortOrders.equals(that.sortOrders)
            && partitionKeys.equals(that.partitionKeys) && Objects.equals(rankColumn, that.rankColumn)
            && child().equals(that.child());
    }

    @Override
    public int hashCode() {
        return Objects.hash(sortOrders, limit, partitionKeys, rankColumn, child());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TopN(").append(limit).append(", ").append(sortOrders);
        if (!partitionKeys.isEmpty()) {
            sb.append(", partitionBy=").append(partitionKeys);
        }
        if (rankColumn != null) {
            sb.append(", rank=").append(rankColumn);
        }
        return sb.append(')').toString();
    }
}
