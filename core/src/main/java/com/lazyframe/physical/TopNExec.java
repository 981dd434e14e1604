package com.lazyframe.physical;

import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;

/**
 * Keeps the top {@code limit} rows per group with a bounded heap. A partial
 * top-N keeps candidates per input partition and never adds the rank column.
 */
public final class TopNExec extends PhysicalPlan {

    private final List<SortOrder> sortOrders;
    private final long limit;
    private final List<String> partitionKeys;
    private final String rankColumn;
    private final boolean partial;

    public TopNExec(int id, PhysicalPlan child, List<SortOrder> sortOrders, long limit,
                    List<String> partitionKeys, String rankColumn, boolean partial,
                    StructType schema, OptionalLong estimatedRows) {
        super(id, List.of(child), schema, estimatedRows);
        this.sortOrders = List.copyOf(sortOrders);
        this.limit = limit;
        this.partitionKeys = List.copyOf(partitionKeys);
        this.rankColumn = rankColumn;
        this.partial = partial;
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

    public boolean isPartial() {
        return partial;
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    protected String argumentString() {
        StringBuilder sb = new StringBuilder().append(limit).append(", ").append(sortOrders);
        if (!partitionKeys.isEmpty()) {
            sb.append(", partitionBy=").append(partitionKeys);
        }
        if (rankColumn != null && !partial) {
            sb.append(", rank=").append(rankColumn);
        }
        if (partial) {
            sb.append(", partial");
        }
        return sb.toString();
    }
}
