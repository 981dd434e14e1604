package com.lazyframe.physical;

import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;

public final class WindowExec extends PhysicalPlan {

    private final List<String> partitionKeys;
    private final List<SortOrder> orderBy;
    private final String rankColumn;

    public WindowExec(int id, PhysicalPlan child, List<String> partitionKeys, List<SortOrder> orderBy,
                      String rankColumn, StructType schema, OptionalLong estimatedRows) {
        super(id, List.of(child), schema, estimatedRows);
        this.partitionKeys = List.copyOf(partitionKeys);
        this.orderBy = List.copyOf(orderBy);
        this.rankColumn = rankColumn;
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

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    protected String argumentString() {
        return "row_number() AS " + rankColumn + ", partitionBy=" + partitionKeys + ", orderBy=" + orderBy;
    }
}
