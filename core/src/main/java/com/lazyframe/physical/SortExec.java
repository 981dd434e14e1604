package com.lazyframe.physical;

import com.lazyframe.logical.Sort.SortOrder;
import java.util.List;
import java.util.OptionalLong;

public final class SortExec extends PhysicalPlan {

    private final List<SortOrder> sortOrders;

    public SortExec(int id, PhysicalPlan child, List<SortOrder> sortOrders, OptionalLong estimatedRows) {
        super(id, List.of(child), child.schema(), estimatedRows);
        this.sortOrders = List.copyOf(sortOrders);
    }

    public List<SortOrder> sortOrders() {
        return sortOrders;
    }

    @Override
    public Partitioning outputPartitioning() {
        return child().outputPartitioning();
    }

    @Override
    protected String argumentString() {
        return sortOrders.toString();
    }
}
