package com.lazyframe.physical;

import com.lazyframe.source.Source;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reads a source, one partition per source split.
 */
public final class ScanExec extends PhysicalPlan {

    private final Source source;

    public ScanExec(int id, Source source, StructType requiredSchema, OptionalLong estimatedRows) {
        super(id, List.of(), requiredSchema, estimatedRows);
        this.source = source;
    }

    public Source source() {
        return source;
    }

    @Override
    public Partitioning outputPartitioning() {
        int splits = source.partitionCount();
        return splits == 1 ? SinglePartition.get() : new UnknownPartitioning(splits);
    }

    @Override
    protected String argumentString() {
        return source.name() + ", " + schema().fieldNames();
    }
}
