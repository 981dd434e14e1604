package com.lazyframe.physical;

import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Hash join over two inputs co-partitioned on their keys. Partition {@code i}
 * of the left side is joined with partition {@code i} of the right side,
 * building on the right.
 */
public final class ShuffleHashJoinExec extends HashJoinExec {

    public ShuffleHashJoinExec(int id, PhysicalPlan left, PhysicalPlan right, List<String> leftKeys,
                               List<String> rightKeys, JoinType joinType, Set<String> mergedRightKeys,
                               StructType schema, OptionalLong estimatedRows) {
        super(id, left, right, leftKeys, rightKeys, joinType, mergedRightKeys, schema, estimatedRows);
    }

    @Override
    public BuildSide buildSide() {
        return BuildSide.RIGHT;
    }

    @Override
    public Partitioning outputPartitioning() {
        return left().outputPartitioning();
    }
}
