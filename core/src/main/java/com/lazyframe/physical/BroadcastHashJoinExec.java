package com.lazyframe.physical;

import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Hash join whose build side is a broadcast exchange. The streamed side keeps
 * its partitioning, so no shuffle of the large input is needed.
 */
public final class BroadcastHashJoinExec extends HashJoinExec {

    private final BuildSide buildSide;

    public BroadcastHashJoinExec(int id, PhysicalPlan left, PhysicalPlan right, List<String> leftKeys,
                                 List<String> rightKeys, JoinType joinType, Set<String> mergedRightKeys,
                                 BuildSide buildSide, StructType schema, OptionalLong estimatedRows) {
        super(id, left, right, leftKeys, rightKeys, joinType, mergedRightKeys, schema, estimatedRows);
        if (buildSide == BuildSide.LEFT && joinType != JoinType.INNER) {
            throw new IllegalArgumentException("Only INNER joins can broadcast the left side");
        }
        this.buildSide = buildSide;
    }

    @Override
    public BuildSide buildSide() {
        return buildSide;
    }

    /**
     * Returns the streamed child.
     *
     * @return the non-broadcast side
     */
    public PhysicalPlan streamed() {
        return buildSide == BuildSide.RIGHT ? left() : right();
    }

    @Override
    public Partitioning outputPartitioning() {
        return streamed().outputPartitioning();
    }
}
