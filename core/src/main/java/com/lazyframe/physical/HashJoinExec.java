package com.lazyframe.physical;

import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Common shape of the hash join strategies: one side is loaded into a hash
 * table (the build side), the other is streamed through it.
 */
public abstract class HashJoinExec extends PhysicalPlan {

    /**
     * Which child is loaded into the hash table.
     */
    public enum BuildSide {
        LEFT,
        RIGHT
    }

    private final List<String> leftKeys;
    private final List<String> rightKeys;
    private final JoinType joinType;
    private final Set<String> mergedRightKeys;

    protected HashJoinExec(int id, PhysicalPlan left, PhysicalPlan right, List<String> leftKeys,
                           List<String> rightKeys, JoinType joinType, Set<String> mergedRightKeys,
                           StructType schema, OptionalLong estimatedRows) {
        super(id, List.of(left, right), schema, estimatedRows);
        this.leftKeys = List.copyOf(leftKeys);
        this.rightKeys = List.copyOf(rightKeys);
        this.joinType = joinType;
        this.mergedRightKeys = Set.copyOf(mergedRightKeys);
    }

    public PhysicalPlan left() {
        return children().get(0);
    }

    public PhysicalPlan right() {
        return children().get(1);
    }

    public List<String> leftKeys() {
        return leftKeys;
    }

    public List<String> rightKeys() {
        return rightKeys;
    }

    public JoinType joinType() {
        return joinType;
    }

    /**
     * Returns the right key columns omitted from the output because the
     * same-named left key is emitted instead.
     *
     * @return the merged right key names
     */
    public Set<String> mergedRightKeys() {
        return mergedRightKeys;
    }

    public abstract BuildSide buildSide();

    @Override
    protected String argumentString() {
        String keys = leftKeys.equals(rightKeys) ? leftKeys.toString() : leftKeys + " = " + rightKeys;
        return joinType + ", " + keys + ", build=" + buildSide();
    }
}
