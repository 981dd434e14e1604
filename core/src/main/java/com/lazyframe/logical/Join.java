package com.lazyframe.logical;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.exception.TypeMismatchException;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeInferenceEngine;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Logical plan node representing an equi-join on key columns.
 *
 * <p>The output is every left column followed by every right column, except
 * that a right key column with the same name as its paired left key is
 * emitted only once (USING semantics). {@link JoinType#LEFT_SEMI} and
 * {@link JoinType#LEFT_ANTI} joins output only the left columns. Any other
 * name that appears on both sides is rejected as ambiguous.
 *
 * <p>Null keys never match.
 */
public class Join extends LogicalPlan {

    private final List<String> leftKeys;
    private final List<String> rightKeys;
    private final JoinType joinType;
    private final JoinHint hint;

    /**
     * Creates a join node.
     *
     * @param left the left child
     * @param right the right child
     * @param leftKeys the key columns of the left child
     * @param rightKeys the key columns of the right child, pairwise with {@code leftKeys}
     * @param joinType the join type
     * @param hint the strategy hint
     * @throws SchemaException if a key is missing or the output has ambiguous names
     * @throws TypeMismatchException if paired keys have incompatible types
     */
    public Join(LogicalPlan left, LogicalPlan right, List<String> leftKeys, List<String> rightKeys,
                JoinType joinType, JoinHint hint) {
        super(Arrays.asList(
            Objects.requireNonNull(left, "left must not be null"),
            Objects.requireNonNull(right, "right must not be null")));
        this.leftKeys = List.copyOf(Objects.requireNonNull(leftKeys, "leftKeys must not be null"));
        this.rightKeys = List.copyOf(Objects.requireNonNull(rightKeys, "rightKeys must not be null"));
        this.joinType = Objects.requireNonNull(joinType, "joinType must not be null");
        this.hint = Objects.requireNonNull(hint, "hint must not be null");
        if (hint == JoinHint.BROADCAST_LEFT && joinType != JoinType.INNER) {
            throw new IllegalArgumentException("Only INNER joins can broadcast the left side, got " + joinType);
        }
        validateKeys();
        // Fail at build time on ambiguous output names
        schema();
    }

    /**
     * Creates a join on same-named key columns.
     */
    public Join(LogicalPlan left, LogicalPlan right, List<String> keys, JoinType joinType, JoinHint hint) {
        this(left, right, keys, keys, joinType, hint);
    }

    private void validateKeys() {
        if (leftKeys.isEmpty()) {
            throw new IllegalArgumentException("Join requires at least one key");
        }
        if (leftKeys.size() != rightKeys.size()) {
            throw new IllegalArgumentException(String.format(
                "Join key count mismatch: %s vs %s", leftKeys, rightKeys));
        }
        StructType leftSchema = left().schema();
        StructType rightSchema = right().schema();
        for (int i = 0; i < leftKeys.size(); i++) {
            StructField l = leftSchema.fieldByName(leftKeys.get(i));
            if (l == null) {
                throw SchemaException.columnNotFound(leftKeys.get(i), leftSchema);
            }
            StructField r = rightSchema.fieldByName(rightKeys.get(i));
            if (r == null) {
                throw SchemaException.columnNotFound(rightKeys.get(i), rightSchema);
            }
            if (!TypeInferenceEngine.isComparable(l.dataType(), r.dataType())) {
                throw new TypeMismatchException(String.format("Join keys %s (%s) and %s (%s) are not comparable",
                    l.name(), l.dataType().typeName(), r.name(), r.dataType().typeName()),
                    l.dataType(), r.dataType());
            }
        }
    }

    public LogicalPlan left() {
        return children.get(0);
    }

    public LogicalPlan right() {
        return children.get(1);
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

    public JoinHint hint() {
        return hint;
    }

    /**
     * Returns the right key columns that are folded into the same-named left
     * key in the output.
     *
     * @return the merged right key names
     */
    public Set<String> mergedRightKeys() {
        Set<String> merged = new HashSet<>();
        for (int i = 0; i < leftKeys.size(); i++) {
            if (leftKeys.get(i).equals(rightKeys.get(i))) {
                merged.add(rightKeys.get(i));
            }
        }
        return merged;
    }

    @Override
    protected StructType inferSchema() {
        StructType leftSchema = left().schema();
        if (!joinType.outputsRight()) {
            return leftSchema;
        }
        Set<String> merged = mergedRightKeys();
        List<StructField> fields = new ArrayList<>(leftSchema.fields());
        for (StructField field : right().schema().fields()) {
            if (merged.contains(field.name())) {
                continue;
            }
            if (leftSchema.contains(field.name())) {
                throw new SchemaException("Ambiguous column '" + field.name()
                    + "' appears on both sides of the join", field.name());
            }
            fields.add(joinType == JoinType.LEFT ? field.withNullable(true) : field);
        }
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withNewChildren(List<LogicalPlan> newChildren) {
        checkArity(newChildren);
        return new Join(newChildren.get(0), newChildren.get(1), leftKeys, rightKeys, joinType, hint);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Join)) return false;
        Join that = (Join) obj;
        return joinType == that.joinType && hint == that.hint
            && leftKeys.equals(that.leftKeys) && rightKeys.equals(that.rightKeys)
            && left().equals(that.left()) && right().equals(that.right());
    }

    @Override
    public int hashCode() {
        return Objects.hash(joinType, hint, leftKeys, rightKeys, left(), right());
    }

    @Override
    public String toString() {
        String keys = leftKeys.equals(rightKeys) ? leftKeys.toString() : leftKeys + " = " + rightKeys;
        return hint == JoinHint.NONE
            ? String.format("Join(%s, %s)", joinType, keys)
            : String.format("Join(%s, %s, hint=%s)", joinType, keys, hint);
    }

    /**
     * Supported join types.
     */
    public enum JoinType {
        INNER,
        LEFT,
        LEFT_SEMI,
        LEFT_ANTI;

        /**
         * Returns whether right-side columns appear in the output.
         *
         * @return true for INNER and LEFT
         */
        public boolean outputsRight() {
            return this == INNER || this == LEFT;
        }
    }

    /**
     * User hint for the physical join strategy.
     */
    public enum JoinHint {
        NONE,
        BROADCAST_LEFT,
        BROADCAST_RIGHT,
        SHUFFLE
    }
}
