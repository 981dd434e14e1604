package com.lazyframe.runtime.operator;

import com.lazyframe.data.GroupKey;
import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.physical.HashJoinExec.BuildSide;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Equi-join: loads the build side into a hash table on open, then streams
 * the probe side through it batch by batch.
 *
 * <p>Rows with a null in any key column never match. Output rows are the
 * left columns followed by the right columns, minus the merged right keys.
 * Semi and anti joins output left rows only. Building on the left is only
 * supported for inner joins.
 *
 * <p>A join over a broadcast is created with {@link #probing}, which takes a
 * table built once for the whole run instead of building one per partition.
 */
public final class HashJoinOperator implements Operator {

    private final Operator left;
    private final Operator right;
    private final BuildSide buildSide;
    private final JoinType joinType;
    private final int[] leftKeyOrdinals;
    private final int[] rightKeyOrdinals;
    private final int[] rightOutputOrdinals;
    private final StructType schema;
    private final JoinHashTable sharedTable;
    private JoinHashTable table;

    public HashJoinOperator(Operator left, Operator right, List<String> leftKeys, List<String> rightKeys,
                            JoinType joinType, Set<String> mergedRightKeys, BuildSide buildSide,
                            StructType schema) {
        this(left, right, left.schema(), right.schema(), null, leftKeys, rightKeys, joinType, mergedRightKeys,
            buildSide, schema);
    }

    private HashJoinOperator(Operator left, Operator right, StructType leftSchema, StructType rightSchema,
                             JoinHashTable sharedTable, List<String> leftKeys, List<String> rightKeys,
                             JoinType joinType, Set<String> mergedRightKeys, BuildSide buildSide,
                             StructType schema) {
        if (buildSide == BuildSide.LEFT && joinType != JoinType.INNER) {
            throw new IllegalArgumentException("Left build side is only supported for inner joins, got "
                + joinType);
        }
        this.left = left;
        this.right = right;
        this.buildSide = buildSide;
        this.joinType = joinType;
        this.schema = schema;
        this.sharedTable = sharedTable;
        this.leftKeyOrdinals = JoinHashTable.keyOrdinals(leftSchema, leftKeys);
        this.rightKeyOrdinals = JoinHashTable.keyOrdinals(rightSchema, rightKeys);
        List<Integer> outputs = new ArrayList<>();
        if (joinType.outputsRight()) {
            for (int i = 0; i < rightSchema.size(); i++) {
                if (!mergedRightKeys.contains(rightSchema.fieldAt(i).name())) {
                    outputs.add(i);
                }
            }
        }
        this.rightOutputOrdinals = outputs.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Creates a join that probes an already-built table. The table is only
     * read, so several operators may share it.
     *
     * @param probe the streamed side
     * @param table the build side, keyed on the build keys
     * @param leftKeys the left key names
     * @param rightKeys the right key names
     * @param joinType the join type
     * @param mergedRightKeys right keys left out of the output
     * @param buildSide which side the table was built from
     * @param schema the output schema
     * @return the operator
     */
    public static HashJoinOperator probing(Operator probe, JoinHashTable table, List<String> leftKeys,
                                           List<String> rightKeys, JoinType joinType, Set<String> mergedRightKeys,
                                           BuildSide buildSide, StructType schema) {
        Objects.requireNonNull(table, "table must not be null");
        if (buildSide == BuildSide.RIGHT) {
            return new HashJoinOperator(probe, null, probe.schema(), table.schema(), table, leftKeys, rightKeys,
                joinType, mergedRightKeys, buildSide, schema);
        }
        return new HashJoinOperator(null, probe, table.schema(), probe.schema(), table, leftKeys, rightKeys,
            joinType, mergedRightKeys, buildSide, schema);
    }

    @Override
    public void open() {
        if (sharedTable != null) {
            table = sharedTable;
        } else {
            Operator build = buildSide == BuildSide.RIGHT ? right : left;
            table = JoinHashTable.build(build, buildSide == BuildSide.RIGHT ? rightKeyOrdinals : leftKeyOrdinals);
        }
        probe().open();
    }

    private Operator probe() {
        return buildSide == BuildSide.RIGHT ? left : right;
    }

    @Override
    public RowBatch next() {
        Operator probe = probe();
        int[] probeOrdinals = buildSide == BuildSide.RIGHT ? leftKeyOrdinals : rightKeyOrdinals;
        RowBatch batch;
        while ((batch = probe.next()) != null) {
            List<Row> out = new ArrayList<>();
            for (Row row : batch) {
                GroupKey key = GroupKey.of(row, probeOrdinals);
                List<Row> matches = table.matches(key);
                if (buildSide == BuildSide.LEFT) {
                    for (Row match : matches) {
                        out.add(combine(match, row));
                    }
                    continue;
                }
                switch (joinType) {
                    case INNER:
                        for (Row match : matches) {
                            out.add(combine(row, match));
                        }
                        break;
                    case LEFT:
                        if (matches.isEmpty()) {
                            out.add(combine(row, null));
                        } else {
                            for (Row match : matches) {
                                out.add(combine(row, match));
                            }
                        }
                        break;
                    case LEFT_SEMI:
                        if (!matches.isEmpty()) {
                            out.add(row);
                        }
                        break;
                    default:
                        if (matches.isEmpty()) {
                            out.add(row);
                        }
                }
            }
            if (!out.isEmpty()) {
                return RowBatch.adopt(schema, out);
            }
        }
        return null;
    }

    private Row combine(Row leftRow, Row rightRow) {
        int leftWidth = leftRow.size();
        Object[] values = new Object[leftWidth + rightOutputOrdinals.length];
        for (int i = 0; i < leftWidth; i++) {
            values[i] = leftRow.get(i);
        }
        if (rightRow != null) {
            for (int i = 0; i < rightOutputOrdinals.length; i++) {
                values[leftWidth + i] = rightRow.get(rightOutputOrdinals[i]);
            }
        }
        return Row.wrap(values);
    }

    @Override
    public void close() {
        table = null;
        probe().close();
    }

    @Override
    public StructType schema() {
        return schema;
    }
}
