package com.lazyframe.runtime.operator;

import com.lazyframe.data.GroupKey;
import com.lazyframe.data.Row;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.physical.HashJoinExec.BuildSide;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HashJoinOperator} across join types, with null keys.
 */
@TestCategories.Tier1
@TestCategories.Execution
@DisplayName("HashJoinOperator Tests")
public class HashJoinOperatorTest extends TestBase {

    private final StructType leftSchema = schema(field("state", StringType.get()), field("cases", LongType.get()));
    private final StructType rightSchema = schema(field("state", StringType.get()), field("pop", LongType.get()));
    private final StructType joinedSchema = schema(
        field("state", StringType.get()), field("cases", LongType.get()), field("pop", LongType.get()));

    private Operator left() {
        return operator(leftSchema, row("Ohio", 1L), row(null, 2L), row("Utah", 3L), row("Iowa", 4L), row("Ohio", 5L));
    }

    private Operator right() {
        return operator(rightSchema, row("Ohio", 100L), row(null, 200L), row("Utah", 300L), row("Utah", 301L));
    }

    private List<Row> join(JoinType type, BuildSide buildSide) {
        StructType schema = type.outputsRight() ? joinedSchema : leftSchema;
        return drain(new HashJoinOperator(left(), right(), List.of("state"), List.of("state"), type,
            Set.of("state"), buildSide, schema));
    }

    @Test
    @DisplayName("INNER: null keys never match, duplicates multiply")
    void testInner() {
        assertThat(join(JoinType.INNER, BuildSide.RIGHT)).containsExactly(
            row("Ohio", 1L, 100L),
            row("Utah", 3L, 300L),
            row("Utah", 3L, 301L),
            row("Ohio", 5L, 100L));
    }

    @Test
    @DisplayName("INNER with the left side built gives the same rows")
    void testInnerBuildLeft() {
        assertThat(sorted(join(JoinType.INNER, BuildSide.LEFT)))
            .isEqualTo(sorted(join(JoinType.INNER, BuildSide.RIGHT)));
    }

    @Test
    @DisplayName("LEFT: unmatched and null-keyed left rows are padded with nulls")
    void testLeft() {
        assertThat(join(JoinType.LEFT, BuildSide.RIGHT)).containsExactly(
            row("Ohio", 1L, 100L),
            row(null, 2L, null),
            row("Utah", 3L, 300L),
            row("Utah", 3L, 301L),
            row("Iowa", 4L, null),
            row("Ohio", 5L, 100L));
    }

    @Test
    @DisplayName("LEFT_SEMI: matched left rows once, left columns only")
    void testSemi() {
        assertThat(join(JoinType.LEFT_SEMI, BuildSide.RIGHT)).containsExactly(
            row("Ohio", 1L), row("Utah", 3L), row("Ohio", 5L));
    }

    @Test
    @DisplayName("LEFT_ANTI: unmatched left rows, including null keys")
    void testAnti() {
        assertThat(join(JoinType.LEFT_ANTI, BuildSide.RIGHT)).containsExactly(
            row(null, 2L), row("Iowa", 4L));
    }

    @Test
    @DisplayName("Building the left side of an outer join is rejected")
    void testLeftBuildOuterRejected() {
        assertThatThrownBy(() -> join(JoinType.LEFT, BuildSide.LEFT))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Integer and long keys of equal value match")
    void testMixedKeyTypes() {
        StructType ints = schema(field("k", IntegerType.get()));
        StructType longs = schema(field("k", LongType.get()), field("v", StringType.get()));
        Operator join = new HashJoinOperator(operator(ints, row(1), row(2)), operator(longs, row(2L, "two")),
            List.of("k"), List.of("k"), JoinType.INNER, Set.of("k"), BuildSide.RIGHT,
            schema(field("k", IntegerType.get()), field("v", StringType.get())));

        assertThat(drain(join)).containsExactly(row(2, "two"));
    }

    @Test
    @DisplayName("One shared table serves several probe partitions without being rebuilt")
    void testSharedTable() {
        JoinHashTable table = JoinHashTable.build(rightSchema,
            List.of(row("Ohio", 100L), row(null, 200L), row("Utah", 300L)), List.of("state"));

        List<Row> first = drain(HashJoinOperator.probing(operator(leftSchema, row("Ohio", 1L), row("Iowa", 4L)),
            table, List.of("state"), List.of("state"), JoinType.LEFT, Set.of("state"), BuildSide.RIGHT,
            joinedSchema));
        List<Row> second = drain(HashJoinOperator.probing(operator(leftSchema, row("Utah", 3L), row(null, 2L)),
            table, List.of("state"), List.of("state"), JoinType.INNER, Set.of("state"), BuildSide.RIGHT,
            joinedSchema));

        assertThat(first).containsExactly(row("Ohio", 1L, 100L), row("Iowa", 4L, null));
        assertThat(second).containsExactly(row("Utah", 3L, 300L));
        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.matches(GroupKey.of(row("Ohio"), new int[] {0}))).containsExactly(row("Ohio", 100L));
    }

    @Test
    @DisplayName("A shared table built on the left probes with right rows")
    void testSharedTableLeftBuild() {
        JoinHashTable table = JoinHashTable.build(leftSchema,
            List.of(row("Ohio", 1L), row("Utah", 3L)), List.of("state"));

        List<Row> rows = drain(HashJoinOperator.probing(right(), table, List.of("state"), List.of("state"),
            JoinType.INNER, Set.of("state"), BuildSide.LEFT, joinedSchema));

        assertThat(rows).containsExactly(row("Ohio", 1L, 100L), row("Utah", 3L, 300L), row("Utah", 3L, 301L));
    }

    @Test
    @DisplayName("Building a shared table on a missing key column fails")
    void testSharedTableMissingKey() {
        assertThatThrownBy(() -> JoinHashTable.build(rightSchema, List.of(row("Ohio", 1L)), List.of("county")))
            .isInstanceOf(SchemaException.class);
    }
}
