package com.lazyframe.optimizer;

import com.lazyframe.api.DataFrame;
import com.lazyframe.api.QueryEngine;
import com.lazyframe.api.QueryExecution;
import com.lazyframe.data.Row;
import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.physical.HashJoinExec;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.lazyframe.api.functions.col;
import static org.assertj.core.api.Assertions.*;

/**
 * Runs filtered joins in both planning modes and compares how many rows
 * reach the join, next to the results.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("Filter Pushdown Execution Tests")
public class FilterPushdownExecutionTest extends TestBase {

    private final StructType casesSchema = schema(field("state", StringType.get()), field("cases", LongType.get()));
    private final StructType populationSchema = schema(
        field("state", StringType.get()), field("population", LongType.get()));

    private QueryEngine engine;
    private DataFrame cases;
    private DataFrame population;

    @Override
    protected void doSetUp() {
        engine = engine(3);
        cases = engine.read(source("cases", casesSchema, 2,
            row("Ohio", 10L), row("Ohio", 2L), row("Utah", 4L), row("Utah", 8L),
            row("Iowa", 1L), row("Texas", 12L), row("Ohio", 6L), row("Iowa", 9L)));
        population = engine.read(source("population", populationSchema, 2,
            row("Ohio", 11_800_000L), row("Utah", 3_300_000L), row("Iowa", 3_200_000L), row("Maine", 500L)));
    }

    private DataFrame query(JoinType joinType) {
        return cases.join(population, List.of("state"), joinType)
            .filter(col("cases").gt(5L).and(col("population").gt(1000L)));
    }

    private static long rowsIntoJoin(QueryExecution execution) {
        HashJoinExec join = execution.physicalPlan().collectNodes().stream()
            .filter(HashJoinExec.class::isInstance).map(HashJoinExec.class::cast)
            .findFirst().orElseThrow();
        return execution.lastStats().stage(join.id()).rowsIn();
    }

    @ParameterizedTest(name = "{0} join")
    @EnumSource(value = JoinType.class, names = {"INNER", "LEFT"})
    @DisplayName("Pushed-down filters never let more rows reach the join, and results match")
    void testPushdownReducesJoinInput(JoinType joinType) {
        QueryExecution naive = query(joinType).materialize(false);
        QueryExecution optimized = query(joinType).materialize(true);

        List<Row> naiveRows = naive.collect();
        List<Row> optimizedRows = optimized.collect();

        assertThat(optimizedRows).containsExactlyInAnyOrderElementsOf(naiveRows);
        assertThat(optimizedRows).containsExactlyInAnyOrder(
            row("Ohio", 10L, 11_800_000L), row("Utah", 8L, 3_300_000L),
            row("Ohio", 6L, 11_800_000L), row("Iowa", 9L, 3_200_000L));
        assertThat(rowsIntoJoin(naive)).isEqualTo(8 + 4);
        assertThat(rowsIntoJoin(optimized)).isLessThan(rowsIntoJoin(naive));
    }

    @ParameterizedTest(name = "{0} join")
    @EnumSource(value = JoinType.class, names = {"INNER", "LEFT"})
    @DisplayName("Only the side a join type allows is filtered below the join")
    void testJoinInputPerJoinType(JoinType joinType) {
        QueryExecution optimized = query(joinType).materialize(true);

        optimized.collect();

        // Five cases rows pass; an INNER join also drops Maine on the population side
        long expected = joinType == JoinType.INNER ? 5 + 3 : 5 + 4;
        assertThat(rowsIntoJoin(optimized)).isEqualTo(expected);
    }
}
