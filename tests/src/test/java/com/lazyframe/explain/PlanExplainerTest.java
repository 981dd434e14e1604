package com.lazyframe.explain;

import com.lazyframe.api.DataFrame;
import com.lazyframe.api.QueryEngine;
import com.lazyframe.api.QueryExecution;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lazyframe.api.functions.col;
import static com.lazyframe.api.functions.max;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PlanExplainer} and {@link PlanDescription}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PlanExplainer Tests")
public class PlanExplainerTest extends TestBase {

    private QueryEngine engine;
    private DataFrame query;

    @Override
    protected void doSetUp() {
        engine = engine(2);
        DataFrame cases = engine.read(source("cases",
            schema(field("state", StringType.get()), field("cases", LongType.get())), 2,
            row("Ohio", 1L), row("Utah", 5L), row("Ohio", 9L)));
        DataFrame population = engine.read(source("population",
            schema(field("state", StringType.get()), field("pop", LongType.get())),
            row("Ohio", 100L), row("Utah", 50L)));
        query = cases.groupBy("state").agg(max(col("cases")).as("max_cases")).join(population, "state");
    }

    @Test
    @DisplayName("Optimized plan has one shuffle and one broadcast")
    void testOptimizedCounts() {
        PlanDescription description = query.explain();

        assertThat(description.shuffleCount()).isEqualTo(1);
        assertThat(description.broadcastCount()).isEqualTo(1);
        assertThat(description.exchangeCount()).isEqualTo(2);
        assertThat(description.find("BroadcastHashJoinExec").depth()).isZero();
    }

    @Test
    @DisplayName("Unoptimized plan shuffles both join sides")
    void testUnoptimizedCounts() {
        PlanDescription description = query.materialize(false).explain();

        assertThat(description.broadcastCount()).isZero();
        assertThat(description.shuffleCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Actual row counts appear after execution")
    void testActualRows() {
        QueryExecution execution = query.materialize();

        assertThat(execution.explain().find("ScanExec").actualRowsOut()).isEmpty();
        execution.collect();
        PlanDescription description = execution.explain();

        assertThat(description.find("BroadcastHashJoinExec").actualRowsOut()).hasValue(2);
        assertThat(description.find("HashAggregateExec").actualRowsIn()).hasValue(3);
        assertThat(description.toString()).contains("boundary=BROADCAST").contains("out=2");
    }

    @Test
    @DisplayName("Logical explain marks repartitions as shuffle boundaries")
    void testLogical() {
        DataFrame df = query.repartition("state");

        PlanDescription description = df.materialize(false).explainLogical();

        assertThat(description.nodes().get(0).operator()).isEqualTo("Repartition");
        assertThat(description.shuffleCount()).isEqualTo(1);
        assertThat(description.nodes().get(0).partitioning()).isEqualTo("-");
    }

    @Test
    @DisplayName("Unknown operator lookup fails")
    void testFindMissing() {
        assertThatThrownBy(() -> query.explain().find("SortExec"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Rendering indents children under their parent")
    void testRendering() {
        String text = query.explain().toString();

        assertThat(text.lines().findFirst()).hasValueSatisfying(line -> assertThat(line).startsWith("BroadcastHashJoinExec"));
        assertThat(text).contains("  ");
    }
}
