package com.lazyframe.physical;

import com.lazyframe.api.DataFrame;
import com.lazyframe.api.QueryEngine;
import com.lazyframe.exception.BroadcastSizeExceededException;
import com.lazyframe.logical.Join.JoinHint;
import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.physical.ExchangeExec.Mode;
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lazyframe.api.functions.col;
import static com.lazyframe.api.functions.max;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PhysicalPlanner}: exchange placement, elision and join lowering.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("PhysicalPlanner Tests")
public class PhysicalPlannerTest extends TestBase {

    private QueryEngine engine;
    private DataFrame cases;
    private DataFrame population;

    @Override
    protected void doSetUp() {
        engine = engine(4);
        cases = engine.read(source("cases",
            schema(field("state", StringType.get()), field("county", StringType.get()), field("cases", LongType.get())),
            3,
            row("Ohio", "Franklin", 10L), row("Ohio", "Summit", 7L), row("Utah", "Salt Lake", 4L),
            row("Iowa", "Polk", 2L)));
        population = engine.read(source("population",
            schema(field("state", StringType.get()), field("pop", LongType.get())),
            row("Ohio", 100L), row("Utah", 50L)));
    }

    private PhysicalPlan plan(DataFrame df, boolean optimized) {
        return new PhysicalPlanner(engine.config()).plan(df.logicalPlan(), optimized);
    }

    private static List<ExchangeExec> exchanges(PhysicalPlan plan) {
        return plan.collectNodes().stream()
            .filter(ExchangeExec.class::isInstance)
            .map(ExchangeExec.class::cast)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Aggregate after a matching repartition needs no second exchange")
    void testExchangeElision() {
        DataFrame df = cases.repartition("state").groupBy("state").agg(max(col("cases")).as("max_cases"));

        assertThat(exchanges(plan(df, true))).hasSize(1);
        assertThat(exchanges(plan(df, false))).hasSize(2);
    }

    @Test
    @DisplayName("Aggregate over a multi-partition scan is hash-partitioned on its keys")
    void testAggregateExchange() {
        DataFrame df = cases.groupBy("state").agg(max(col("cases")).as("max_cases"));

        List<ExchangeExec> exchanges = exchanges(plan(df, true));

        assertThat(exchanges).hasSize(1);
        assertThat(exchanges.get(0).mode()).isEqualTo(Mode.HASH);
        assertThat(exchanges.get(0).keys()).containsExactly("state");
        assertThat(exchanges.get(0).numPartitions()).isEqualTo(4);
    }

    @Test
    @DisplayName("Small right side is broadcast in the optimized plan only")
    void testBroadcastJoin() {
        DataFrame df = cases.join(population, "state");

        PhysicalPlan optimized = plan(df, true);
        PhysicalPlan unoptimized = plan(df, false);

        assertThat(optimized).isInstanceOf(BroadcastHashJoinExec.class);
        assertThat(exchanges(optimized)).extracting(ExchangeExec::mode).containsExactly(Mode.BROADCAST);
        assertThat(unoptimized).isInstanceOf(ShuffleHashJoinExec.class);
        assertThat(exchanges(unoptimized)).extracting(ExchangeExec::mode).containsExactly(Mode.HASH, Mode.HASH);
    }

    @Test
    @DisplayName("Shuffle join reuses the left side's partitioning")
    void testShuffleJoinReusesPartitioning() {
        DataFrame df = cases.repartition(3, "state")
            .join(population, List.of("state"), JoinType.INNER, JoinHint.SHUFFLE);

        PhysicalPlan optimized = plan(df, true);

        List<ExchangeExec> exchanges = exchanges(optimized);
        assertThat(exchanges).hasSize(2);
        assertThat(exchanges).allSatisfy(e -> assertThat(e.numPartitions()).isEqualTo(3));
    }

    @Test
    @DisplayName("Global sort gathers into a single partition")
    void testSortGathers() {
        PhysicalPlan plan = plan(cases.orderBy(col("cases").desc()), true);

        assertThat(plan).isInstanceOf(SortExec.class);
        assertThat(exchanges(plan)).extracting(ExchangeExec::mode).containsExactly(Mode.SINGLE);
        assertThat(plan.outputPartitioning().isSingle()).isTrue();
    }

    @Test
    @DisplayName("Node ids are unique within a plan")
    void testUniqueIds() {
        DataFrame df = cases.repartition("state").filter(col("cases").gt(1L))
            .groupBy("state").agg(max(col("cases")).as("max_cases"))
            .join(population, "state");

        List<PhysicalPlan> nodes = plan(df, false).collectNodes();
        Set<Integer> ids = new HashSet<>();
        for (PhysicalPlan node : nodes) {
            ids.add(node.id());
        }

        assertThat(ids).hasSize(nodes.size());
    }

    @Test
    @DisplayName("Forced broadcast over the threshold fails at planning time")
    void testForcedBroadcastTooLarge() {
        QueryEngine tight = new QueryEngine(EngineConfig.builder()
            .defaultPartitionCount(2).broadcastThresholdBytes(10).build());
        DataFrame left = tight.read(source("l", schema(field("k", LongType.get())), row(1L)));
        DataFrame right = tight.read(source("r", schema(field("k", LongType.get())), row(1L), row(2L)));
        DataFrame df = left.join(right, List.of("k"), JoinType.INNER, JoinHint.BROADCAST_RIGHT);

        assertThatThrownBy(() -> new PhysicalPlanner(tight.config()).plan(df.logicalPlan(), true))
            .isInstanceOf(BroadcastSizeExceededException.class);
    }
}
