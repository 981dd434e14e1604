package com.lazyframe.physical;

import com.lazyframe.api.DataFrame;
import com.lazyframe.api.QueryEngine;
import com.lazyframe.data.Row;
import com.lazyframe.exception.BroadcastSizeExceededException;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.Join.JoinHint;
import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.physical.JoinStrategySelector.Strategy;
import com.lazyframe.source.InMemorySource;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JoinStrategySelector} and {@link SizeEstimator}.
 *
 * <p>The population table is six rows of (string, long), estimated at
 * 6 * (20 + 8) = 168 bytes.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("JoinStrategySelector Tests")
public class JoinStrategySelectorTest extends TestBase {

    private static final long POPULATION_BYTES = 168;

    private final StructType populationSchema = schema(field("state", StringType.get()), field("pop", LongType.get()));
    private final StructType casesSchema = schema(
        field("state", StringType.get()), field("county", StringType.get()), field("cases", LongType.get()));

    private QueryEngine engine;
    private InMemorySource population;
    private InMemorySource cases;

    @Override
    protected void doSetUp() {
        engine = engine(2);
        population = source("population", populationSchema,
            row("Ohio", 1L), row("Utah", 2L), row("Iowa", 3L),
            row("Maine", 4L), row("Texas", 5L), row("Idaho", 6L));
        Row[] counties = new Row[20];
        for (int i = 0; i < counties.length; i++) {
            counties[i] = row("Ohio", "c" + i, (long) i);
        }
        cases = source("cases", casesSchema, counties);
    }

    private Join join(InMemorySource left, InMemorySource right, JoinType type, JoinHint hint) {
        DataFrame joined = engine.read(left).join(engine.read(right), List.of("state"), type, hint);
        return (Join) joined.logicalPlan();
    }

    @Nested
    @DisplayName("Size Estimates")
    class Estimates {

        @Test
        @DisplayName("Scan estimate is rows times row width")
        void testScanEstimate() {
            Join join = join(cases, population, JoinType.INNER, JoinHint.NONE);

            assertThat(SizeEstimator.estimatedRows(join.right())).isEqualTo(OptionalLong.of(6));
            assertThat(SizeEstimator.estimatedSizeInBytes(join.right())).isEqualTo(OptionalLong.of(POPULATION_BYTES));
        }

        @Test
        @DisplayName("Source without statistics has an unknown estimate")
        void testUnknown() {
            Join join = join(cases, population.withoutStatistics(), JoinType.INNER, JoinHint.NONE);

            assertThat(SizeEstimator.estimatedSizeInBytes(join.right())).isEmpty();
            assertThat(SizeEstimator.estimatedRows(join)).isEmpty();
        }

        @Test
        @DisplayName("Limit caps the estimate even over an unknown input")
        void testLimitCap() {
            DataFrame limited = engine.read(cases.withoutStatistics()).limit(5);

            assertThat(SizeEstimator.estimatedRows(limited.logicalPlan())).isEqualTo(OptionalLong.of(5));
        }
    }

    @ParameterizedTest(name = "threshold {0} -> {1}")
    @DisplayName("Broadcast exactly at the threshold, shuffle one byte below")
    @CsvSource({
        "168, BROADCAST_RIGHT",
        "167, SHUFFLE",
        "0, SHUFFLE",
        "1000000, BROADCAST_RIGHT"
    })
    void testThreshold(long threshold, Strategy expected) {
        JoinStrategySelector selector = new JoinStrategySelector(threshold);

        assertThat(selector.select(join(cases, population, JoinType.INNER, JoinHint.NONE), true))
            .isEqualTo(expected);
    }

    @Test
    @DisplayName("Unknown size is never broadcast automatically")
    void testUnknownSizeShuffles() {
        JoinStrategySelector selector = new JoinStrategySelector(Long.MAX_VALUE);
        Join join = join(cases.withoutStatistics(), population.withoutStatistics(), JoinType.INNER, JoinHint.NONE);

        assertThat(selector.select(join, true)).isEqualTo(Strategy.SHUFFLE);
    }

    @Test
    @DisplayName("Smaller INNER side is broadcast")
    void testSmallerSide() {
        JoinStrategySelector selector = new JoinStrategySelector(1_000_000);

        assertThat(selector.select(join(population, cases, JoinType.INNER, JoinHint.NONE), true))
            .isEqualTo(Strategy.BROADCAST_LEFT);
    }

    @Test
    @DisplayName("Non-INNER joins only broadcast the right side")
    void testLeftJoinNeverBroadcastsLeft() {
        JoinStrategySelector selector = new JoinStrategySelector(POPULATION_BYTES);

        assertThat(selector.select(join(population, cases, JoinType.LEFT, JoinHint.NONE), true))
            .isEqualTo(Strategy.SHUFFLE);
    }

    @Test
    @DisplayName("Without cost-based selection every unhinted join shuffles")
    void testNotCostBased() {
        JoinStrategySelector selector = new JoinStrategySelector(1_000_000);

        assertThat(selector.select(join(cases, population, JoinType.INNER, JoinHint.NONE), false))
            .isEqualTo(Strategy.SHUFFLE);
    }

    @Nested
    @DisplayName("Hints")
    class Hints {

        @Test
        @DisplayName("Shuffle hint wins over a small side")
        void testShuffleHint() {
            JoinStrategySelector selector = new JoinStrategySelector(1_000_000);

            assertThat(selector.select(join(cases, population, JoinType.INNER, JoinHint.SHUFFLE), true))
                .isEqualTo(Strategy.SHUFFLE);
        }

        @Test
        @DisplayName("Broadcast hint of an unknown side is honored")
        void testBroadcastHintUnknown() {
            JoinStrategySelector selector = new JoinStrategySelector(10);
            Join join = join(cases, population.withoutStatistics(), JoinType.INNER, JoinHint.BROADCAST_RIGHT);

            assertThat(selector.select(join, false)).isEqualTo(Strategy.BROADCAST_RIGHT);
        }

        @Test
        @DisplayName("Broadcast hint of a side known to be too large fails")
        void testBroadcastHintTooLarge() {
            JoinStrategySelector selector = new JoinStrategySelector(POPULATION_BYTES - 1);
            Join join = join(cases, population, JoinType.INNER, JoinHint.BROADCAST_RIGHT);

            assertThatThrownBy(() -> selector.select(join, true))
                .isInstanceOf(BroadcastSizeExceededException.class)
                .satisfies(e -> assertThat(((BroadcastSizeExceededException) e).sizeInBytes())
                    .isEqualTo(POPULATION_BYTES));
        }
    }
}
