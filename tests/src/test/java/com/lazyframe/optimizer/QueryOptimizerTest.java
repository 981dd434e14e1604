package com.lazyframe.optimizer;

import com.lazyframe.api.DataFrame;
import com.lazyframe.exception.OptimizerDivergedException;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.TableScan;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lazyframe.api.functions.col;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the fixed-point loop in {@link QueryOptimizer}.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("QueryOptimizer Tests")
public class QueryOptimizerTest extends TestBase {

    private DataFrame df;

    @Override
    protected void doSetUp() {
        df = engine(2).read(source("cases",
            schema(field("state", StringType.get()), field("cases", LongType.get())),
            row("Ohio", 10L)));
    }

    @Test
    @DisplayName("Default rules reach a fixed point")
    void testFixedPoint() {
        LogicalPlan plan = df.repartition("state").filter(col("cases").gt(1L)).filter(col("state").equalTo("Ohio"))
            .logicalPlan();
        QueryOptimizer optimizer = new QueryOptimizer(10);

        LogicalPlan optimized = optimizer.optimize(plan);

        assertThat(optimizer.optimize(optimized)).isEqualTo(optimized);
        assertThat(optimized.schema()).isEqualTo(plan.schema());
    }

    @Test
    @DisplayName("An unchanged plan stops after one pass")
    void testNoRules() {
        LogicalPlan plan = df.logicalPlan();

        assertThat(new QueryOptimizer(List.of(), 1).optimize(plan)).isSameAs(plan);
    }

    @Test
    @DisplayName("Oscillating rules raise OptimizerDivergedException with the last plan")
    void testDivergence() {
        LogicalPlan plan = df.filter(col("cases").gt(1L)).logicalPlan();
        QueryOptimizer optimizer = new QueryOptimizer(List.of(new FlipFilterRule()), 3);

        assertThatThrownBy(() -> optimizer.optimize(plan))
            .isInstanceOf(OptimizerDivergedException.class)
            .satisfies(e -> {
                OptimizerDivergedException diverged = (OptimizerDivergedException) e;
                assertThat(diverged.passes()).isEqualTo(3);
                assertThat(diverged.lastPlan()).isNotNull();
            });
    }

    @Test
    @DisplayName("maxPasses must be positive")
    void testInvalidPasses() {
        assertThatThrownBy(() -> new QueryOptimizer(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    /** Alternates a filter between its original form and a doubled conjunction. */
    private static final class FlipFilterRule implements OptimizationRule {
        @Override
        public LogicalPlan apply(LogicalPlan plan) {
            Filter filter = (Filter) plan;
            if (filter.child() instanceof TableScan) {
                return new Filter(new Filter(filter.child(), filter.condition()), filter.condition());
            }
            return new Filter(((Filter) filter.child()).child(), filter.condition());
        }
    }
}
