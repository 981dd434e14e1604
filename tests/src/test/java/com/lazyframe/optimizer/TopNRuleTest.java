package com.lazyframe.optimizer;

import com.lazyframe.api.DataFrame;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.TopN;
import com.lazyframe.logical.Window;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.lazyframe.api.functions.col;
import static com.lazyframe.api.functions.lit;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TopNRule}.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("TopN Rule Tests")
public class TopNRuleTest extends TestBase {

    private final TopNRule rule = new TopNRule();
    private DataFrame df;

    @Override
    protected void doSetUp() {
        df = engine(2).read(source("counties",
            schema(field("state", StringType.get()), field("county", StringType.get()), field("cases", LongType.get())),
            row("Ohio", "Franklin", 10L), row("Ohio", "Summit", 7L), row("Utah", "Salt Lake", 4L)));
    }

    @Test
    @DisplayName("Limit over sort becomes a global top-N")
    void testSortLimit() {
        LogicalPlan plan = df.sortLimit(2, col("cases").desc()).logicalPlan();

        LogicalPlan rewritten = rule.apply(plan);

        assertThat(rewritten).isInstanceOf(TopN.class);
        TopN topN = (TopN) rewritten;
        assertThat(topN.limit()).isEqualTo(2);
        assertThat(topN.isGlobal()).isTrue();
        assertThat(topN.rankColumn()).isNull();
    }

    @ParameterizedTest(name = "{0} keeps {1} rank(s)")
    @DisplayName("Rank filters become per-partition top-N")
    @CsvSource({
        "le, 2",
        "lt, 1",
        "eq, 1"
    })
    void testRankFilter(String form, long expected) {
        DataFrame ranked = df.withRowNumber("rn", List.of("state"), col("cases").desc());
        DataFrame filtered;
        switch (form) {
            case "le": filtered = ranked.filter(col("rn").leq(2L)); break;
            case "lt": filtered = ranked.filter(col("rn").lt(2L)); break;
            default: filtered = ranked.filter(col("rn").equalTo(1L)); break;
        }

        LogicalPlan rewritten = rule.apply(filtered.logicalPlan());

        assertThat(rewritten).isInstanceOf(TopN.class);
        TopN topN = (TopN) rewritten;
        assertThat(topN.limit()).isEqualTo(expected);
        assertThat(topN.partitionKeys()).containsExactly("state");
        assertThat(topN.rankColumn()).isEqualTo("rn");
        assertThat(topN.schema()).isEqualTo(filtered.schema());
    }

    @Test
    @DisplayName("Literal on the left is recognised")
    void testFlippedComparison() {
        DataFrame ranked = df.withRowNumber("rn", List.of("state"), col("cases").desc());
        LogicalPlan plan = ranked.filter(lit(3L).geq(col("rn"))).logicalPlan();

        LogicalPlan rewritten = rule.apply(plan);

        assertThat(rewritten).isInstanceOf(TopN.class);
        assertThat(((TopN) rewritten).limit()).isEqualTo(3);
    }

    @Test
    @DisplayName("Other conjuncts stay in a filter above the top-N")
    void testRemainingConjuncts() {
        DataFrame ranked = df.withRowNumber("rn", List.of("state"), col("cases").desc());
        LogicalPlan plan = ranked.filter(col("rn").leq(2L).and(col("cases").gt(5L))).logicalPlan();

        LogicalPlan rewritten = rule.apply(plan);

        assertThat(rewritten).isInstanceOf(Filter.class);
        assertThat(((Filter) rewritten).child()).isInstanceOf(TopN.class);
    }

    @Test
    @DisplayName("rn = 2 and rn > 1 keep the window")
    void testNonPrefixFilters() {
        DataFrame ranked = df.withRowNumber("rn", List.of("state"), col("cases").desc());

        LogicalPlan equalsTwo = rule.apply(ranked.filter(col("rn").equalTo(2L)).logicalPlan());
        LogicalPlan greater = rule.apply(ranked.filter(col("rn").gt(1L)).logicalPlan());

        assertThat(((Filter) equalsTwo).child()).isInstanceOf(Window.class);
        assertThat(((Filter) greater).child()).isInstanceOf(Window.class);
    }

    @Test
    @DisplayName("Rewritten rank filter returns the same rows")
    void testEquivalentResults() {
        DataFrame query = df.withRowNumber("rn", List.of("state"), col("cases").desc())
            .filter(col("rn").leq(1L));

        assertThat(sorted(query.collect(true))).isEqualTo(sorted(query.collect(false)));
        assertThat(sorted(query.collect(true))).containsExactly(
            List.of("Ohio", "Franklin", 10L, 1L),
            List.of("Utah", "Salt Lake", 4L, 1L));
    }
}
