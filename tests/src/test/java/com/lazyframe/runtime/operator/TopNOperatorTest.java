package com.lazyframe.runtime.operator;

import com.lazyframe.data.Row;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.logical.Sort.NullOrdering;
import com.lazyframe.logical.Sort.SortDirection;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the ordering operators: sort, limit, top-N and window.
 */
@TestCategories.Tier1
@TestCategories.Execution
@DisplayName("Ordering Operator Tests")
public class TopNOperatorTest extends TestBase {

    private final StructType input = schema(
        field("state", StringType.get()), field("county", StringType.get()), field("cases", LongType.get()));
    private final StructType ranked = schema(
        field("state", StringType.get()), field("county", StringType.get()), field("cases", LongType.get()),
        required("rn", LongType.get()));
    private final List<SortOrder> casesDesc = List.of(
        new SortOrder(ColumnReference.of("cases", LongType.get()), SortDirection.DESCENDING));

    private Row[] counties() {
        return new Row[] {
            row("Ohio", "a", 5L),
            row("Utah", "b", 9L),
            row("Ohio", "c", 7L),
            row("Ohio", "d", 7L),
            row("Utah", "e", null),
            row("Ohio", "f", 1L),
            row("Utah", "g", 2L)
        };
    }

    @Nested
    @DisplayName("Top-N")
    class TopN {

        @Test
        @DisplayName("Ties keep arrival order, matching a stable sort and cut")
        void testTies() {
            Operator topN = new TopNOperator(operator(input, counties()), casesDesc, 2, List.of("state"),
                true, ranked, 4);

            assertThat(drain(topN)).containsExactly(
                row("Ohio", "c", 7L, 1L),
                row("Ohio", "d", 7L, 2L),
                row("Utah", "b", 9L, 1L),
                row("Utah", "g", 2L, 2L));
        }

        @ParameterizedTest(name = "k = {0}")
        @DisplayName("Per-partition top-N equals the window rows with rank <= k")
        @ValueSource(longs = {1, 2, 3, 10})
        void testMatchesWindow(long k) {
            List<Row> topN = drain(new TopNOperator(operator(input, counties()), casesDesc, k,
                List.of("state"), true, ranked, 3));
            List<Row> window = drain(new WindowOperator(operator(input, counties()), List.of("state"),
                casesDesc, ranked, 3));
            List<Row> expected = new ArrayList<>();
            for (Row row : window) {
                if ((Long) row.get(3) <= k) {
                    expected.add(row);
                }
            }

            assertThat(topN).containsExactlyElementsOf(expected);
        }

        @Test
        @DisplayName("Global top-N without a rank column")
        void testGlobal() {
            Operator topN = new TopNOperator(operator(input, counties()), casesDesc, 3, List.of(), false, input, 4);

            assertThat(column(drain(topN), 1)).containsExactly("b", "c", "d");
        }

        @Test
        @DisplayName("Zero limit emits nothing")
        void testZero() {
            Operator topN = new TopNOperator(operator(input, counties()), casesDesc, 0, List.of(), false, input, 4);

            assertThat(drain(topN)).isEmpty();
        }
    }

    @Test
    @DisplayName("Descending sort puts nulls last by default")
    void testSortNulls() {
        Operator sort = new SortOperator(operator(input, counties()), casesDesc, 4);

        assertThat(column(drain(sort), 1)).containsExactly("b", "c", "d", "a", "g", "f", "e");
    }

    @Test
    @DisplayName("Explicit NULLS FIRST applies regardless of direction")
    void testSortNullsFirst() {
        List<SortOrder> orders = List.of(new SortOrder(ColumnReference.of("cases", LongType.get()),
            SortDirection.DESCENDING, NullOrdering.NULLS_FIRST));

        assertThat(column(drain(new SortOperator(operator(input, counties()), orders, 4)), 1).get(0))
            .isEqualTo("e");
    }

    @Test
    @DisplayName("Limit truncates the batch that crosses the limit")
    void testLimit() {
        List<Row> rows = drain(new LimitOperator(operator(input, counties()), 3));

        assertThat(column(rows, 1)).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("Window numbers every row in the partition")
    void testWindow() {
        List<Row> rows = drain(new WindowOperator(operator(input, counties()), List.of("state"), casesDesc, ranked, 4));

        assertThat(rows).hasSize(7);
        assertThat(rows.get(3)).isEqualTo(row("Ohio", "f", 1L, 4L));
        assertThat(rows.get(6)).isEqualTo(row("Utah", "e", null, 3L));
    }
}
