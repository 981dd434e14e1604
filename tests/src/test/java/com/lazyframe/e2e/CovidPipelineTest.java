package com.lazyframe.e2e;

import com.lazyframe.api.DataFrame;
import com.lazyframe.api.QueryEngine;
import com.lazyframe.api.QueryExecution;
import com.lazyframe.data.Row;
import com.lazyframe.explain.BoundaryKind;
import com.lazyframe.explain.PlanDescription;
import com.lazyframe.explain.PlanNodeDescription;
import com.lazyframe.physical.FilterExec;
import com.lazyframe.physical.PhysicalPlan;
import com.lazyframe.physical.ScanExec;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.DateType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.lazyframe.api.functions.col;
import static com.lazyframe.api.functions.max;
import static com.lazyframe.api.functions.year;
import static org.assertj.core.api.Assertions.*;

/**
 * Runs a COVID-style reporting pipeline over synthetic county data and
 * checks results, exchange counts and row flow for both planning modes.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("COVID Pipeline End-to-End Tests")
public class CovidPipelineTest extends TestBase {

    private static final String[] STATES = {"CA", "TX", "FL", "NY", "IL", "PA", "OH", "GA", "WA", "AZ"};
    private static final List<String> SELECTED = List.of("CA", "TX", "FL", "NY", "IL", "PA");
    private static final int ROWS = 1200;

    private final StructType countiesSchema = schema(
        field("date", DateType.get()), field("county", StringType.get()), field("state", StringType.get()),
        field("fips", StringType.get()), field("cases", StringType.get()), field("deaths", StringType.get()));
    private final StructType populationSchema = schema(
        required("state", StringType.get()), field("population", LongType.get()));

    private QueryEngine engine;
    private Row[] counties;

    @Override
    protected void doSetUp() {
        engine = engine(4);
        counties = new Row[ROWS];
        LocalDate start = LocalDate.of(2020, 1, 1);
        for (int i = 0; i < ROWS; i++) {
            counties[i] = row(
                start.plusDays((i * 7L) % 700),
                "county-" + (i % 13),
                STATES[i % STATES.length],
                String.format("%05d", i % 97),
                casesText(i),
                i % 41 == 0 ? "" : String.valueOf(i % 17));
        }
    }

    private static String casesText(int i) {
        if (i % 37 == 0) {
            return "";
        }
        if (i % 53 == 0) {
            return "n/a";
        }
        return String.valueOf((i * 31) % 500);
    }

    private DataFrame pipeline() {
        DataFrame raw = engine.read(source("us-counties", countiesSchema, 4, counties));
        DataFrame population = engine.read(source("population", populationSchema,
            row("CA", 39_500_000L), row("TX", 29_000_000L), row("FL", 21_500_000L),
            row("NY", 19_450_000L), row("IL", 12_670_000L), row("PA", 12_800_000L)));

        return raw.repartition("state")
            .filter(col("state").isin(SELECTED.toArray()).and(year(col("date")).equalTo(2020)))
            .withColumn("cases", col("cases").tryCast(LongType.get()))
            .withColumn("deaths", col("deaths").tryCast(LongType.get()))
            .filter(col("cases").geq(10L))
            .groupBy("state").agg(max(col("cases")).as("max_cases"))
            .join(population, "state");
    }

    /** Computes the expected result directly from the generated rows. */
    private List<List<Object>> expected() {
        Map<String, Long> populations = Map.of("CA", 39_500_000L, "TX", 29_000_000L, "FL", 21_500_000L,
            "NY", 19_450_000L, "IL", 12_670_000L, "PA", 12_800_000L);
        Map<String, Long> maxima = new TreeMap<>();
        for (Row row : counties) {
            String state = (String) row.get(2);
            if (!SELECTED.contains(state) || ((LocalDate) row.get(0)).getYear() != 2020) {
                continue;
            }
            Long cases;
            try {
                cases = Long.parseLong(((String) row.get(4)).trim());
            } catch (NumberFormatException e) {
                cases = null;
            }
            if (cases != null && cases >= 10) {
                maxima.merge(state, cases, Math::max);
            }
        }
        List<Row> rows = new ArrayList<>();
        maxima.forEach((state, max) -> rows.add(row(state, max, populations.get(state))));
        return sorted(rows);
    }

    @Test
    @DisplayName("Optimized and unoptimized runs return the expected rows")
    void testResults() {
        DataFrame pipeline = pipeline();

        List<Row> optimized = pipeline.collect(true);
        List<Row> unoptimized = pipeline.collect(false);

        assertThat(sorted(optimized)).isEqualTo(expected());
        assertThat(sorted(unoptimized)).isEqualTo(sorted(optimized));
        assertThat(optimized).hasSize(SELECTED.size());
    }

    @Test
    @DisplayName("Optimized plan has one shuffle and one broadcast; unoptimized has at least four exchanges")
    void testExchangeCounts() {
        DataFrame pipeline = pipeline();

        PlanDescription optimized = pipeline.materialize(true).explain();
        PlanDescription unoptimized = pipeline.materialize(false).explain();

        assertThat(optimized.exchangeCount()).isEqualTo(2);
        assertThat(optimized.shuffleCount()).isEqualTo(1);
        assertThat(optimized.broadcastCount()).isEqualTo(1);
        assertThat(unoptimized.exchangeCount()).isGreaterThanOrEqualTo(4);
        assertThat(unoptimized.broadcastCount()).isZero();
    }

    @Test
    @DisplayName("Filter reads straight from the scan and only filtered rows are shuffled")
    void testRowFlow() {
        QueryExecution execution = pipeline().materialize(true);
        execution.collect();

        PhysicalPlan plan = execution.physicalPlan();
        FilterExec filter = plan.collectNodes().stream()
            .filter(FilterExec.class::isInstance).map(FilterExec.class::cast)
            .findFirst().orElseThrow();
        assertThat(filter.child()).isInstanceOf(ScanExec.class);

        PlanDescription description = execution.explain();
        PlanNodeDescription filterNode = description.find("FilterExec");
        PlanNodeDescription shuffle = description.nodes().stream()
            .filter(node -> node.boundary() == BoundaryKind.SHUFFLE)
            .findFirst().orElseThrow();
        assertThat(filterNode.actualRowsIn()).hasValue(ROWS);
        assertThat(filterNode.actualRowsOut().getAsLong()).isLessThan(ROWS);
        assertThat(shuffle.actualRowsOut()).isEqualTo(filterNode.actualRowsOut());
    }

    @Test
    @DisplayName("Scan reads only the columns the pipeline uses")
    void testScanColumns() {
        PhysicalPlan plan = pipeline().materialize(true).physicalPlan();

        ScanExec scan = plan.collectNodes().stream()
            .filter(ScanExec.class::isInstance).map(ScanExec.class::cast)
            .filter(node -> node.schema().size() > 2)
            .findFirst().orElseThrow();
        assertThat(scan.schema().fieldNames()).containsExactly("date", "state", "cases");
    }
}
