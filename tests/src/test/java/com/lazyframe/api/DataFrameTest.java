package com.lazyframe.api;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.exception.TypeMismatchException;
import com.lazyframe.logical.Join.JoinType;
import com.lazyframe.source.CollectingSink;
import com.lazyframe.source.InMemorySource;
import com.lazyframe.source.Source;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.DateType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.lazyframe.api.functions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the DataFrame builder API.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("DataFrame Tests")
public class DataFrameTest extends TestBase {

    private final StructType casesSchema = schema(
        field("date", DateType.get()), field("state", StringType.get()),
        field("county", StringType.get()), field("cases", LongType.get()));
    private final StructType populationSchema = schema(
        field("state", StringType.get()), field("pop", LongType.get()));

    private QueryEngine engine;
    private DataFrame cases;
    private DataFrame population;

    @Override
    protected void doSetUp() {
        engine = engine(3);
        cases = engine.read(source("cases", casesSchema, 2,
            row(LocalDate.of(2020, 3, 1), "Ohio", "Franklin", 10L),
            row(LocalDate.of(2020, 3, 2), "Ohio", "Summit", 4L),
            row(LocalDate.of(2021, 1, 5), "Ohio", "Franklin", 30L),
            row(LocalDate.of(2020, 4, 1), "Utah", "Salt Lake", 7L),
            row(LocalDate.of(2020, 4, 2), "Iowa", "Polk", null),
            row(LocalDate.of(2020, 5, 9), null, "Unknown", 3L)));
        population = engine.read(source("population", populationSchema,
            row("Ohio", 100L), row("Utah", 50L), row("Texas", 300L)));
    }

    @Nested
    @DisplayName("Build-Time Validation")
    class Validation {

        @Test
        @DisplayName("Unknown column in filter fails while building")
        void testUnknownColumn() {
            assertThatThrownBy(() -> cases.filter(col("deaths").gt(1L)))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("deaths");
        }

        @Test
        @DisplayName("Non-boolean filter fails while building")
        void testNonBooleanFilter() {
            assertThatThrownBy(() -> cases.filter(col("cases").plus(1L)))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Comparing a string with a number fails while building")
        void testIncomparable() {
            assertThatThrownBy(() -> cases.filter(col("state").gt(5L)))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("SUM over a string column fails while building")
        void testSumOfString() {
            assertThatThrownBy(() -> cases.groupBy("state").agg(sum(col("county"))))
                .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Aggregates are only allowed inside agg")
        void testAggregateInSelect() {
            assertThatThrownBy(() -> cases.select(max(col("cases"))))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> cases.groupBy("state").agg(col("cases")))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Unknown grouping key fails while building")
        void testUnknownGroupingKey() {
            assertThatThrownBy(() -> cases.groupBy("region").agg(countStar()))
                .isInstanceOf(SchemaException.class);
        }

        @Test
        @DisplayName("Join producing duplicate non-key column names fails while building")
        void testAmbiguousJoin() {
            DataFrame other = engine.read(source("other",
                schema(field("state", StringType.get()), field("cases", LongType.get()))));

            assertThatThrownBy(() -> cases.join(other, "state"))
                .isInstanceOf(SchemaException.class);
        }

        @Test
        @DisplayName("Nothing runs until an action")
        void testLazy() {
            AtomicInteger scans = new AtomicInteger();
            InMemorySource delegate = source("counted", populationSchema, row("Ohio", 1L));
            Source counted = new Source() {
                @Override
                public String name() {
                    return "counted";
                }

                @Override
                public StructType schema() {
                    return delegate.schema();
                }

                @Override
                public Iterator<RowBatch> scan(StructType requiredSchema) {
                    scans.incrementAndGet();
                    return delegate.scan(requiredSchema);
                }
            };

            DataFrame df = engine.read(counted).filter(col("pop").gt(0L)).select("state");
            df.explain();
            assertThat(scans).hasValue(0);

            assertThat(df.collect()).containsExactly(row("Ohio"));
            assertThat(scans).hasValue(1);
        }
    }

    @Nested
    @DisplayName("Transformations")
    class Transformations {

        @Test
        @DisplayName("withColumn replaces an existing column in place")
        void testWithColumnReplace() {
            DataFrame df = cases.withColumn("cases", coalesce(col("cases"), lit(0L)));

            assertThat(df.schema().fieldNames()).containsExactly("date", "state", "county", "cases");
            assertThat(column(df.collect(), 3)).containsExactlyInAnyOrder(10L, 4L, 30L, 7L, 0L, 3L);
        }

        @Test
        @DisplayName("withColumn appends a new column")
        void testWithColumnAppend() {
            DataFrame df = cases.withColumn("year", year(col("date"))).filter(col("year").equalTo(2021));

            assertThat(df.schema().fieldNames()).containsExactly("date", "state", "county", "cases", "year");
            assertThat(df.collect()).containsExactly(row(LocalDate.of(2021, 1, 5), "Ohio", "Franklin", 30L, 2021));
        }

        @Test
        @DisplayName("Builders never modify the DataFrame they are called on")
        void testImmutability() {
            cases.filter(col("cases").gt(5L)).select("state");

            assertThat(cases.schema()).isEqualTo(casesSchema);
            assertThat(cases.collect()).hasSize(6);
        }

        @Test
        @DisplayName("USING join keeps one key column and drops null keys")
        void testInnerJoin() {
            DataFrame joined = cases.join(population, "state");

            assertThat(joined.schema().fieldNames()).containsExactly("date", "state", "county", "cases", "pop");
            assertThat(column(joined.collect(), 1)).containsOnly("Ohio", "Utah").hasSize(4);
        }

        @Test
        @DisplayName("LEFT join keeps unmatched rows with nullable right columns")
        void testLeftJoin() {
            DataFrame joined = cases.join(population, List.of("state"), JoinType.LEFT);

            assertThat(joined.schema().fieldByName("pop").nullable()).isTrue();
            List<Row> rows = joined.collect();
            assertThat(rows).hasSize(6);
            assertThat(rows).filteredOn(r -> "Iowa".equals(r.get(1))).singleElement()
                .satisfies(r -> assertThat(r.get(4)).isNull());
        }

        @Test
        @DisplayName("Anti join returns left rows without a match")
        void testAntiJoin() {
            DataFrame missing = population.join(cases, List.of("state"), JoinType.LEFT_ANTI);

            assertThat(missing.schema()).isEqualTo(populationSchema);
            assertThat(missing.collect()).containsExactly(row("Texas", 300L));
        }

        @Test
        @DisplayName("sortLimit returns the top rows in order")
        void testSortLimit() {
            List<Row> rows = cases.sortLimit(2, col("cases").desc()).select("county", "cases").collect();

            assertThat(rows).containsExactly(row("Franklin", 30L), row("Franklin", 10L));
        }

        @Test
        @DisplayName("Global aggregate over filtered-out input yields one row")
        void testEmptyGlobalAggregate() {
            List<Row> rows = cases.filter(col("cases").gt(1000L)).agg(countStar().as("n"), max(col("cases")))
                .collect();

            assertThat(rows).containsExactly(row(0L, null));
        }
    }

    @Nested
    @DisplayName("Optimizer Equivalence")
    class Equivalence {

        @Test
        @DisplayName("Optimized and unoptimized runs return the same rows")
        void testEquivalence() {
            DataFrame query = cases.repartition("state")
                .filter(col("cases").isNotNull())
                .withColumn("year", year(col("date")))
                .filter(col("year").equalTo(2020))
                .groupBy("state").agg(max(col("cases")).as("max_cases"), count(col("county")).as("counties"))
                .join(population, "state")
                .withColumn("per_pop", col("max_cases").divide(col("pop")))
                .withRowNumber("rn", List.of(), col("per_pop").desc())
                .filter(col("rn").leq(5L));

            assertThat(sorted(query.collect(true))).isEqualTo(sorted(query.collect(false)));
            assertThat(query.collect()).hasSize(2);
        }

        @Test
        @DisplayName("Results can be written to a sink")
        void testWrite() {
            CollectingSink sink = new CollectingSink();

            cases.select("county").write(sink);

            assertThat(sink.rows()).hasSize(6);
            assertThat(sink.batchCount()).isPositive();
        }
    }
}
