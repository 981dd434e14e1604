package com.lazyframe.shuffle;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.BroadcastSizeExceededException;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ShuffleEngine} and {@link HashPartitionFunction}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ShuffleEngine Tests")
public class ShuffleEngineTest extends TestBase {

    private final StructType schema = schema(field("state", StringType.get()), field("cases", LongType.get()));
    private final ShuffleEngine engine = new ShuffleEngine(3);

    private List<List<RowBatch>> input() {
        List<List<RowBatch>> partitions = new ArrayList<>();
        partitions.add(RowBatch.builder(schema, 2)
            .add(row("Ohio", 1L)).add(row("Utah", 2L)).add(row("Ohio", 3L)).build());
        partitions.add(RowBatch.builder(schema, 2)
            .add(row("Iowa", 4L)).add(row("Ohio", 5L)).add(row(null, 6L)).add(row("Utah", 7L)).build());
        return partitions;
    }

    private static List<Row> rows(List<RowBatch> partition) {
        List<Row> rows = new ArrayList<>();
        for (RowBatch batch : partition) {
            rows.addAll(batch.rows());
        }
        return rows;
    }

    @Nested
    @DisplayName("Hash Shuffle")
    class Hash {

        @Test
        @DisplayName("Equal keys land in the same partition and every row arrives once")
        void testCoLocation() {
            PartitionFunction function = HashPartitionFunction.forKeys(schema, List.of("state"));

            List<List<RowBatch>> output = engine.shuffle(input(), function, 4);

            assertThat(output).hasSize(4);
            int total = 0;
            for (int p = 0; p < output.size(); p++) {
                for (Row row : rows(output.get(p))) {
                    assertThat(function.partition(row, 4)).isEqualTo(p);
                    total++;
                }
            }
            assertThat(total).isEqualTo(7);
        }

        @Test
        @DisplayName("Relative row order is preserved within a partition")
        void testOrderPreserved() {
            PartitionFunction function = HashPartitionFunction.forKeys(schema, List.of("state"));

            List<List<RowBatch>> output = engine.shuffle(input(), function, 4);

            List<Row> ohio = rows(output.get(function.partition(row("Ohio", 0L), 4))).stream()
                .filter(r -> "Ohio".equals(r.get(0)))
                .collect(Collectors.toList());
            assertThat(column(ohio, 1)).containsExactly(1L, 3L, 5L);
        }

        @Test
        @DisplayName("Shuffling twice gives identical output")
        void testDeterministic() {
            PartitionFunction function = HashPartitionFunction.forKeys(schema, List.of("state"));

            List<List<RowBatch>> first = engine.shuffle(input(), function, 5);
            List<List<RowBatch>> second = engine.shuffle(input(), function, 5);

            for (int p = 0; p < 5; p++) {
                assertThat(rows(first.get(p))).isEqualTo(rows(second.get(p)));
            }
        }

        @Test
        @DisplayName("Integer and long keys of equal value hash alike")
        void testNormalizedHash() {
            HashPartitionFunction function = new HashPartitionFunction(new int[] {0});

            assertThat(function.hash(row(7))).isEqualTo(function.hash(row(7L)));
        }

        @Test
        @DisplayName("Output batches respect the batch size")
        void testBatchSize() {
            PartitionFunction single = (row, n) -> 0;

            List<List<RowBatch>> output = engine.shuffle(input(), single, 1);

            assertThat(output.get(0)).allSatisfy(batch -> assertThat(batch.size()).isLessThanOrEqualTo(3));
            assertThat(rows(output.get(0))).hasSize(7);
        }

        @Test
        @DisplayName("Unknown key column is rejected")
        void testUnknownKey() {
            assertThatThrownBy(() -> HashPartitionFunction.forKeys(schema, List.of("county")))
                .isInstanceOf(SchemaException.class);
        }
    }

    @Test
    @DisplayName("Round robin deals rows in turn")
    void testRoundRobin() {
        List<List<RowBatch>> output = engine.roundRobin(input(), 3);

        assertThat(column(rows(output.get(0)), 1)).containsExactly(1L, 4L, 7L);
        assertThat(column(rows(output.get(1)), 1)).containsExactly(2L, 5L);
        assertThat(column(rows(output.get(2)), 1)).containsExactly(3L, 6L);
    }

    @Test
    @DisplayName("Coalesce concatenates partitions in order")
    void testCoalesce() {
        List<List<RowBatch>> output = engine.coalesce(input());

        assertThat(output).hasSize(1);
        assertThat(column(rows(output.get(0)), 1)).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
    }

    @Nested
    @DisplayName("Broadcast")
    class Broadcast {

        @Test
        @DisplayName("Data within the limit is materialized once")
        void testWithinLimit() {
            long size = ShuffleEngine.sizeInBytes(input());

            List<Row> rows = engine.broadcast(input(), size);

            assertThat(rows).hasSize(7);
            assertThat(size).isEqualTo(7L * (20 + 8));
        }

        @Test
        @DisplayName("Data over the limit fails with BroadcastSizeExceededException")
        void testOverLimit() {
            assertThatThrownBy(() -> engine.broadcast(input(), 100, "join#3"))
                .isInstanceOf(BroadcastSizeExceededException.class)
                .hasMessageContaining("join#3");
        }
    }

    @Test
    @DisplayName("Partition count must be positive")
    void testInvalidPartitionCount() {
        assertThatThrownBy(() -> engine.roundRobin(input(), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
