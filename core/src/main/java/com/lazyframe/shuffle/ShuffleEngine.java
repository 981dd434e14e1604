package com.lazyframe.shuffle;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.BroadcastSizeExceededException;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redistributes partitioned row batches.
 *
 * <p>Input is a list of partitions, each a list of batches. All operations
 * are deterministic: rows keep their relative order within each output
 * partition (input partition order first, then batch order, then row
 * order), and output batches hold at most {@code batchSize} rows.
 *
 * <p>Example usage:
 * <pre>
 *   ShuffleEngine engine = new ShuffleEngine(4096);
 *   List&lt;List&lt;RowBatch&gt;&gt; out = engine.shuffle(input,
 *       HashPartitionFunction.forKeys(schema, List.of("state")), 8);
 * </pre>
 */
public final class ShuffleEngine {

    private static final Logger logger = LoggerFactory.getLogger(ShuffleEngine.class);

    private final int batchSize;

    public ShuffleEngine(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    /**
     * Routes every row to the partition chosen by {@code function}.
     *
     * @param input the input partitions
     * @param function the partition function
     * @param numPartitions the number of output partitions
     * @return exactly {@code numPartitions} output partitions
     */
    public List<List<RowBatch>> shuffle(List<List<RowBatch>> input, PartitionFunction function,
                                        int numPartitions) {
        Objects.requireNonNull(function, "function must not be null");
        checkPartitionCount(numPartitions);
        StructType schema = schemaOf(input);
        List<RowBatch.Builder> builders = builders(schema, numPartitions);
        for (List<RowBatch> partition : input) {
            for (RowBatch batch : partition) {
                for (Row row : batch) {
                    builders.get(function.partition(row, numPartitions)).add(row);
                }
            }
        }
        return finish(builders);
    }

    /**
     * Deals rows to output partitions in turn.
     *
     * @param input the input partitions
     * @param numPartitions the number of output partitions
     * @return exactly {@code numPartitions} output partitions
     */
    public List<List<RowBatch>> roundRobin(List<List<RowBatch>> input, int numPartitions) {
        checkPartitionCount(numPartitions);
        StructType schema = schemaOf(input);
        List<RowBatch.Builder> builders = builders(schema, numPartitions);
        int next = 0;
        for (List<RowBatch> partition : input) {
            for (RowBatch batch : partition) {
                for (Row row : batch) {
                    builders.get(next).add(row);
                    next = (next + 1) % numPartitions;
                }
            }
        }
        return finish(builders);
    }

    /**
     * Concatenates all partitions into one.
     *
     * @param input the input partitions
     * @return a single output partition
     */
    public List<List<RowBatch>> coalesce(List<List<RowBatch>> input) {
        StructType schema = schemaOf(input);
        RowBatch.Builder builder = RowBatch.builder(schema, batchSize);
        for (List<RowBatch> partition : input) {
            for (RowBatch batch : partition) {
                builder.addAll(batch);
            }
        }
        return Collections.singletonList(builder.build());
    }

    /**
     * Materializes every row once for sharing with all consumers.
     *
     * @param input the input partitions
     * @param maxBytes the largest allowed size, rows times estimated row width
     * @return an unmodifiable list of all rows
     * @throws BroadcastSizeExceededException if the data is larger than {@code maxBytes}
     */
    public List<Row> broadcast(List<List<RowBatch>> input, long maxBytes) {
        return broadcast(input, maxBytes, "broadcast");
    }

    /**
     * Materializes every row once, naming {@code node} in the error if the
     * data is too large.
     */
    public List<Row> broadcast(List<List<RowBatch>> input, long maxBytes, String node) {
        List<Row> rows = new ArrayList<>();
        long bytes = 0;
        for (List<RowBatch> partition : input) {
            for (RowBatch batch : partition) {
                rows.addAll(batch.rows());
                bytes += batch.estimatedSizeInBytes();
                if (bytes > maxBytes) {
                    throw new BroadcastSizeExceededException(node, bytes, maxBytes);
                }
            }
        }
        logger.debug("Broadcast {} rows ({} bytes) for {}", rows.size(), bytes, node);
        return Collections.unmodifiableList(rows);
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Returns the estimated size of partitioned data, rows times estimated row width.
     *
     * @param partitions the data
     * @return the size in bytes
     */
    public static long sizeInBytes(List<List<RowBatch>> partitions) {
        long bytes = 0;
        for (List<RowBatch> partition : partitions) {
            for (RowBatch batch : partition) {
                bytes += batch.estimatedSizeInBytes();
            }
        }
        return bytes;
    }

    private List<RowBatch.Builder> builders(StructType schema, int numPartitions) {
        List<RowBatch.Builder> builders = new ArrayList<>(numPartitions);
        for (int i = 0; i < numPartitions; i++) {
            builders.add(RowBatch.builder(schema, batchSize));
        }
        return builders;
    }

    private static List<List<RowBatch>> finish(List<RowBatch.Builder> builders) {
        List<List<RowBatch>> output = new ArrayList<>(builders.size());
        for (RowBatch.Builder builder : builders) {
            output.add(builder.build());
        }
        return output;
    }

    private static StructType schemaOf(List<List<RowBatch>> input) {
        Objects.requireNonNull(input, "input must not be null");
        for (List<RowBatch> partition : input) {
            if (!partition.isEmpty()) {
                return partition.get(0).schema();
            }
        }
        return StructType.EMPTY;
    }

    private static void checkPartitionCount(int numPartitions) {
        if (numPartitions < 1) {
            throw new IllegalArgumentException("numPartitions must be positive: " + numPartitions);
        }
    }
}
