package com.lazyframe.runtime;

import com.lazyframe.data.Row;
import com.lazyframe.data.RowBatch;
import com.lazyframe.exception.QueryExecutionException;
import com.lazyframe.physical.BroadcastHashJoinExec;
import com.lazyframe.physical.ExchangeExec;
import com.lazyframe.physical.FilterExec;
import com.lazyframe.physical.HashAggregateExec;
import com.lazyframe.physical.HashJoinExec;
import com.lazyframe.physical.HashJoinExec.BuildSide;
import com.lazyframe.physical.LimitExec;
import com.lazyframe.physical.PhysicalPlan;
import com.lazyframe.physical.ProjectExec;
import com.lazyframe.physical.ScanExec;
import com.lazyframe.physical.ShuffleHashJoinExec;
import com.lazyframe.physical.SortExec;
import com.lazyframe.physical.TopNExec;
import com.lazyframe.physical.WindowExec;
import com.lazyframe.runtime.operator.FilterOperator;
import com.lazyframe.runtime.operator.HashAggregateOperator;
import com.lazyframe.runtime.operator.HashJoinOperator;
import com.lazyframe.runtime.operator.JoinHashTable;
import com.lazyframe.runtime.operator.LimitOperator;
import com.lazyframe.runtime.operator.MaterializedOperator;
import com.lazyframe.runtime.operator.Operator;
import com.lazyframe.runtime.operator.ProjectOperator;
import com.lazyframe.runtime.operator.ScanOperator;
import com.lazyframe.runtime.operator.SortOperator;
import com.lazyframe.runtime.operator.TopNOperator;
import com.lazyframe.runtime.operator.WindowOperator;
import com.lazyframe.shuffle.HashPartitionFunction;
import com.lazyframe.shuffle.ShuffleEngine;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs physical plans.
 *
 * <p>A plan is cut into stages at its exchanges. Each exchange is a barrier:
 * all partitions of the stage below it are drained in parallel on the run's
 * worker pool, then redistributed once. Nothing runs until the returned
 * {@link ResultStream} is first pulled; the exchanges are materialized then,
 * bottom up, and the final stage streams from the worker pool.
 *
 * <p>Example usage:
 * <pre>
 *   ExecutionContext context = new ExecutionContext(config);
 *   try (ResultStream stream = new Executor().execute(physicalPlan, context)) {
 *       while (stream.hasNext()) {
 *           RowBatch batch = stream.next();
 *       }
 *   }
 * </pre>
 */
public final class Executor {

    private static final Logger logger = LoggerFactory.getLogger(Executor.class);

    /**
     * Prepares a run of a plan. No source is read before the first pull
     * on the returned stream.
     *
     * @param plan the physical plan
     * @param context the run's context, closed by the returned stream
     * @return the result stream
     */
    public ResultStream execute(PhysicalPlan plan, ExecutionContext context) {
        logger.info("Starting run {} for {}", context.runId(), plan.label());
        Run run = new Run(context);
        int partitions = plan.outputPartitioning().numPartitions();
        return new ResultStream(plan, context, () -> run.prepare(plan), p -> run.operator(plan, p, -1),
            partitions);
    }

    /**
     * Materialized exchange output for one run.
     */
    private static final class Run {

        private final ExecutionContext context;
        private final ShuffleEngine shuffle;
        private final Map<Integer, List<List<RowBatch>>> exchanged = new HashMap<>();
        private final Map<Integer, List<Row>> broadcasts = new HashMap<>();
        private final Map<Integer, JoinHashTable> broadcastTables = new HashMap<>();

        Run(ExecutionContext context) {
            this.context = context;
            this.shuffle = context.shuffleEngine();
        }

        void prepare(PhysicalPlan node) {
            for (PhysicalPlan child : node.children()) {
                prepare(child);
            }
            if (node instanceof ExchangeExec) {
                materialize((ExchangeExec) node);
            } else if (node instanceof BroadcastHashJoinExec) {
                buildBroadcastTable((BroadcastHashJoinExec) node);
            }
        }

        /**
         * Hashes a join's broadcast rows once; every probe partition reads the
         * same table. The build rows count once toward the join's input.
         */
        private void buildBroadcastTable(BroadcastHashJoinExec join) {
            boolean buildRight = join.buildSide() == BuildSide.RIGHT;
            ExchangeExec exchange = (ExchangeExec) (buildRight ? join.right() : join.left());
            List<Row> rows = broadcasts.remove(exchange.id());
            if (rows == null) {
                throw new IllegalStateException(exchange.label() + " has not been materialized");
            }
            JoinHashTable table = JoinHashTable.build(exchange.schema(), rows,
                buildRight ? join.rightKeys() : join.leftKeys());
            broadcastTables.put(join.id(), table);
            context.stats().addRowsIn(join.id(), table.rowCount());
            logger.debug("{} built a shared table of {} rows", join.label(), table.rowCount());
        }

        private void materialize(ExchangeExec exchange) {
            context.checkCancelled();
            long start = System.nanoTime();
            PhysicalPlan child = exchange.child();
            List<List<RowBatch>> input = drain(child, exchange.id());
            long rows = 0;
            for (List<RowBatch> partition : input) {
                for (RowBatch batch : partition) {
                    rows += batch.size();
                }
            }
            long bytes = ShuffleEngine.sizeInBytes(input);
            try {
                switch (exchange.mode()) {
                    case BROADCAST:
                        List<Row> all = shuffle.broadcast(input, exchange.maxBroadcastBytes(), exchange.label());
                        broadcasts.put(exchange.id(), all);
                        context.stats().addOutput(exchange.id(), all.size());
                        break;
                    case HASH:
                        record(exchange, shuffle.shuffle(input,
                            HashPartitionFunction.forKeys(child.schema(), exchange.keys()),
                            exchange.numPartitions()));
                        break;
                    case ROUND_ROBIN:
                        record(exchange, shuffle.roundRobin(input, exchange.numPartitions()));
                        break;
                    default:
                        record(exchange, shuffle.coalesce(input));
                }
            } catch (RuntimeException e) {
                throw InstrumentedOperator.attachNode(e, exchange.label());
            }
            context.stats().addShuffle(exchange.id(), rows, bytes);
            context.stats().addElapsedNanos(exchange.id(), System.nanoTime() - start);
            logger.debug("{} moved {} rows ({} bytes) in mode {}", exchange.label(), rows, bytes,
                exchange.mode());
        }

        private void record(ExchangeExec exchange, List<List<RowBatch>> output) {
            for (List<RowBatch> partition : output) {
                for (RowBatch batch : partition) {
                    context.stats().addOutput(exchange.id(), batch.size());
                }
            }
            exchanged.put(exchange.id(), output);
        }

        /**
         * Runs every partition of a stage on the worker pool and collects
         * the batches, in partition order.
         */
        private List<List<RowBatch>> drain(PhysicalPlan stage, int consumerId) {
            int partitions = stage.outputPartitioning().numPartitions();
            List<Future<List<RowBatch>>> futures = new ArrayList<>(partitions);
            for (int p = 0; p < partitions; p++) {
                int partition = p;
                futures.add(context.workers().submit(() -> drainPartition(stage, partition, consumerId)));
            }
            List<List<RowBatch>> result = new ArrayList<>(partitions);
            try {
                for (Future<List<RowBatch>> future : futures) {
                    result.add(future.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new QueryExecutionException("Interrupted while running " + stage.label(), e, stage.label());
            } catch (ExecutionException e) {
                cancelAll(futures);
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new QueryExecutionException("Execution failed in " + stage.label(), cause, stage.label());
            }
            return result;
        }

        private List<RowBatch> drainPartition(PhysicalPlan stage, int partition, int consumerId) {
            List<RowBatch> batches = new ArrayList<>();
            Operator operator = operator(stage, partition, consumerId);
            operator.open();
            try {
                RowBatch batch;
                while ((batch = operator.next()) != null) {
                    batches.add(batch);
                }
            } finally {
                operator.close();
            }
            return batches;
        }

        private static void cancelAll(List<? extends Future<?>> futures) {
            for (Future<?> future : futures) {
                future.cancel(true);
            }
        }

        /**
         * Builds the operator tree for one partition of a stage.
         *
         * @param node the stage node
         * @param partition the partition index
         * @param parentId the consuming node's id, or -1 for the final result
         */
        Operator operator(PhysicalPlan node, int partition, int parentId) {
            if (node instanceof ExchangeExec) {
                return readExchange((ExchangeExec) node, partition, parentId);
            }
            int id = node.id();
            int batchSize = shuffle.batchSize();
            Operator operator;
            if (node instanceof ScanExec) {
                ScanExec scan = (ScanExec) node;
                operator = new ScanOperator(scan.source(), scan.schema(), partition, batchSize);
            } else if (node instanceof FilterExec) {
                operator = new FilterOperator(operator(node.child(), partition, id),
                    ((FilterExec) node).condition());
            } else if (node instanceof ProjectExec) {
                operator = new ProjectOperator(operator(node.child(), partition, id),
                    ((ProjectExec) node).projections(), node.schema());
            } else if (node instanceof HashAggregateExec) {
                HashAggregateExec aggregate = (HashAggregateExec) node;
                operator = new HashAggregateOperator(operator(node.child(), partition, id),
                    aggregate.groupingKeys(), aggregate.aggregates(), node.schema(), batchSize);
            } else if (node instanceof LimitExec) {
                operator = new LimitOperator(operator(node.child(), partition, id), ((LimitExec) node).limit());
            } else if (node instanceof SortExec) {
                operator = new SortOperator(operator(node.child(), partition, id),
                    ((SortExec) node).sortOrders(), batchSize);
            } else if (node instanceof TopNExec) {
                TopNExec topN = (TopNExec) node;
                boolean addRank = topN.rankColumn() != null && !topN.isPartial();
                operator = new TopNOperator(operator(node.child(), partition, id), topN.sortOrders(),
                    topN.limit(), topN.partitionKeys(), addRank, node.schema(), batchSize);
            } else if (node instanceof WindowExec) {
                WindowExec window = (WindowExec) node;
                operator = new WindowOperator(operator(node.child(), partition, id), window.partitionKeys(),
                    window.orderBy(), node.schema(), batchSize);
            } else if (node instanceof BroadcastHashJoinExec) {
                BroadcastHashJoinExec join = (BroadcastHashJoinExec) node;
                JoinHashTable table = broadcastTables.get(join.id());
                if (table == null) {
                    throw new IllegalStateException(join.label() + " has no broadcast table");
                }
                operator = HashJoinOperator.probing(operator(join.streamed(), partition, id), table,
                    join.leftKeys(), join.rightKeys(), join.joinType(), join.mergedRightKeys(), join.buildSide(),
                    node.schema());
            } else if (node instanceof ShuffleHashJoinExec) {
                HashJoinExec join = (HashJoinExec) node;
                operator = new HashJoinOperator(operator(join.left(), partition, id),
                    operator(join.right(), partition, id), join.leftKeys(), join.rightKeys(), join.joinType(),
                    join.mergedRightKeys(), join.buildSide(), node.schema());
            } else {
                throw new IllegalArgumentException("No operator for " + node.nodeName());
            }
            return new InstrumentedOperator(operator, id, parentId, node.label(), context);
        }

        private Operator readExchange(ExchangeExec exchange, int partition, int parentId) {
            List<List<RowBatch>> partitions = exchanged.get(exchange.id());
            if (partitions == null) {
                throw new IllegalStateException(exchange.label() + " has not been materialized");
            }
            List<RowBatch> batches = partition < partitions.size() ? partitions.get(partition) : List.of();
            return new InstrumentedOperator(new MaterializedOperator(exchange.schema(), batches), -1, parentId,
                exchange.label(), context);
        }
    }
}
