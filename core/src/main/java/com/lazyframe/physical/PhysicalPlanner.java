package com.lazyframe.physical;

import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.Limit;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.Repartition;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.TableScan;
import com.lazyframe.logical.TopN;
import com.lazyframe.logical.Window;
import com.lazyframe.runtime.EngineConfig;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a logical plan into a physical plan.
 *
 * <p>Each logical node maps to one physical operator. Operators that need
 * their input distributed in a particular way (grouped aggregation, windows,
 * shuffle joins, global sorts and limits) get an {@link ExchangeExec}
 * inserted below them unless the child's partitioning already satisfies the
 * requirement.
 *
 * <p>In unoptimized mode joins always shuffle unless hinted, and every
 * requirement gets its own exchange whether or not it is already satisfied.
 * This is the reference plan the optimized plan is checked against.
 */
public class PhysicalPlanner {

    private static final Logger logger = LoggerFactory.getLogger(PhysicalPlanner.class);

    private final EngineConfig config;
    private final JoinStrategySelector joinStrategySelector;

    public PhysicalPlanner(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.joinStrategySelector = new JoinStrategySelector(config.broadcastThresholdBytes());
    }

    /**
     * Creates a physical plan.
     *
     * @param plan the logical plan
     * @param optimized whether to select broadcast joins and elide satisfied exchanges
     * @return the physical plan
     * @throws com.lazyframe.exception.BroadcastSizeExceededException if a broadcast hint cannot be honored
     */
    public PhysicalPlan plan(LogicalPlan plan, boolean optimized) {
        Objects.requireNonNull(plan, "plan must not be null");
        PhysicalPlan physical = new Lowering(optimized).lower(plan);
        if (logger.isDebugEnabled()) {
            logger.debug("Physical plan ({}):\n{}", optimized ? "optimized" : "unoptimized", treeString(physical));
        }
        return physical;
    }

    static String treeString(PhysicalPlan plan) {
        StringBuilder sb = new StringBuilder();
        appendTree(sb, plan, 0);
        return sb.toString();
    }

    private static void appendTree(StringBuilder sb, PhysicalPlan node, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(depth == 0 ? "" : "+- ").append(node).append('\n');
        for (PhysicalPlan child : node.children()) {
            appendTree(sb, child, depth + 1);
        }
    }

    /**
     * One lowering pass; owns the node id counter.
     */
    private final class Lowering {

        private final boolean optimized;
        private int nextId;

        Lowering(boolean optimized) {
            this.optimized = optimized;
        }

        private int id() {
            return nextId++;
        }

        PhysicalPlan lower(LogicalPlan node) {
            OptionalLong rows = SizeEstimator.estimatedRows(node);

            if (node instanceof TableScan) {
                TableScan scan = (TableScan) node;
                return new ScanExec(id(), scan.source(), scan.schema(), rows);
            }
            if (node instanceof Filter) {
                Filter filter = (Filter) node;
                return new FilterExec(id(), lower(filter.child()), filter.condition(), rows);
            }
            if (node instanceof Project) {
                Project project = (Project) node;
                return new ProjectExec(id(), lower(project.child()), project.projections(), project.schema(), rows);
            }
            if (node instanceof Aggregate) {
                Aggregate aggregate = (Aggregate) node;
                PhysicalPlan child = lower(aggregate.child());
                child = aggregate.isGrouped()
                    ? ensureClustered(child, aggregate.groupingKeys())
                    : ensureSingle(child);
                return new HashAggregateExec(id(), child, aggregate.groupingKeys(),
                    aggregate.aggregateExpressions(), aggregate.schema(), rows);
            }
            if (node instanceof Join) {
                return lowerJoin((Join) node, rows);
            }
            if (node instanceof Sort) {
                Sort sort = (Sort) node;
                return new SortExec(id(), ensureSingle(lower(sort.child())), sort.sortOrders(), rows);
            }
            if (node instanceof Limit) {
                Limit limit = (Limit) node;
                PhysicalPlan child = lower(limit.child());
                if (needsExchange(child.outputPartitioning().isSingle())) {
                    child = ExchangeExec.single(id(), new LimitExec(id(), child, limit.limit(), true, rows));
                }
                return new LimitExec(id(), child, limit.limit(), false, rows);
            }
            if (node instanceof TopN) {
                return lowerTopN((TopN) node, rows);
            }
            if (node instanceof Window) {
                Window window = (Window) node;
                PhysicalPlan child = lower(window.child());
                child = window.partitionKeys().isEmpty()
                    ? ensureSingle(child)
                    : ensureClustered(child, window.partitionKeys());
                return new WindowExec(id(), child, window.partitionKeys(), window.orderBy(),
                    window.rankColumn(), window.schema(), rows);
            }
            if (node instanceof Repartition) {
                return lowerRepartition((Repartition) node);
            }
            throw new IllegalArgumentException("No physical strategy for " + node.nodeName());
        }

        private PhysicalPlan lowerJoin(Join join, OptionalLong rows) {
            JoinStrategySelector.Strategy strategy = joinStrategySelector.select(join, optimized);
            PhysicalPlan left = lower(join.left());
            PhysicalPlan right = lower(join.right());
            long limit = config.broadcastThresholdBytes();

            switch (strategy) {
                case BROADCAST_RIGHT:
                    return new BroadcastHashJoinExec(id(), left, ExchangeExec.broadcast(id(), right, limit),
                        join.leftKeys(), join.rightKeys(), join.joinType(), join.mergedRightKeys(),
                        HashJoinExec.BuildSide.RIGHT, join.schema(), rows);
                case BROADCAST_LEFT:
                    return new BroadcastHashJoinExec(id(), ExchangeExec.broadcast(id(), left, limit), right,
                        join.leftKeys(), join.rightKeys(), join.joinType(), join.mergedRightKeys(),
                        HashJoinExec.BuildSide.LEFT, join.schema(), rows);
                default:
                    int partitions = config.defaultPartitionCount();
                    Partitioning leftPartitioning = left.outputPartitioning();
                    if (optimized && leftPartitioning instanceof HashPartitioning
                            && ((HashPartitioning) leftPartitioning).keys().equals(join.leftKeys())) {
                        partitions = leftPartitioning.numPartitions();
                    }
                    left = ensureHash(left, join.leftKeys(), partitions);
                    right = ensureHash(right, join.rightKeys(), partitions);
                    return new ShuffleHashJoinExec(id(), left, right, join.leftKeys(), join.rightKeys(),
                        join.joinType(), join.mergedRightKeys(), join.schema(), rows);
            }
        }

        private PhysicalPlan lowerTopN(TopN topN, OptionalLong rows) {
            PhysicalPlan child = lower(topN.child());
            if (!topN.isGlobal()) {
                child = ensureClustered(child, topN.partitionKeys());
            } else if (needsExchange(child.outputPartitioning().isSingle())) {
                PhysicalPlan partial = new TopNExec(id(), child, topN.sortOrders(), topN.limit(), List.of(),
                    null, true, child.schema(), rows);
                child = ExchangeExec.single(id(), partial);
            }
            return new TopNExec(id(), child, topN.sortOrders(), topN.limit(), topN.partitionKeys(),
                topN.rankColumn(), false, topN.schema(), rows);
        }

        private PhysicalPlan lowerRepartition(Repartition repartition) {
            PhysicalPlan child = lower(repartition.child());
            int partitions = repartition.numPartitions() > 0
                ? repartition.numPartitions() : config.defaultPartitionCount();
            if (!repartition.isHash()) {
                return ExchangeExec.roundRobin(id(), child, partitions);
            }
            HashPartitioning target = new HashPartitioning(repartition.keys(), partitions);
            if (optimized && target.equals(child.outputPartitioning())) {
                return child;
            }
            return ExchangeExec.hash(id(), child, repartition.keys(), partitions);
        }

        private boolean needsExchange(boolean satisfied) {
            return !optimized || !satisfied;
        }

        private PhysicalPlan ensureSingle(PhysicalPlan child) {
            return needsExchange(child.outputPartitioning().isSingle())
                ? ExchangeExec.single(id(), child) : child;
        }

        private PhysicalPlan ensureClustered(PhysicalPlan child, List<String> keys) {
            return needsExchange(child.outputPartitioning().satisfiesClustering(keys))
                ? ExchangeExec.hash(id(), child, keys, config.defaultPartitionCount()) : child;
        }

        private PhysicalPlan ensureHash(PhysicalPlan child, List<String> keys, int partitions) {
            boolean satisfied = new HashPartitioning(keys, partitions).equals(child.outputPartitioning());
            return needsExchange(satisfied) ? ExchangeExec.hash(id(), child, keys, partitions) : child;
        }
    }
}
