package com.lazyframe.physical;

import com.lazyframe.exception.BroadcastSizeExceededException;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.Join.JoinType;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses between broadcast and shuffle hash joins.
 *
 * <p>A side can be broadcast when its estimated size is known and at most
 * the broadcast threshold. INNER joins may broadcast either side; the other
 * join types only the right side. When both sides qualify the smaller one is
 * broadcast, the right side on ties. Anything else is a shuffle join.
 *
 * <p>Hints override the choice. A forced broadcast whose known size is
 * above the threshold is rejected.
 */
public final class JoinStrategySelector {

    private static final Logger logger = LoggerFactory.getLogger(JoinStrategySelector.class);

    /**
     * Physical join strategy.
     */
    public enum Strategy {
        BROADCAST_LEFT,
        BROADCAST_RIGHT,
        SHUFFLE
    }

    private final long thresholdBytes;

    public JoinStrategySelector(long thresholdBytes) {
        this.thresholdBytes = thresholdBytes;
    }

    /**
     * Selects the strategy for a join.
     *
     * @param join the logical join
     * @param costBased whether size-based broadcast selection is enabled
     * @return the strategy
     * @throws BroadcastSizeExceededException if a broadcast hint names a side known to be too large
     */
    public Strategy select(Join join, boolean costBased) {
        OptionalLong leftBytes = SizeEstimator.estimatedSizeInBytes(join.left());
        OptionalLong rightBytes = SizeEstimator.estimatedSizeInBytes(join.right());

        switch (join.hint()) {
            case BROADCAST_LEFT:
                checkForced(join, "left", leftBytes);
                return Strategy.BROADCAST_LEFT;
            case BROADCAST_RIGHT:
                checkForced(join, "right", rightBytes);
                return Strategy.BROADCAST_RIGHT;
            case SHUFFLE:
                return Strategy.SHUFFLE;
            default:
                break;
        }
        if (!costBased) {
            return Strategy.SHUFFLE;
        }

        boolean rightFits = fits(rightBytes);
        boolean leftFits = join.joinType() == JoinType.INNER && fits(leftBytes);
        Strategy strategy;
        if (leftFits && rightFits) {
            strategy = leftBytes.getAsLong() < rightBytes.getAsLong()
                ? Strategy.BROADCAST_LEFT : Strategy.BROADCAST_RIGHT;
        } else if (rightFits) {
            strategy = Strategy.BROADCAST_RIGHT;
        } else if (leftFits) {
            strategy = Strategy.BROADCAST_LEFT;
        } else {
            strategy = Strategy.SHUFFLE;
        }
        logger.debug("{}: left={} bytes, right={} bytes, threshold={} -> {}", join,
            describe(leftBytes), describe(rightBytes), thresholdBytes, strategy);
        return strategy;
    }

    public long thresholdBytes() {
        return thresholdBytes;
    }

    private boolean fits(OptionalLong bytes) {
        return bytes.isPresent() && bytes.getAsLong() <= thresholdBytes;
    }

    private void checkForced(Join join, String side, OptionalLong bytes) {
        if (bytes.isEmpty()) {
            logger.warn("Broadcasting {} side of {} without a size estimate; the limit of {} bytes is checked at run time",
                side, join, thresholdBytes);
            return;
        }
        if (bytes.getAsLong() > thresholdBytes) {
            throw new BroadcastSizeExceededException(join + " (" + side + " side)", bytes.getAsLong(), thresholdBytes);
        }
    }

    private static String describe(OptionalLong bytes) {
        return bytes.isPresent() ? String.valueOf(bytes.getAsLong()) : "unknown";
    }
}
