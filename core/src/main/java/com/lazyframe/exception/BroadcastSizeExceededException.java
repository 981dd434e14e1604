package com.lazyframe.exception;

/**
 * Thrown when a join side selected for broadcast is larger than the configured
 * broadcast threshold.
 *
 * <p>Raised at physical planning time for a forced broadcast hint whose estimate
 * exceeds the threshold, and at execution time when the measured broadcast data
 * exceeds it.
 */
public class BroadcastSizeExceededException extends LazyFrameException {

    private final String node;
    private final long sizeInBytes;
    private final long thresholdBytes;

    public BroadcastSizeExceededException(String node, long sizeInBytes, long thresholdBytes) {
        super(String.format("Broadcast side of %s is %d bytes, above the broadcast threshold of %d bytes",
            node, sizeInBytes, thresholdBytes));
        this.node = node;
        this.sizeInBytes = sizeInBytes;
        this.thresholdBytes = thresholdBytes;
    }

    /**
     * Returns a description of the plan node whose input was too large.
     *
     * @return the node description
     */
    public String node() {
        return node;
    }

    public long sizeInBytes() {
        return sizeInBytes;
    }

    public long thresholdBytes() {
        return thresholdBytes;
    }
}
