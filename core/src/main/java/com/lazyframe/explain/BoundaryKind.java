package com.lazyframe.explain;

/**
 * How a plan node moves data between partitions.
 */
public enum BoundaryKind {
    /** Data stays in its partition. */
    NONE,
    /** Data is redistributed across partitions (hash, round-robin or gather). */
    SHUFFLE,
    /** Data is copied whole to every consumer partition. */
    BROADCAST
}
