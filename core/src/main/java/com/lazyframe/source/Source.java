package com.lazyframe.source;

import com.lazyframe.data.RowBatch;
import com.lazyframe.types.StructType;
import java.util.Iterator;
import java.util.OptionalLong;

/**
 * A readable table. File formats, CSV parsing and remote storage live behind
 * this interface; the engine only pulls batches from it.
 *
 * <p>A source may return batches wider than the requested schema, in which
 * case the scan operator projects them down to the required columns.
 */
public interface Source {

    /**
     * Returns a short name used in plan descriptions.
     *
     * @return the source name
     */
    String name();

    /**
     * Returns the full schema of the table.
     *
     * @return the schema
     */
    StructType schema();

    /**
     * Reads the whole table.
     *
     * @param requiredSchema the columns the query needs (a subset of {@link #schema()})
     * @return batches of rows
     */
    Iterator<RowBatch> scan(StructType requiredSchema);

    /**
     * Returns the number of physical splits this source can be read in.
     *
     * @return the partition count, at least 1
     */
    default int partitionCount() {
        return 1;
    }

    /**
     * Reads a single split. Sources with one split delegate to {@link #scan(StructType)}.
     *
     * @param requiredSchema the columns the query needs
     * @param partition the split index, in {@code [0, partitionCount())}
     * @return batches of rows
     */
    default Iterator<RowBatch> scanPartition(StructType requiredSchema, int partition) {
        if (partition != 0 || partitionCount() != 1) {
            throw new IllegalArgumentException("Source " + name() + " has no partition " + partition);
        }
        return scan(requiredSchema);
    }

    /**
     * Returns the row count if known without reading the data.
     *
     * @return the row count estimate, or empty
     */
    default OptionalLong estimatedRowCount() {
        return OptionalLong.empty();
    }
}
