package com.lazyframe.types;

/**
 * Sealed interface for all data types in the lazyframe type system.
 *
 * <p>This represents the logical type of a column or expression. Values of each
 * type have a fixed Java representation:
 * <ul>
 *   <li>{@link StringType} - {@code String}</li>
 *   <li>{@link LongType} - {@code Long}</li>
 *   <li>{@link IntegerType} - {@code Integer}</li>
 *   <li>{@link DoubleType} - {@code Double}</li>
 *   <li>{@link BooleanType} - {@code Boolean}</li>
 *   <li>{@link DateType} - {@code java.time.LocalDate}</li>
 * </ul>
 *
 * <p>Nullability is not part of the type; it is carried by {@link StructField}.
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, DoubleType, StringType, DateType, StructType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the estimated size in bytes of one value of this type.
     *
     * <p>Used for row-width estimation when sizing broadcast candidates and
     * measuring shuffle volume.
     *
     * @return the default size in bytes
     */
    int defaultSize();

    /**
     * Returns whether the given non-null Java value is a valid representation of
     * this type.
     *
     * @param value the value to check
     * @return true if the value can be stored in a column of this type
     */
    boolean accepts(Object value);
}
