package com.lazyframe.data;

import java.util.Arrays;

/**
 * Key built from selected columns of a row, used for hashing, grouping and
 * join lookups.
 *
 * <p>Numeric values are normalized so that keys compare by value across
 * numeric types: {@code 5}, {@code 5L} and {@code 5.0} form the same key.
 */
public final class GroupKey {

    private final Object[] values;
    private final int hash;

    private GroupKey(Object[] values) {
        this.values = values;
        this.hash = Arrays.hashCode(values);
    }

    /**
     * Extracts a key from a row.
     *
     * @param row the row
     * @param ordinals the key column positions
     * @return the key
     */
    public static GroupKey of(Row row, int[] ordinals) {
        Object[] values = new Object[ordinals.length];
        for (int i = 0; i < ordinals.length; i++) {
            values[i] = normalize(row.get(ordinals[i]));
        }
        return new GroupKey(values);
    }

    /**
     * Normalizes a value for key comparison.
     *
     * @param value the raw value
     * @return the normalized value
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer) {
            return ((Integer) value).longValue();
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p62) {
                return (long) d;
            }
            return value;
        }
        return value;
    }

    /**
     * Returns whether any key column is null. Null keys never match in joins.
     *
     * @return true if a key value is null
     */
    public boolean hasNull() {
        for (Object value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return values.length;
    }

    public Object get(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GroupKey)) return false;
        GroupKey that = (GroupKey) obj;
        return hash == that.hash && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
