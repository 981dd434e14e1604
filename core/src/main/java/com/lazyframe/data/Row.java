package com.lazyframe.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable row of values, positionally aligned with the schema of the batch
 * that holds it.
 *
 * <p>Values use the Java representation of their column type (see
 * {@link com.lazyframe.types.DataType}); SQL NULL is {@code null}.
 */
public final class Row {

    private final Object[] values;

    private Row(Object[] values) {
        this.values = values;
    }

    /**
     * Creates a row from the given values. The array is copied.
     *
     * @param values the column values
     * @return the row
     */
    public static Row of(Object... values) {
        return new Row(values.clone());
    }

    /**
     * Creates a row from a list of values.
     *
     * @param values the column values
     * @return the row
     */
    public static Row fromList(List<?> values) {
        return new Row(values.toArray());
    }

    /**
     * Wraps an array the caller will never touch again. Used by operators that
     * build a fresh value array per output row.
     */
    public static Row wrap(Object[] values) {
        return new Row(values);
    }

    public Object get(int ordinal) {
        return values[ordinal];
    }

    public boolean isNullAt(int ordinal) {
        return values[ordinal] == null;
    }

    public int size() {
        return values.length;
    }

    /**
     * Returns the values as an unmodifiable list.
     *
     * @return the values
     */
    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    /**
     * Copies the values into a new array.
     *
     * @return a fresh array holding this row's values
     */
    public Object[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Row)) return false;
        return Arrays.equals(values, ((Row) obj).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Row" + Arrays.toString(values);
    }
}
