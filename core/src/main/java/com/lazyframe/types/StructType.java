package com.lazyframe.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a struct type (row schema) with named fields.
 *
 * <p>This is the schema of a DataFrame and of every {@code RowBatch}. Field names
 * are unique; lookups by name are constant time.
 */
public final class StructType implements DataType {

    /** Empty struct type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private final List<StructField> fields;
    private final Map<String, Integer> indexByName;

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     * @throws IllegalArgumentException if two fields share a name
     */
    public StructType(List<StructField> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
        this.indexByName = new HashMap<>();
        for (int i = 0; i < this.fields.size(); i++) {
            String name = this.fields.get(i).name();
            if (indexByName.put(name, i) != null) {
                throw new IllegalArgumentException("Duplicate field name: " + name);
            }
        }
    }

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return fields;
    }

    /**
     * Returns the field names in order.
     *
     * @return the field names
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (StructField field : fields) {
            names.add(field.name());
        }
        return names;
    }

    /**
     * Returns the number of fields in this struct.
     *
     * @return the field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public StructField fieldByName(String name) {
        Integer index = indexByName.get(name);
        return index == null ? null : fields.get(index);
    }

    /**
     * Returns the index of the field with the given name, or -1 if not found.
     *
     * @param name the field name
     * @return the field index, or -1 if not found
     */
    public int fieldIndex(String name) {
        Integer index = indexByName.get(name);
        return index == null ? -1 : index;
    }

    /**
     * Returns whether a field with the given name exists.
     *
     * @param name the field name
     * @return true if present
     */
    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Returns a struct containing only the named fields, in this struct's order.
     *
     * @param names the names to keep
     * @return the narrowed struct
     */
    public StructType select(Collection<String> names) {
        List<StructField> kept = new ArrayList<>();
        for (StructField field : fields) {
            if (names.contains(field.name())) {
                kept.add(field);
            }
        }
        return new StructType(kept);
    }

    /**
     * Returns the estimated width in bytes of one row of this struct.
     *
     * @return the sum of the fields' default sizes
     */
    public int estimatedRowWidth() {
        int width = 0;
        for (StructField field : fields) {
            width += field.dataType().defaultSize();
        }
        return width;
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public int defaultSize() {
        return estimatedRowWidth();
    }

    @Override
    public boolean accepts(Object value) {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
