package com.lazyframe.types;

/**
 * Data type representing a variable-length string.
 *
 * <p>The default size is an average used for estimation only.
 */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public int defaultSize() {
        return 20;
    }

    @Override
    public boolean accepts(Object value) {
        return value instanceof String;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
