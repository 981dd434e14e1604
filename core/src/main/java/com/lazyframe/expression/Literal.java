package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DateType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a literal constant value.
 *
 * <p>Literals are fixed values that don't change, such as:
 * <ul>
 *   <li>Numeric literals: 42, 3.14, 100L</li>
 *   <li>String literals: 'CA'</li>
 *   <li>Boolean literals: true, false</li>
 *   <li>Date literals: DATE '2020-03-01'</li>
 *   <li>Null literal: null</li>
 * </ul>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     * @throws IllegalArgumentException if the value does not match the type
     */
    public Literal(Object value, DataType dataType) {
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        if (value != null && !dataType.accepts(value)) {
            throw new IllegalArgumentException(
                "Literal value " + value + " is not a valid " + dataType.typeName());
        }
        this.value = value;
    }

    /**
     * Creates a literal, inferring the type from the Java value.
     *
     * @param value a String, Long, Integer, Double, Boolean or LocalDate
     * @return the literal
     * @throws IllegalArgumentException for null or unsupported values
     */
    public static Literal of(Object value) {
        if (value instanceof String) {
            return new Literal(value, StringType.get());
        }
        if (value instanceof Long) {
            return new Literal(value, LongType.get());
        }
        if (value instanceof Integer) {
            return new Literal(value, IntegerType.get());
        }
        if (value instanceof Double) {
            return new Literal(value, DoubleType.get());
        }
        if (value instanceof Boolean) {
            return new Literal(value, BooleanType.get());
        }
        if (value instanceof LocalDate) {
            return new Literal(value, DateType.get());
        }
        if (value == null) {
            throw new IllegalArgumentException("Use new Literal(null, type) for typed null literals");
        }
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return this;
    }

    @Override
    public String toSQL() {
        if (value == null) {
            return "NULL";
        }
        if (dataType instanceof StringType) {
            // Escape single quotes in strings
            return "'" + value.toString().replace("'", "''") + "'";
        }
        if (dataType instanceof BooleanType) {
            return value.toString().toUpperCase();
        }
        if (dataType instanceof DateType) {
            return "DATE '" + value + "'";
        }
        if (dataType instanceof LongType) {
            return value + "L";
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value) && Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }
}
