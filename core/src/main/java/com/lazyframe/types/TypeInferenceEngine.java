package com.lazyframe.types;

/**
 * Centralized rules for type compatibility and result type inference.
 *
 * <h2>Type Resolution Rules</h2>
 * <ul>
 *   <li>Comparisons and join keys: numeric types compare with each other, every
 *       other type compares only with itself</li>
 *   <li>Arithmetic: promoted numeric type (Integer &lt; Long &lt; Double)</li>
 *   <li>Aggregates: COUNT → Long, SUM → Long or Double, AVG → Double,
 *       MIN/MAX → argument type</li>
 * </ul>
 */
public final class TypeInferenceEngine {

    private TypeInferenceEngine() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns whether the type is numeric.
     *
     * @param type the type to test
     * @return true for integer, long and double
     */
    public static boolean isNumeric(DataType type) {
        return type instanceof IntegerType || type instanceof LongType || type instanceof DoubleType;
    }

    /**
     * Returns whether the type is integral.
     *
     * @param type the type to test
     * @return true for integer and long
     */
    public static boolean isIntegral(DataType type) {
        return type instanceof IntegerType || type instanceof LongType;
    }

    /**
     * Returns whether values of the two types can be compared or equi-joined.
     *
     * @param left the left type
     * @param right the right type
     * @return true if comparable
     */
    public static boolean isComparable(DataType left, DataType right) {
        if (left == null || right == null) {
            return false;
        }
        if (isNumeric(left) && isNumeric(right)) {
            return true;
        }
        return left.equals(right);
    }

    /**
     * Promotes numeric types.
     *
     * <p>Promotion order: Integer &lt; Long &lt; Double.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     */
    public static DataType promoteNumericTypes(DataType left, DataType right) {
        if (left instanceof DoubleType || right instanceof DoubleType) {
            return DoubleType.get();
        }
        if (left instanceof LongType || right instanceof LongType) {
            return LongType.get();
        }
        return IntegerType.get();
    }

    /**
     * Resolves the return type of an aggregate function.
     *
     * @param function the aggregate function name (case-insensitive)
     * @param argType the argument type, or null for COUNT(*)
     * @return the result type
     * @throws IllegalArgumentException if the function is unknown
     */
    public static DataType resolveAggregateReturnType(String function, DataType argType) {
        switch (function.toUpperCase()) {
            case "COUNT":
                return LongType.get();
            case "SUM":
                return argType instanceof DoubleType ? DoubleType.get() : LongType.get();
            case "AVG":
                return DoubleType.get();
            case "MIN":
            case "MAX":
                return argType;
            default:
                throw new IllegalArgumentException("Unknown aggregate function: " + function);
        }
    }

    /**
     * Converts a numeric value to the Java representation of the target type.
     *
     * @param value the numeric value (may be null)
     * @param target the target numeric type
     * @return the converted value, or null
     */
    public static Object coerceNumeric(Object value, DataType target) {
        if (!(value instanceof Number)) {
            return value;
        }
        Number number = (Number) value;
        if (target instanceof LongType) {
            return number.longValue();
        }
        if (target instanceof IntegerType) {
            return number.intValue();
        }
        if (target instanceof DoubleType) {
            return number.doubleValue();
        }
        return value;
    }
}
