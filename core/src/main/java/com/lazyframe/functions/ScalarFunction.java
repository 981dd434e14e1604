package com.lazyframe.functions;

import com.lazyframe.types.DataType;
import java.util.List;

/**
 * A built-in scalar function: validates its argument types at build time and
 * computes one value per row at execution time.
 */
public interface ScalarFunction {

    /**
     * Returns the lower-case function name.
     *
     * @return the name
     */
    String name();

    /**
     * Resolves the return type for the given argument types.
     *
     * @param argumentTypes the resolved argument types
     * @return the return type
     * @throws com.lazyframe.exception.TypeMismatchException if the arguments are invalid
     */
    DataType returnType(List<DataType> argumentTypes);

    /**
     * Computes the function on one row's argument values.
     *
     * @param arguments the evaluated arguments (may contain nulls)
     * @return the result, or null
     */
    Object invoke(Object[] arguments);

    /**
     * Returns whether any null argument makes the result null. Evaluators skip
     * {@link #invoke} entirely in that case.
     *
     * @return true for null-intolerant functions
     */
    default boolean nullIntolerant() {
        return true;
    }
}
