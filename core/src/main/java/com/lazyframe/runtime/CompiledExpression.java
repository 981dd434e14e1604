package com.lazyframe.runtime;

import com.lazyframe.data.Row;

/**
 * An expression bound to column positions, ready to evaluate per row.
 */
@FunctionalInterface
public interface CompiledExpression {

    /**
     * Evaluates the expression.
     *
     * @param row the input row
     * @return the value, or null
     */
    Object eval(Row row);
}
