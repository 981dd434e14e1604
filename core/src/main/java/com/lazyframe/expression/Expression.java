package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.List;

/**
 * Base interface for all expressions in the lazyframe engine.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references</li>
 *   <li>Arithmetic operations (a + b, a * b)</li>
 *   <li>Comparison operations (a > b, a == b)</li>
 *   <li>Function calls (year(date), upper(name))</li>
 *   <li>Safe casts (try_cast(cases AS long))</li>
 * </ul>
 *
 * <p>Expressions are immutable values with structural equality, so plans that
 * contain them can be compared by the optimizer's fixed-point loop. They carry no
 * evaluation logic; {@link com.lazyframe.runtime.ExpressionCompiler} binds them
 * to a schema and produces evaluators.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     * @throws IllegalStateException if the expression is not resolved
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Returns the direct child expressions.
     *
     * @return the children, empty for leaves
     */
    List<Expression> children();

    /**
     * Returns a copy of this expression with the given children, in the order
     * returned by {@link #children()}.
     *
     * @param newChildren the replacement children
     * @return the rebuilt expression
     */
    Expression withNewChildren(List<Expression> newChildren);

    /**
     * Renders this expression in SQL syntax. Used by explain output and
     * {@code toString}.
     *
     * @return the SQL string representation
     */
    String toSQL();

    /**
     * Returns whether every column reference below this expression is resolved.
     *
     * @return true if resolved
     */
    default boolean resolved() {
        for (Expression child : children()) {
            if (!child.resolved()) {
                return false;
            }
        }
        return true;
    }
}
