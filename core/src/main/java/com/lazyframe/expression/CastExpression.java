package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression that casts another expression to a different data type.
 *
 * <p>Two flavours exist:
 * <ul>
 *   <li>{@code CAST(x AS long)} - a malformed input fails the query</li>
 *   <li>{@code TRY_CAST(x AS long)} - a malformed input yields NULL and the row
 *       continues downstream</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>
 *   TRY_CAST(cases AS long)
 *   CAST(date_str AS date)
 * </pre>
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final DataType targetType;
    private final boolean tryCast;

    /**
     * Creates a cast expression.
     *
     * @param expression the expression to cast
     * @param targetType the target data type
     * @param tryCast true to yield null instead of failing on malformed input
     */
    public CastExpression(Expression expression, DataType targetType, boolean tryCast) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
        this.tryCast = tryCast;
    }

    public static CastExpression cast(Expression expression, DataType targetType) {
        return new CastExpression(expression, targetType, false);
    }

    public static CastExpression tryCast(Expression expression, DataType targetType) {
        return new CastExpression(expression, targetType, true);
    }

    public Expression expression() {
        return expression;
    }

    public DataType targetType() {
        return targetType;
    }

    public boolean isTryCast() {
        return tryCast;
    }

    @Override
    public DataType dataType() {
        return targetType;
    }

    @Override
    public boolean nullable() {
        // A failed try_cast produces null even from a non-null input
        return tryCast || expression.nullable();
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(expression);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new CastExpression(newChildren.get(0), targetType, tryCast);
    }

    @Override
    public String toSQL() {
        return String.format("%s(%s AS %s)", tryCast ? "TRY_CAST" : "CAST",
            expression.toSQL(), targetType.typeName());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return tryCast == that.tryCast &&
               expression.equals(that.expression) &&
               targetType.equals(that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType, tryCast);
    }
}
