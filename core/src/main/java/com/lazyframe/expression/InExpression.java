package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing an IN clause (or NOT IN clause).
 *
 * <p>SQL form: expr IN (val1, val2, val3)
 * <p>SQL form (negated): expr NOT IN (val1, val2, val3)
 *
 * <p>Nullability follows SQL semantics:
 * <ul>
 *   <li>If testExpr is NULL: result is NULL</li>
 *   <li>If any value in the list is NULL and no exact match: result is NULL</li>
 *   <li>If an exact match is found: result is TRUE</li>
 *   <li>If no match and no NULLs: result is FALSE</li>
 * </ul>
 */
public final class InExpression implements Expression {

    private final Expression testExpr;
    private final List<Expression> values;
    private final boolean negated;

    /**
     * Creates an IN expression.
     *
     * @param testExpr the expression being tested
     * @param values the values to test against
     * @param negated true for NOT IN, false for IN
     * @throws IllegalArgumentException if values is empty
     */
    public InExpression(Expression testExpr, List<Expression> values, boolean negated) {
        Objects.requireNonNull(testExpr, "testExpr must not be null");
        Objects.requireNonNull(values, "values must not be null");

        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN clause requires at least one value");
        }

        this.testExpr = testExpr;
        this.values = new ArrayList<>(values);
        this.negated = negated;
    }

    public InExpression(Expression testExpr, List<Expression> values) {
        this(testExpr, values, false);
    }

    public Expression testExpr() {
        return testExpr;
    }

    /**
     * Returns the values in the IN list.
     *
     * @return an unmodifiable list of value expressions
     */
    public List<Expression> values() {
        return Collections.unmodifiableList(values);
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        if (testExpr.nullable()) {
            return true;
        }
        for (Expression value : values) {
            if (value.nullable()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<Expression> children() {
        List<Expression> all = new ArrayList<>(values.size() + 1);
        all.add(testExpr);
        all.addAll(values);
        return all;
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new InExpression(newChildren.get(0), newChildren.subList(1, newChildren.size()), negated);
    }

    @Override
    public String toSQL() {
        String valueList = values.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", "));
        return String.format("(%s %sIN (%s))", testExpr.toSQL(), negated ? "NOT " : "", valueList);
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated &&
               testExpr.equals(that.testExpr) &&
               values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values, negated);
    }
}
