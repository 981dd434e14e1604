package com.lazyframe.api;

import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.InExpression;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.logical.Sort.NullOrdering;
import com.lazyframe.logical.Sort.SortDirection;
import com.lazyframe.logical.Sort.SortOrder;
import com.lazyframe.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A column expression in the DataFrame API.
 *
 * <p>Columns are unresolved until a {@link DataFrame} builder binds them to
 * its input schema. A column may also carry a sort direction for use in
 * {@code orderBy}, {@code sortLimit} and {@code withRowNumber}.
 */
public class Column {

    private final Expression expr;
    private final SortDirection direction;
    private final NullOrdering nullOrdering;

    public Column(Expression expr) {
        this(expr, null, null);
    }

    private Column(Expression expr, SortDirection direction, NullOrdering nullOrdering) {
        this.expr = Objects.requireNonNull(expr, "expr must not be null");
        this.direction = direction;
        this.nullOrdering = nullOrdering;
    }

    public Expression expr() {
        return expr;
    }

    // Naming

    /**
     * Names the column's output.
     *
     * @param alias the output name
     * @return the aliased column
     */
    public Column as(String alias) {
        if (expr instanceof AggregateExpression) {
            return new Column(((AggregateExpression) expr).withAlias(alias));
        }
        if (expr instanceof AliasExpression) {
            return new Column(new AliasExpression(((AliasExpression) expr).expression(), alias));
        }
        return new Column(new AliasExpression(expr, alias));
    }

    public Column alias(String alias) {
        return as(alias);
    }

    // Comparison

    public Column equalTo(Object other) {
        return new Column(BinaryExpression.equal(expr, toExpr(other)));
    }

    public Column notEqual(Object other) {
        return new Column(BinaryExpression.notEqual(expr, toExpr(other)));
    }

    public Column gt(Object other) {
        return new Column(BinaryExpression.greaterThan(expr, toExpr(other)));
    }

    public Column geq(Object other) {
        return new Column(BinaryExpression.greaterThanOrEqual(expr, toExpr(other)));
    }

    public Column lt(Object other) {
        return new Column(BinaryExpression.lessThan(expr, toExpr(other)));
    }

    public Column leq(Object other) {
        return new Column(BinaryExpression.lessThanOrEqual(expr, toExpr(other)));
    }

    public Column isin(Object... values) {
        List<Expression> list = new ArrayList<>(values.length);
        for (Object value : values) {
            list.add(toExpr(value));
        }
        return new Column(new InExpression(expr, list));
    }

    public Column isNull() {
        return new Column(UnaryExpression.isNull(expr));
    }

    public Column isNotNull() {
        return new Column(UnaryExpression.isNotNull(expr));
    }

    // Logical

    public Column and(Column other) {
        return new Column(BinaryExpression.and(expr, other.expr));
    }

    public Column or(Column other) {
        return new Column(BinaryExpression.or(expr, other.expr));
    }

    // Arithmetic

    public Column plus(Object other) {
        return new Column(BinaryExpression.add(expr, toExpr(other)));
    }

    public Column minus(Object other) {
        return new Column(BinaryExpression.subtract(expr, toExpr(other)));
    }

    public Column multiply(Object other) {
        return new Column(BinaryExpression.multiply(expr, toExpr(other)));
    }

    public Column divide(Object other) {
        return new Column(BinaryExpression.divide(expr, toExpr(other)));
    }

    public Column mod(Object other) {
        return new Column(BinaryExpression.modulo(expr, toExpr(other)));
    }

    // Casting

    public Column cast(DataType type) {
        return new Column(CastExpression.cast(expr, type));
    }

    /**
     * Converts to {@code type}, yielding null where the value cannot be converted.
     */
    public Column tryCast(DataType type) {
        return new Column(CastExpression.tryCast(expr, type));
    }

    // Ordering

    public Column asc() {
        return new Column(expr, SortDirection.ASCENDING, null);
    }

    public Column desc() {
        return new Column(expr, SortDirection.DESCENDING, null);
    }

    public Column ascNullsLast() {
        return new Column(expr, SortDirection.ASCENDING, NullOrdering.NULLS_LAST);
    }

    public Column descNullsFirst() {
        return new Column(expr, SortDirection.DESCENDING, NullOrdering.NULLS_FIRST);
    }

    /**
     * Returns the sort order for a resolved expression, ascending unless
     * {@link #desc()} was applied.
     */
    SortOrder toSortOrder(Expression resolved) {
        SortDirection dir = direction == null ? SortDirection.ASCENDING : direction;
        return nullOrdering == null ? new SortOrder(resolved, dir) : new SortOrder(resolved, dir, nullOrdering);
    }

    static Expression toExpr(Object value) {
        if (value instanceof Column) {
            return ((Column) value).expr;
        }
        return Literal.of(value);
    }

    @Override
    public String toString() {
        return expr.toSQL();
    }
}
