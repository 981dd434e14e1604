package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression that names the output of another expression.
 *
 * <p>Aliases only matter at the top of a projection list, where they define the
 * output column name: {@code TRY_CAST(cases AS long) AS cases}.
 */
public final class AliasExpression implements Expression {

    private final Expression expression;
    private final String alias;

    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public DataType dataType() {
        return expression.dataType();
    }

    @Override
    public boolean nullable() {
        return expression.nullable();
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(expression);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new AliasExpression(newChildren.get(0), alias);
    }

    @Override
    public String toSQL() {
        return expression.toSQL() + " AS " + alias;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return alias.equals(that.alias) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }
}
