package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a unary operation.
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>Logical: NOT a</li>
 *   <li>Arithmetic: -a</li>
 *   <li>Null tests: a IS NULL, a IS NOT NULL</li>
 * </ul>
 *
 * <p>Null tests never return null themselves; NOT and negation propagate null.
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NOT("NOT"),
        NEGATE("-"),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isPostfix() {
            return this == IS_NULL || this == IS_NOT_NULL;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        if (operator == Operator.NEGATE) {
            return operand.dataType();
        }
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        if (operator.isPostfix()) {
            return false;
        }
        return operand.nullable();
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(operand);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new UnaryExpression(operator, newChildren.get(0));
    }

    @Override
    public String toSQL() {
        if (operator.isPostfix()) {
            return String.format("(%s %s)", operand.toSQL(), operator.symbol());
        }
        if (operator == Operator.NOT) {
            return String.format("(NOT %s)", operand.toSQL());
        }
        return String.format("(-%s)", operand.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }
}
