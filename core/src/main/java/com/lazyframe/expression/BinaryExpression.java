package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.TypeInferenceEngine;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a % b</li>
 *   <li>Comparison: a > b, a >= b, a < b, a <= b, a = b, a != b</li>
 *   <li>Logical: a AND b, a OR b</li>
 * </ul>
 *
 * <p>Comparisons and arithmetic return null when either operand is null. AND and
 * OR follow three-valued logic: {@code FALSE AND NULL} is false and
 * {@code TRUE OR NULL} is true.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Arithmetic operators
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),

        // Comparison operators
        EQUAL("="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUAL(">="),

        // Logical operators
        AND("AND"),
        OR("OR");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == MODULO;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        /**
         * Returns the operator that gives the same result with the operands
         * swapped, e.g. {@code a < b} is {@code b > a}.
         *
         * @return the mirrored comparison operator
         * @throws IllegalStateException if this is not a comparison
         */
        public Operator flip() {
            switch (this) {
                case LESS_THAN: return GREATER_THAN;
                case LESS_THAN_OR_EQUAL: return GREATER_THAN_OR_EQUAL;
                case GREATER_THAN: return LESS_THAN;
                case GREATER_THAN_OR_EQUAL: return LESS_THAN_OR_EQUAL;
                case EQUAL: return EQUAL;
                case NOT_EQUAL: return NOT_EQUAL;
                default: throw new IllegalStateException("Not a comparison: " + this);
            }
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        if (operator.isComparison() || operator.isLogical()) {
            return BooleanType.get();
        }
        if (operator == Operator.DIVIDE) {
            return DoubleType.get();
        }
        return TypeInferenceEngine.promoteNumericTypes(left.dataType(), right.dataType());
    }

    @Override
    public boolean nullable() {
        // Division by zero yields null
        return left.nullable() || right.nullable() || operator == Operator.DIVIDE
            || operator == Operator.MODULO;
    }

    @Override
    public List<Expression> children() {
        return Arrays.asList(left, right);
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new BinaryExpression(newChildren.get(0), operator, newChildren.get(1));
    }

    @Override
    public String toSQL() {
        return String.format("(%s %s %s)", left.toSQL(), operator.symbol(), right.toSQL());
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               operator == that.operator &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.SUBTRACT, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MULTIPLY, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.DIVIDE, right);
    }

    public static BinaryExpression modulo(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.MODULO, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    public static BinaryExpression lessThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }

    public static BinaryExpression greaterThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }
}
