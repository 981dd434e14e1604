package com.lazyframe.runtime;

import com.lazyframe.data.Row;
import com.lazyframe.exception.QueryExecutionException;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.FunctionCall;
import com.lazyframe.expression.InExpression;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.functions.FunctionRegistry;
import com.lazyframe.functions.ScalarFunction;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DateType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeInferenceEngine;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Compiles resolved expressions into evaluators over rows of a fixed schema.
 *
 * <p>Evaluation follows SQL semantics: arithmetic and comparisons with a
 * null operand yield null, {@code AND}/{@code OR} use three-valued logic,
 * and division or modulo by zero yields null. A {@code TRY_CAST} that cannot
 * convert its input yields null; a strict {@code CAST} fails the query.
 */
public final class ExpressionCompiler {

    private ExpressionCompiler() {}

    /**
     * Compiles an expression against an input schema.
     *
     * @param expr the resolved expression
     * @param schema the schema of the rows it will be evaluated on
     * @return the evaluator
     * @throws SchemaException if a referenced column is not in the schema
     */
    public static CompiledExpression compile(Expression expr, StructType schema) {
        if (expr instanceof ColumnReference) {
            String name = ((ColumnReference) expr).columnName();
            int ordinal = schema.fieldIndex(name);
            if (ordinal < 0) {
                throw SchemaException.columnNotFound(name, schema);
            }
            return row -> row.get(ordinal);
        }
        if (expr instanceof Literal) {
            Object value = ((Literal) expr).value();
            return row -> value;
        }
        if (expr instanceof AliasExpression) {
            return compile(((AliasExpression) expr).expression(), schema);
        }
        if (expr instanceof BinaryExpression) {
            return compileBinary((BinaryExpression) expr, schema);
        }
        if (expr instanceof UnaryExpression) {
            return compileUnary((UnaryExpression) expr, schema);
        }
        if (expr instanceof InExpression) {
            return compileIn((InExpression) expr, schema);
        }
        if (expr instanceof CastExpression) {
            CastExpression cast = (CastExpression) expr;
            CompiledExpression child = compile(cast.expression(), schema);
            DataType target = cast.targetType();
            boolean tryCast = cast.isTryCast();
            return row -> castValue(child.eval(row), target, tryCast);
        }
        if (expr instanceof FunctionCall) {
            return compileFunction((FunctionCall) expr, schema);
        }
        throw new IllegalArgumentException("Cannot evaluate expression: " + expr.toSQL());
    }

    /**
     * Compiles a predicate. A row passes only when the predicate evaluates
     * to TRUE; FALSE and NULL both reject it.
     *
     * @param predicate the resolved boolean expression
     * @param schema the input schema
     * @return the row predicate
     */
    public static Predicate<Row> compilePredicate(Expression predicate, StructType schema) {
        CompiledExpression compiled = compile(predicate, schema);
        return row -> Boolean.TRUE.equals(compiled.eval(row));
    }

    // ==================== Binary ====================

    private static CompiledExpression compileBinary(BinaryExpression bin, StructType schema) {
        CompiledExpression left = compile(bin.left(), schema);
        CompiledExpression right = compile(bin.right(), schema);
        BinaryExpression.Operator op = bin.operator();

        switch (op) {
            case AND:
                return row -> {
                    Object l = left.eval(row);
                    if (Boolean.FALSE.equals(l)) {
                        return false;
                    }
                    Object r = right.eval(row);
                    if (Boolean.FALSE.equals(r)) {
                        return false;
                    }
                    return l == null || r == null ? null : Boolean.TRUE;
                };
            case OR:
                return row -> {
                    Object l = left.eval(row);
                    if (Boolean.TRUE.equals(l)) {
                        return true;
                    }
                    Object r = right.eval(row);
                    if (Boolean.TRUE.equals(r)) {
                        return true;
                    }
                    return l == null || r == null ? null : Boolean.FALSE;
                };
            default:
                break;
        }

        if (op.isComparison()) {
            return row -> {
                Object l = left.eval(row);
                Object r = right.eval(row);
                if (l == null || r == null) {
                    return null;
                }
                int cmp = compareValues(l, r);
                switch (op) {
                    case EQUAL: return cmp == 0;
                    case NOT_EQUAL: return cmp != 0;
                    case LESS_THAN: return cmp < 0;
                    case LESS_THAN_OR_EQUAL: return cmp <= 0;
                    case GREATER_THAN: return cmp > 0;
                    default: return cmp >= 0;
                }
            };
        }

        DataType resultType = bin.dataType();
        return row -> {
            Object l = left.eval(row);
            Object r = right.eval(row);
            if (l == null || r == null) {
                return null;
            }
            return arithmetic(op, (Number) l, (Number) r, resultType);
        };
    }

    private static Object arithmetic(BinaryExpression.Operator op, Number l, Number r, DataType resultType) {
        if (op == BinaryExpression.Operator.DIVIDE) {
            double divisor = r.doubleValue();
            return divisor == 0.0 ? null : l.doubleValue() / divisor;
        }
        if (resultType instanceof DoubleType) {
            double a = l.doubleValue();
            double b = r.doubleValue();
            switch (op) {
                case ADD: return a + b;
                case SUBTRACT: return a - b;
                case MULTIPLY: return a * b;
                default: return b == 0.0 ? null : a % b;
            }
        }
        long a = l.longValue();
        long b = r.longValue();
        long result;
        switch (op) {
            case ADD: result = a + b; break;
            case SUBTRACT: result = a - b; break;
            case MULTIPLY: result = a * b; break;
            default:
                if (b == 0) {
                    return null;
                }
                result = a % b;
        }
        return resultType instanceof IntegerType ? (Object) (int) result : (Object) result;
    }

    // ==================== Unary / IN ====================

    private static CompiledExpression compileUnary(UnaryExpression unary, StructType schema) {
        CompiledExpression operand = compile(unary.operand(), schema);
        switch (unary.operator()) {
            case IS_NULL:
                return row -> operand.eval(row) == null;
            case IS_NOT_NULL:
                return row -> operand.eval(row) != null;
            case NOT:
                return row -> {
                    Object value = operand.eval(row);
                    return value == null ? null : !((Boolean) value);
                };
            default:
                return row -> {
                    Object value = operand.eval(row);
                    if (value instanceof Integer) {
                        return -((Integer) value);
                    }
                    if (value instanceof Long) {
                        return -((Long) value);
                    }
                    return value == null ? null : -((Double) value);
                };
        }
    }

    private static CompiledExpression compileIn(InExpression in, StructType schema) {
        CompiledExpression test = compile(in.testExpr(), schema);
        List<CompiledExpression> values = new ArrayList<>();
        for (Expression value : in.values()) {
            values.add(compile(value, schema));
        }
        boolean negated = in.isNegated();
        return row -> {
            Object t = test.eval(row);
            if (t == null) {
                return null;
            }
            boolean sawNull = false;
            for (CompiledExpression value : values) {
                Object v = value.eval(row);
                if (v == null) {
                    sawNull = true;
                } else if (compareValues(t, v) == 0) {
                    return !negated;
                }
            }
            return sawNull ? null : negated;
        };
    }

    // ==================== Functions ====================

    private static CompiledExpression compileFunction(FunctionCall call, StructType schema) {
        ScalarFunction function = FunctionRegistry.lookup(call.functionName());
        List<CompiledExpression> args = new ArrayList<>();
        for (Expression argument : call.arguments()) {
            args.add(compile(argument, schema));
        }
        DataType resultType = call.dataType();
        boolean nullIntolerant = function.nullIntolerant();
        return row -> {
            Object[] values = new Object[args.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = args.get(i).eval(row);
                if (values[i] == null && nullIntolerant) {
                    return null;
                }
            }
            return TypeInferenceEngine.coerceNumeric(function.invoke(values), resultType);
        };
    }

    // ==================== Casts ====================

    /**
     * Converts a value to a target type.
     *
     * @param value the input value (may be null)
     * @param target the target type
     * @param tryCast whether a failed conversion yields null instead of failing
     * @return the converted value, or null
     * @throws QueryExecutionException if a strict cast fails
     */
    public static Object castValue(Object value, DataType target, boolean tryCast) {
        if (value == null) {
            return null;
        }
        try {
            return convert(value, target);
        } catch (NumberFormatException | DateTimeParseException | ArithmeticException e) {
            if (tryCast) {
                return null;
            }
            throw new QueryExecutionException(String.format("Cannot cast '%s' to %s", value, target.typeName()),
                e, null);
        }
    }

    private static Object convert(Object value, DataType target) {
        if (target.accepts(value)) {
            return value;
        }
        if (target instanceof StringType) {
            return value.toString();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (target instanceof LongType) {
                return Long.parseLong(text);
            }
            if (target instanceof IntegerType) {
                return Integer.parseInt(text);
            }
            if (target instanceof DoubleType) {
                return Double.parseDouble(text);
            }
            if (target instanceof DateType) {
                return LocalDate.parse(text);
            }
            if (target instanceof BooleanType) {
                if (text.equalsIgnoreCase("true")) {
                    return true;
                }
                if (text.equalsIgnoreCase("false")) {
                    return false;
                }
                throw new NumberFormatException("Not a boolean: " + text);
            }
        }
        if (value instanceof Number && TypeInferenceEngine.isNumeric(target)) {
            Number number = (Number) value;
            if (value instanceof Double && !(target instanceof DoubleType)) {
                double d = number.doubleValue();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new ArithmeticException("Cannot convert " + d + " to " + target.typeName());
                }
            }
            if (target instanceof IntegerType) {
                return Math.toIntExact(number.longValue());
            }
            return TypeInferenceEngine.coerceNumeric(number, target);
        }
        throw new ArithmeticException("Unsupported cast from " + value.getClass().getSimpleName()
            + " to " + target.typeName());
    }

    // ==================== Comparison ====================

    /**
     * Compares two non-null values of comparable types. Numbers compare by
     * value across numeric types.
     *
     * @param left the left value
     * @param right the right value
     * @return negative, zero or positive
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareValues(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (left instanceof Double || right instanceof Double) {
                return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
            }
            return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
        }
        return ((Comparable) left).compareTo(right);
    }
}
