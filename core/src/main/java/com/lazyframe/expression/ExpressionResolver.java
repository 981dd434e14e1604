package com.lazyframe.expression;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.exception.TypeMismatchException;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeInferenceEngine;

/**
 * Binds column names to the fields of an input schema and type-checks the
 * resulting expression.
 *
 * <p>Resolution happens when a plan node is built, so a bad column name or an
 * incompatible comparison fails before anything is executed.
 */
public final class ExpressionResolver {

    private ExpressionResolver() {}

    /**
     * Resolves and type-checks an expression against a schema.
     *
     * @param expr the expression, possibly containing {@link UnresolvedColumn}s
     * @param schema the input schema
     * @return a fully resolved expression
     * @throws SchemaException if a column does not exist
     * @throws TypeMismatchException if operand types are incompatible
     */
    public static Expression resolve(Expression expr, StructType schema) {
        Expression resolved = ExpressionUtils.transform(expr, e -> bind(e, schema));
        ExpressionUtils.transform(resolved, ExpressionResolver::check);
        return resolved;
    }

    /**
     * Resolves an expression that must evaluate to boolean.
     *
     * @param predicate the predicate
     * @param schema the input schema
     * @return the resolved predicate
     * @throws TypeMismatchException if the predicate is not boolean
     */
    public static Expression resolvePredicate(Expression predicate, StructType schema) {
        Expression resolved = resolve(predicate, schema);
        if (!(resolved.dataType() instanceof BooleanType)) {
            throw new TypeMismatchException("Predicate must be boolean, got "
                + resolved.dataType().typeName() + ": " + resolved.toSQL(),
                BooleanType.get(), resolved.dataType());
        }
        return resolved;
    }

    private static Expression bind(Expression expr, StructType schema) {
        String name;
        if (expr instanceof UnresolvedColumn) {
            name = ((UnresolvedColumn) expr).columnName();
        } else if (expr instanceof ColumnReference) {
            name = ((ColumnReference) expr).columnName();
        } else {
            return expr;
        }
        StructField field = schema.fieldByName(name);
        if (field == null) {
            throw SchemaException.columnNotFound(name, schema);
        }
        ColumnReference bound = new ColumnReference(name, field.dataType(), field.nullable());
        return bound.equals(expr) ? expr : bound;
    }

    private static Expression check(Expression expr) {
        if (expr instanceof BinaryExpression) {
            checkBinary((BinaryExpression) expr);
        } else if (expr instanceof UnaryExpression) {
            checkUnary((UnaryExpression) expr);
        } else if (expr instanceof InExpression) {
            InExpression in = (InExpression) expr;
            DataType testType = in.testExpr().dataType();
            for (Expression value : in.values()) {
                requireComparable(testType, value.dataType(), in);
            }
        } else if (expr instanceof CastExpression) {
            CastExpression cast = (CastExpression) expr;
            DataType source = cast.expression().dataType();
            boolean supported = source.equals(cast.targetType())
                || source instanceof StringType
                || cast.targetType() instanceof StringType
                || (TypeInferenceEngine.isNumeric(source) && TypeInferenceEngine.isNumeric(cast.targetType()));
            if (!supported) {
                throw new TypeMismatchException("Cannot cast " + source.typeName() + " to "
                    + cast.targetType().typeName(), source, cast.targetType());
            }
        } else if (expr instanceof FunctionCall) {
            // The registry validates arity and argument types
            expr.dataType();
        }
        return expr;
    }

    private static void checkBinary(BinaryExpression bin) {
        DataType left = bin.left().dataType();
        DataType right = bin.right().dataType();
        BinaryExpression.Operator op = bin.operator();
        if (op.isComparison()) {
            requireComparable(left, right, bin);
        } else if (op.isLogical()) {
            if (!(left instanceof BooleanType) || !(right instanceof BooleanType)) {
                throw new TypeMismatchException(op.symbol() + " requires boolean operands: " + bin.toSQL(),
                    left, right);
            }
        } else if (!TypeInferenceEngine.isNumeric(left) || !TypeInferenceEngine.isNumeric(right)) {
            throw new TypeMismatchException("Arithmetic requires numeric operands: " + bin.toSQL(),
                left, right);
        }
    }

    private static void checkUnary(UnaryExpression unary) {
        DataType type = unary.operand().dataType();
        if (unary.operator() == UnaryExpression.Operator.NOT && !(type instanceof BooleanType)) {
            throw new TypeMismatchException("NOT requires a boolean operand: " + unary.toSQL(),
                BooleanType.get(), type);
        }
        if (unary.operator() == UnaryExpression.Operator.NEGATE && !TypeInferenceEngine.isNumeric(type)) {
            throw new TypeMismatchException("Negation requires a numeric operand: " + unary.toSQL(),
                type, null);
        }
    }

    private static void requireComparable(DataType left, DataType right, Expression context) {
        if (!TypeInferenceEngine.isComparable(left, right)) {
            throw new TypeMismatchException(String.format("Cannot compare %s with %s in %s",
                left.typeName(), right.typeName(), context.toSQL()), left, right);
        }
    }
}
