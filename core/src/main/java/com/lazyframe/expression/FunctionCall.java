package com.lazyframe.expression;

import com.lazyframe.functions.FunctionRegistry;
import com.lazyframe.types.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a call to a built-in scalar function.
 *
 * <p>Examples:
 * <pre>
 *   year(date)                 -- date function
 *   upper(state)               -- string function
 *   coalesce(cases, 0L)        -- conditional function
 * </pre>
 *
 * <p>The return type is derived from the argument types through
 * {@link FunctionRegistry}, so it is only available once the arguments are
 * resolved.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name (case-insensitive)
     * @param arguments the function arguments
     */
    public FunctionCall(String functionName, List<Expression> arguments) {
        Objects.requireNonNull(functionName, "functionName must not be null");
        if (functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.functionName = functionName.toLowerCase();
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public DataType dataType() {
        List<DataType> argumentTypes = new ArrayList<>(arguments.size());
        for (Expression argument : arguments) {
            argumentTypes.add(argument.dataType());
        }
        return FunctionRegistry.lookup(functionName).returnType(argumentTypes);
    }

    @Override
    public boolean nullable() {
        boolean nullIntolerant = FunctionRegistry.isSupported(functionName)
            && FunctionRegistry.lookup(functionName).nullIntolerant();
        if (nullIntolerant) {
            return arguments.stream().anyMatch(Expression::nullable);
        }
        return arguments.stream().allMatch(Expression::nullable);
    }

    @Override
    public List<Expression> children() {
        return arguments();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return new FunctionCall(functionName, newChildren);
    }

    @Override
    public String toSQL() {
        return functionName + "(" + arguments.stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }
}
