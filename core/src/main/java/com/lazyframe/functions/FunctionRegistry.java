package com.lazyframe.functions;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.exception.TypeMismatchException;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DateType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.TypeInferenceEngine;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Registry of built-in scalar functions.
 *
 * <p>Function categories:
 * <ul>
 *   <li>Date functions: year, month, dayofmonth</li>
 *   <li>String functions: upper, lower, trim, length</li>
 *   <li>Math functions: abs</li>
 *   <li>Conditional functions: coalesce</li>
 * </ul>
 *
 * <p>Aggregate functions are not scalar and live on
 * {@link com.lazyframe.logical.Aggregate.AggregateExpression}.
 */
public final class FunctionRegistry {

    private static final Map<String, ScalarFunction> FUNCTIONS = new TreeMap<>();

    static {
        initializeDateFunctions();
        initializeStringFunctions();
        initializeMathFunctions();
        initializeConditionalFunctions();
    }

    private FunctionRegistry() {
        // Utility class - prevent instantiation
    }

    /**
     * Looks up a function by name (case-insensitive).
     *
     * @param functionName the function name
     * @return the function
     * @throws SchemaException if no such function exists
     */
    public static ScalarFunction lookup(String functionName) {
        ScalarFunction function = FUNCTIONS.get(functionName.toLowerCase());
        if (function == null) {
            throw new SchemaException("Unknown function: " + functionName
                + ". Supported functions: " + FUNCTIONS.keySet());
        }
        return function;
    }

    public static boolean isSupported(String functionName) {
        return functionName != null && FUNCTIONS.containsKey(functionName.toLowerCase());
    }

    public static Set<String> functionNames() {
        return Collections.unmodifiableSet(FUNCTIONS.keySet());
    }

    private static void register(ScalarFunction function) {
        FUNCTIONS.put(function.name(), function);
    }

    // ==================== Date Functions ====================

    private static void initializeDateFunctions() {
        register(unary("year", DateType.get(), IntegerType.get(), v -> ((LocalDate) v).getYear()));
        register(unary("month", DateType.get(), IntegerType.get(), v -> ((LocalDate) v).getMonthValue()));
        register(unary("dayofmonth", DateType.get(), IntegerType.get(), v -> ((LocalDate) v).getDayOfMonth()));
    }

    // ==================== String Functions ====================

    private static void initializeStringFunctions() {
        register(unary("upper", StringType.get(), StringType.get(), v -> ((String) v).toUpperCase()));
        register(unary("lower", StringType.get(), StringType.get(), v -> ((String) v).toLowerCase()));
        register(unary("trim", StringType.get(), StringType.get(), v -> ((String) v).trim()));
        register(unary("length", StringType.get(), IntegerType.get(), v -> ((String) v).length()));
    }

    // ==================== Math Functions ====================

    private static void initializeMathFunctions() {
        register(new ScalarFunction() {
            @Override
            public String name() {
                return "abs";
            }

            @Override
            public DataType returnType(List<DataType> argumentTypes) {
                checkArity(name(), argumentTypes, 1);
                DataType type = argumentTypes.get(0);
                if (!TypeInferenceEngine.isNumeric(type)) {
                    throw new TypeMismatchException("abs requires a numeric argument, got " + type);
                }
                return type;
            }

            @Override
            public Object invoke(Object[] arguments) {
                Object value = arguments[0];
                if (value instanceof Long) {
                    return Math.abs((Long) value);
                }
                if (value instanceof Integer) {
                    return Math.abs((Integer) value);
                }
                return Math.abs((Double) value);
            }
        });
    }

    // ==================== Conditional Functions ====================

    private static void initializeConditionalFunctions() {
        register(new ScalarFunction() {
            @Override
            public String name() {
                return "coalesce";
            }

            @Override
            public DataType returnType(List<DataType> argumentTypes) {
                if (argumentTypes.isEmpty()) {
                    throw new TypeMismatchException("coalesce requires at least one argument");
                }
                DataType result = argumentTypes.get(0);
                for (DataType type : argumentTypes) {
                    if (!TypeInferenceEngine.isComparable(result, type)) {
                        throw new TypeMismatchException(
                            "coalesce arguments must share a type", result, type);
                    }
                    if (TypeInferenceEngine.isNumeric(type)) {
                        result = TypeInferenceEngine.promoteNumericTypes(result, type);
                    }
                }
                return result;
            }

            @Override
            public Object invoke(Object[] arguments) {
                for (Object argument : arguments) {
                    if (argument != null) {
                        return argument;
                    }
                }
                return null;
            }

            @Override
            public boolean nullIntolerant() {
                return false;
            }
        });
    }

    // ==================== Helpers ====================

    private static ScalarFunction unary(String name, DataType argType, DataType resultType,
                                        Function<Object, Object> body) {
        return new ScalarFunction() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public DataType returnType(List<DataType> argumentTypes) {
                checkArity(name, argumentTypes, 1);
                if (!argType.equals(argumentTypes.get(0))) {
                    throw new TypeMismatchException(String.format("%s requires a %s argument, got %s",
                        name, argType.typeName(), argumentTypes.get(0)), argType, argumentTypes.get(0));
                }
                return resultType;
            }

            @Override
            public Object invoke(Object[] arguments) {
                return body.apply(arguments[0]);
            }
        };
    }

    private static void checkArity(String name, List<DataType> argumentTypes, int expected) {
        if (argumentTypes.size() != expected) {
            throw new TypeMismatchException(String.format("%s expects %d argument(s), got %d",
                name, expected, argumentTypes.size()));
        }
    }
}
