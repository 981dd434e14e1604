package com.lazyframe.api;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.FunctionCall;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.logical.Aggregate.AggregateExpression;
import com.lazyframe.types.DataType;
import java.util.ArrayList;
import java.util.List;

/**
 * Static factories for columns, literals, aggregates and scalar functions.
 */
public final class functions {

    private functions() {}

    // Columns and literals

    public static Column col(String name) {
        return new Column(new UnresolvedColumn(name));
    }

    public static Column lit(Object value) {
        return new Column(Literal.of(value));
    }

    /**
     * Returns a typed NULL literal.
     */
    public static Column nullLit(DataType type) {
        return new Column(new Literal(null, type));
    }

    public static Column not(Column column) {
        return new Column(UnaryExpression.not(column.expr()));
    }

    // Aggregates

    public static Column max(Column column) {
        return aggregate("MAX", column, false);
    }

    public static Column min(Column column) {
        return aggregate("MIN", column, false);
    }

    public static Column sum(Column column) {
        return aggregate("SUM", column, false);
    }

    public static Column avg(Column column) {
        return aggregate("AVG", column, false);
    }

    public static Column count(Column column) {
        return aggregate("COUNT", column, false);
    }

    public static Column countDistinct(Column column) {
        return aggregate("COUNT", column, true);
    }

    public static Column countStar() {
        return new Column(new AggregateExpression("COUNT", null, "count(*)"));
    }

    private static Column aggregate(String function, Column column, boolean distinct) {
        String alias = function.toLowerCase() + "(" + (distinct ? "DISTINCT " : "") + column + ")";
        return new Column(new AggregateExpression(function, column.expr(), alias, distinct));
    }

    // Scalar functions

    public static Column year(Column column) {
        return call("year", column);
    }

    public static Column month(Column column) {
        return call("month", column);
    }

    public static Column dayofmonth(Column column) {
        return call("dayofmonth", column);
    }

    public static Column upper(Column column) {
        return call("upper", column);
    }

    public static Column lower(Column column) {
        return call("lower", column);
    }

    public static Column trim(Column column) {
        return call("trim", column);
    }

    public static Column length(Column column) {
        return call("length", column);
    }

    public static Column abs(Column column) {
        return call("abs", column);
    }

    public static Column coalesce(Column... columns) {
        return call("coalesce", columns);
    }

    /**
     * Calls a registered scalar function by name.
     *
     * @param name the function name
     * @param arguments the arguments
     * @return the call
     */
    public static Column call(String name, Column... arguments) {
        List<Expression> args = new ArrayList<>(arguments.length);
        for (Column argument : arguments) {
            args.add(argument.expr());
        }
        return new Column(new FunctionCall(name, args));
    }
}
