package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an unresolved column reference.
 *
 * <p>User code builds expressions before it knows the schema they will be applied
 * to ({@code col("cases")}). Builders on {@code DataFrame} replace every
 * unresolved column with a typed {@link ColumnReference} against the current
 * node's output schema, failing with a {@code SchemaException} if the column does
 * not exist.
 */
public final class UnresolvedColumn implements Expression {

    private final String columnName;

    /**
     * Creates an unresolved column reference.
     *
     * @param columnName the column name
     */
    public UnresolvedColumn(String columnName) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Unresolved columns have no type yet.
     *
     * @throws IllegalStateException always
     */
    @Override
    public DataType dataType() {
        throw new IllegalStateException("Column is not resolved: " + columnName);
    }

    @Override
    public boolean nullable() {
        return true;
    }

    @Override
    public boolean resolved() {
        return false;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public Expression withNewChildren(List<Expression> newChildren) {
        return this;
    }

    @Override
    public String toSQL() {
        return "'" + columnName;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnresolvedColumn)) return false;
        return columnName.equals(((UnresolvedColumn) obj).columnName);
    }

    @Override
    public int hashCode() {
        return columnName.hashCode();
    }
}
