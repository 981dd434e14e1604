package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a resolved reference to a column of the input schema.
 *
 * <p>Column references are produced by {@link ExpressionResolver} from
 * {@link UnresolvedColumn}s once the input schema is known, so they always carry
 * the column's type and nullability.
 */
public final class ColumnReference implements Expression {

    private final String columnName;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @param dataType the data type of the column
     * @param nullable whether the column is nullable
     */
    public ColumnReference(String columnName, DataType dataType, boolean nullable) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    /**
     * Creates a nullable column reference.
     *
     * @param columnName the column name
     * @param dataType the data type of the column
     */
    public ColumnReference(String columnName, DataType dataType) {
        this(columnName, dataType, true);
    }

    public String columnName() {
        return columnName;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
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
        return columnName;
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return nullable == that.nullable &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(dataType, that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnName, dataType, nullable);
    }

    /**
     * Creates a nullable column reference.
     *
     * @param columnName the column name
     * @param dataType the data type
     * @return the column reference
     */
    public static ColumnReference of(String columnName, DataType dataType) {
        return new ColumnReference(columnName, dataType);
    }
}
