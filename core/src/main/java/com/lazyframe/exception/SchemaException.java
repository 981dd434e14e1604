package com.lazyframe.exception;

import com.lazyframe.types.StructType;
import java.util.List;

/**
 * Thrown when a plan references a column that does not exist in its input
 * schema, or when an operation would produce an ambiguous schema.
 *
 * <p>Always raised at plan build time.
 */
public class SchemaException extends LazyFrameException {

    private final String columnName;

    public SchemaException(String message) {
        super(message);
        this.columnName = null;
    }

    public SchemaException(String message, String columnName) {
        super(message);
        this.columnName = columnName;
    }

    /**
     * Creates the exception for a column missing from a schema, listing the
     * available columns in the message.
     *
     * @param columnName the missing column
     * @param schema the schema that was searched
     * @return the exception
     */
    public static SchemaException columnNotFound(String columnName, StructType schema) {
        List<String> available = schema.fieldNames();
        return new SchemaException(
            "Column '" + columnName + "' not found. Available columns: " + available, columnName);
    }

    /**
     * Returns the offending column name.
     *
     * @return the column name, or null if the error is not about a single column
     */
    public String columnName() {
        return columnName;
    }
}
