package com.lazyframe.exception;

import com.lazyframe.types.DataType;

/**
 * Thrown when operand types are incompatible: join keys of different types, a
 * comparison between a string and a number, a non-boolean filter predicate.
 *
 * <p>Always raised at plan build time.
 */
public class TypeMismatchException extends LazyFrameException {

    private final DataType leftType;
    private final DataType rightType;

    public TypeMismatchException(String message) {
        this(message, null, null);
    }

    public TypeMismatchException(String message, DataType leftType, DataType rightType) {
        super(message);
        this.leftType = leftType;
        this.rightType = rightType;
    }

    public DataType leftType() {
        return leftType;
    }

    public DataType rightType() {
        return rightType;
    }
}
