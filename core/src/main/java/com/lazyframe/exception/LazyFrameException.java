package com.lazyframe.exception;

/**
 * Base class of all exceptions raised by the engine.
 *
 * <p>All engine exceptions are unchecked. Build-time errors ({@link SchemaException},
 * {@link TypeMismatchException}) are raised while a plan is being composed, before
 * any data is read. Planning and execution errors abort the run that raised them.
 * Nothing is retried internally.
 */
public class LazyFrameException extends RuntimeException {

    public LazyFrameException(String message) {
        super(message);
    }

    public LazyFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
