package com.lazyframe.exception;

/**
 * Thrown by a run that was cancelled through its execution context.
 */
public class QueryCancelledException extends LazyFrameException {

    public QueryCancelledException(String runId) {
        super("Query run " + runId + " was cancelled");
    }
}
