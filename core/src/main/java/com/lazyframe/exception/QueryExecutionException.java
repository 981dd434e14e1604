package com.lazyframe.exception;

/**
 * Exception thrown when query execution fails.
 *
 * <p>Wraps failures raised inside worker tasks (for example a strict
 * {@code CAST} on malformed input) together with the plan node that was running.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       List&lt;Row&gt; rows = df.collect();
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getTechnicalMessage());
 *   }
 * </pre>
 */
public class QueryExecutionException extends LazyFrameException {

    private final String failedNode;

    public QueryExecutionException(String message, String failedNode) {
        super(message);
        this.failedNode = failedNode;
    }

    public QueryExecutionException(String message, Throwable cause, String failedNode) {
        super(message, cause);
        this.failedNode = failedNode;
    }

    /**
     * Returns the description of the plan node that failed.
     *
     * @return the node description, or null if not available
     */
    public String getFailedNode() {
        return failedNode;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedNode != null) {
            sb.append("Failed node: ").append(failedNode).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
