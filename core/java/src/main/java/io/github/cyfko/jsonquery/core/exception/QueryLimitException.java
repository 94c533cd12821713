package io.github.cyfko.jsonquery.core.exception;

/**
 * Raised when a filter tree violates one of the structural limits of
 * {@link io.github.cyfko.jsonquery.core.config.QueryLimits}.
 * <p>
 * Limits are checked per node, before descending into its children, in the order
 * depth, breadth, elements.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class QueryLimitException extends FilterCompilationException {

    private final int limit;

    protected QueryLimitException(String message, int limit) {
        super(message);
        this.limit = limit;
    }

    /**
     * Returns the configured value of the violated limit.
     *
     * @return the limit that was exceeded
     */
    public int limit() {
        return limit;
    }
}
