package io.github.cyfko.jsonquery.core.exception;

/**
 * Raised when a logical node has more than {@code maxBreadth} direct children.
 *
 * @since 1.0.0
 */
public class MaximumBreadthException extends QueryLimitException {

    public MaximumBreadthException(int maxBreadth) {
        super(String.format("Breadth limit (%d) exceeded", maxBreadth), maxBreadth);
    }
}
