package io.github.cyfko.jsonquery.core.exception;

/**
 * Raised when a node sits deeper than {@code maxDepth} levels below the root.
 *
 * @since 1.0.0
 */
public class MaximumDepthException extends QueryLimitException {

    public MaximumDepthException(int maxDepth) {
        super(String.format("Depth limit (%d) exceeded", maxDepth), maxDepth);
    }
}
