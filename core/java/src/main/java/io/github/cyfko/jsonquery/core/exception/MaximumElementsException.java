package io.github.cyfko.jsonquery.core.exception;

/**
 * Raised when the total number of nodes in a filter tree would exceed {@code maxElements}.
 *
 * @since 1.0.0
 */
public class MaximumElementsException extends QueryLimitException {

    public MaximumElementsException(int maxElements) {
        super(String.format("Filter elements limit (%d) exceeded", maxElements), maxElements);
    }
}
