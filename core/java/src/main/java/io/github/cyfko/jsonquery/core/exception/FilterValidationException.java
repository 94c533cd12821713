package io.github.cyfko.jsonquery.core.exception;

/**
 * Exception thrown when a filter node is malformed with respect to its classification.
 * <p>
 * The node has a recognisable operator and column, but its shape or value does not
 * fit: a missing {@code value} key, a sequence where a single node or scalar is expected,
 * a {@code null} value on a non-nullable column, a value of the wrong type, or a
 * missing/unknown {@code case} on a string column.
 * </p>
 *
 * <p><strong>Validation Error Examples:</strong></p>
 * <pre>{@code
 * // NOT applied to a sequence
 * {"operator": "not", "value": [{"column": "age", "operator": "==", "value": 10}]}
 * // -> "Cannot apply NOT to a sequence"
 *
 * // null on a non-nullable column
 * {"column": "age", "operator": "==", "value": null}
 * // -> "Column 'age' is not nullable"
 *
 * // string column without case mode
 * {"column": "name", "operator": "match-any", "value": "bob"}
 * // -> "String column 'name' requires a 'case' of [strict, ignore]"
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterValidationException extends FilterCompilationException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the malformed node
     */
    public FilterValidationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the malformed node
     * @param cause   the original cause (e.g. a {@link ClassCastException} from a backend conversion)
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
