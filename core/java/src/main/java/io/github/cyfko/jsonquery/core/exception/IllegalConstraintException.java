package io.github.cyfko.jsonquery.core.exception;

/**
 * Exception thrown when the configuration handed to a
 * {@link io.github.cyfko.jsonquery.core.QueryResolver} (or to one of its configuration
 * records) is malformed.
 * <p>
 * This exception is raised only at construction time, before any filter tree is compiled.
 * It signals a programming or deployment defect and must never be confused with a
 * {@link FilterCompilationException}, which rejects untrusted input.
 * </p>
 *
 * <p><strong>Common Causes:</strong></p>
 * <ul>
 *   <li>The backend (schema handle) is missing</li>
 *   <li>One of the logical roles AND / OR / NOT has no alias, or an alias is shared by two roles</li>
 *   <li>A column is declared both as a string and as a numeric column</li>
 *   <li>A declared column cannot be resolved by the backend</li>
 *   <li>A negative structural limit</li>
 * </ul>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * TypeConstraints.builder()
 *     .string("name")
 *     .numeric("name")
 *     .build();
 * // -> "Column(s) [name] declared as both string and numeric"
 * }</pre>
 *
 * @since 1.0.0
 */
public class IllegalConstraintException extends RuntimeException {

    /**
     * Creates a new exception with the given message.
     *
     * @param message explanation of the configuration defect
     */
    public IllegalConstraintException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with the given message and cause.
     *
     * @param message explanation of the configuration defect
     * @param cause   underlying failure (e.g. a backend introspection error)
     */
    public IllegalConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}
