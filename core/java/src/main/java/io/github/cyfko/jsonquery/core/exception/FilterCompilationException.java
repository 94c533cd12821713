package io.github.cyfko.jsonquery.core.exception;

/**
 * Base class of every error raised while compiling a filter tree.
 * <p>
 * A compilation error is always fatal to the single
 * {@link io.github.cyfko.jsonquery.core.compiler.FilterCompiler#compile compile} call that raised it:
 * no partial predicate is returned and nothing is retried. The first violation met in a
 * depth-first, left-to-right walk of the tree is the one reported.
 * </p>
 *
 * <p><strong>Best Practice for Handling:</strong></p>
 * <pre>{@code
 * try {
 *     TypedQuery<User> query = JsonQuery.of(em, User.class, aliases, types).query(filter);
 *     return query.getResultList();
 * } catch (FilterCompilationException e) {
 *     // untrusted input: report back to the client
 *     return ResponseEntity.badRequest().body(e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see QueryLimitException
 * @see FilterValidationException
 * @see UnknownOperatorException
 * @see UnresolvableColumnException
 */
public abstract class FilterCompilationException extends RuntimeException {

    protected FilterCompilationException(String message) {
        super(message);
    }

    protected FilterCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
