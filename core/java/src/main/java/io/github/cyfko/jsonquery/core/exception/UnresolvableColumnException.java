package io.github.cyfko.jsonquery.core.exception;

/**
 * Raised when a comparison node names a column that is neither declared in the
 * {@link io.github.cyfko.jsonquery.core.config.TypeConstraints} nor, when schema fallback
 * is enabled, found with a usable type in the backend schema.
 *
 * @since 1.0.0
 */
public class UnresolvableColumnException extends FilterCompilationException {

    private final String column;

    public UnresolvableColumnException(String column) {
        super(String.format("Column '%s' cannot be resolved", column));
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
