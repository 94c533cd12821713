package io.github.cyfko.jsonquery.core.exception;

import io.github.cyfko.jsonquery.core.api.ColumnType;

/**
 * Exception thrown when a comparison node uses an operator that is not recognised
 * for the type of its column.
 * <p>
 * Numeric columns accept {@code <, <=, ==, !=, >=, >}; string columns accept
 * {@code match-prefix, match-suffix, match-any, match-strict}. Anything else must be
 * provided by a registered {@link io.github.cyfko.jsonquery.core.spi.CustomOperatorProvider}.
 * </p>
 *
 * <pre>{@code
 * {"column": "age", "operator": "match-any", "value": 3}
 * // -> "Operator 'match-any' is not supported for NUMERIC column 'age'"
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnknownOperatorException extends FilterCompilationException {

    private final String operator;
    private final String column;

    public UnknownOperatorException(String operator, String column, ColumnType type) {
        super(String.format("Operator '%s' is not supported for %s column '%s'", operator, type, column));
        this.operator = operator;
        this.column = column;
    }

    public String getOperator() {
        return operator;
    }

    public String getColumn() {
        return column;
    }
}
