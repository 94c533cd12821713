package io.github.cyfko.jsonquery.core.api;

import java.util.Optional;

/**
 * Binary comparison operators accepted on {@link ColumnType#NUMERIC} columns.
 *
 * <p><strong>Symbol mappings:</strong></p>
 * <ul>
 *     <li>LT / &lt;</li>
 *     <li>LTE / &lt;=</li>
 *     <li>EQ / ==</li>
 *     <li>NE / !=</li>
 *     <li>GTE / &gt;=</li>
 *     <li>GT / &gt;</li>
 * </ul>
 *
 * <pre>{@code
 * NumericOperator op = NumericOperator.fromSymbol(">=").orElseThrow();  // GTE
 * NumericOperator.fromSymbol("GTE");                                     // empty: symbols only
 * }</pre>
 *
 * @since 1.0.0
 */
public enum NumericOperator {

    /** Less than: "&lt;" */
    LT("<"),

    /** Less than or equal: "&lt;=" */
    LTE("<="),

    /** Equality: "==" */
    EQ("=="),

    /** Inequality: "!=" */
    NE("!="),

    /** Greater than or equal: "&gt;=" */
    GTE(">="),

    /** Greater than: "&gt;" */
    GT(">");

    private final String symbol;

    NumericOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the literal used for this operator in a filter tree.
     *
     * @return the operator symbol
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Finds the operator whose symbol equals {@code value} exactly (case-sensitive, no trimming).
     *
     * @param value the operator literal from a filter node
     * @return the matching operator, or empty if {@code value} is not a numeric operator
     */
    public static Optional<NumericOperator> fromSymbol(String value) {
        for (NumericOperator op : values()) {
            if (op.symbol.equals(value)) return Optional.of(op);
        }
        return Optional.empty();
    }
}
