package io.github.cyfko.jsonquery.core.api;

import java.util.Optional;

/**
 * String match operators accepted on {@link ColumnType#STRING} columns.
 * <p>
 * Each mode turns the user-supplied search string into a backend pattern by placing the
 * backend's wildcard character. The search string itself is passed through verbatim:
 * a literal wildcard inside it keeps its wildcard meaning.
 * </p>
 *
 * <pre>{@code
 * MatchMode.PREFIX.toPattern("Hello", '%');   // "Hello%"
 * MatchMode.SUFFIX.toPattern("World", '%');   // "%World"
 * MatchMode.ANY.toPattern("World", '%');      // "%World%"
 * MatchMode.STRICT.toPattern("Hello", '%');   // "Hello"
 * }</pre>
 *
 * @since 1.0.0
 * @see CaseMode
 */
public enum MatchMode {

    /** Column starts with the value. */
    PREFIX("match-prefix"),

    /** Column ends with the value. */
    SUFFIX("match-suffix"),

    /** Column contains the value. */
    ANY("match-any"),

    /** Column equals the value (modulo case mode). */
    STRICT("match-strict");

    private final String symbol;

    MatchMode(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Builds the search pattern for this mode.
     *
     * @param value    the search string, unescaped
     * @param wildcard the backend's multi-character wildcard
     * @return the pattern to hand to the backend
     */
    public String toPattern(String value, char wildcard) {
        return switch (this) {
            case PREFIX -> value + wildcard;
            case SUFFIX -> wildcard + value;
            case ANY -> wildcard + value + wildcard;
            case STRICT -> value;
        };
    }

    /**
     * Finds the mode whose symbol equals {@code value} exactly.
     *
     * @param value the operator literal from a filter node
     * @return the matching mode, or empty
     */
    public static Optional<MatchMode> fromSymbol(String value) {
        for (MatchMode mode : values()) {
            if (mode.symbol.equals(value)) return Optional.of(mode);
        }
        return Optional.empty();
    }
}
