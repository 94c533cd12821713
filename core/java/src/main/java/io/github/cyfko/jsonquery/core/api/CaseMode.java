package io.github.cyfko.jsonquery.core.api;

import java.util.Optional;

/**
 * Case handling of a string match, selected by the {@code case} field of a comparison node.
 *
 * @since 1.0.0
 */
public enum CaseMode {

    /** Case-sensitive match. */
    STRICT("strict"),

    /** Case-insensitive match. */
    IGNORE("ignore");

    private final String symbol;

    CaseMode(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<CaseMode> fromSymbol(String value) {
        for (CaseMode mode : values()) {
            if (mode.symbol.equals(value)) return Optional.of(mode);
        }
        return Optional.empty();
    }
}
