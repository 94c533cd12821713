package io.github.cyfko.jsonquery.core.api;

import java.util.Locale;

/**
 * Logical combinators a filter node can stand for.
 * <p>
 * The literal strings that select a role in a filter tree are configured through
 * {@link io.github.cyfko.jsonquery.core.config.OperatorAliases}; by default each role is
 * selected by its lower-case name.
 * </p>
 *
 * <ul>
 *   <li>{@link #AND} / {@link #OR}: {@code value} is a sequence of child nodes</li>
 *   <li>{@link #NOT}: {@code value} is exactly one child node</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum LogicalRole {

    /** Conjunction of every child. */
    AND,

    /** Disjunction of every child. */
    OR,

    /** Negation of a single child. */
    NOT;

    /**
     * Returns the alias used when no explicit alias is configured for this role.
     *
     * @return the lower-case role name ({@code "and"}, {@code "or"}, {@code "not"})
     */
    public String defaultAlias() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Indicates whether nodes of this role carry a sequence of children.
     *
     * @return {@code true} for {@link #AND} and {@link #OR}
     */
    public boolean takesSequence() {
        return this != NOT;
    }
}
