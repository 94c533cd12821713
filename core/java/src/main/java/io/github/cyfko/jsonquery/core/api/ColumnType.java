package io.github.cyfko.jsonquery.core.api;

/**
 * Semantic type category of a filterable column.
 * <p>
 * The category decides which comparison operators a column accepts:
 * {@link NumericOperator} for {@link #NUMERIC}, {@link MatchMode} for {@link #STRING}.
 * {@link #UNKNOWN} columns cannot be filtered.
 * </p>
 *
 * @since 1.0.0
 */
public enum ColumnType {
    STRING,
    NUMERIC,
    UNKNOWN
}
