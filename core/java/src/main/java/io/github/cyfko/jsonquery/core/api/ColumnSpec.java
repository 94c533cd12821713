package io.github.cyfko.jsonquery.core.api;

import java.util.Objects;

/**
 * A filterable column, resolved once against the backend.
 *
 * @param name     the column name as written in filter nodes
 * @param handle   the backend's handle for the column
 * @param type     the column's type category, never {@link ColumnType#UNKNOWN}
 * @param nullable whether comparisons against {@code null} are accepted
 * @param <H>      backend column handle type
 * @since 1.0.0
 */
public record ColumnSpec<H>(String name, H handle, ColumnType type, boolean nullable) {

    public ColumnSpec {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        if (type == ColumnType.UNKNOWN) {
            throw new IllegalArgumentException("Column '" + name + "' must have a known type");
        }
    }
}
