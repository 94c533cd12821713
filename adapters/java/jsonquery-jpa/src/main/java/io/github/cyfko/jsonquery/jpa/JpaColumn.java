package io.github.cyfko.jsonquery.jpa;

import java.util.Objects;

/**
 * A basic, single-valued attribute of an entity, as resolved from the JPA metamodel.
 *
 * @param name     the attribute name
 * @param javaType the attribute's Java type, primitives replaced by their wrapper
 * @since 1.0.0
 */
public record JpaColumn(String name, Class<?> javaType) {

    public JpaColumn {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(javaType, "javaType cannot be null");
    }
}
