package io.github.cyfko.jsonquery.core.config;

import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;
import io.github.cyfko.jsonquery.core.utils.ConfigUtils;

import java.util.*;

/**
 * Declared type category and nullability of every filterable column.
 * <p>
 * Columns are declared either as string columns or as numeric columns, and optionally as
 * nullable. Names are exact, case-sensitive strings.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>No column is declared both string and numeric</li>
 *   <li>Every nullable column is also declared string or numeric</li>
 * </ul>
 *
 * <h2>Schema Fallback</h2>
 * <p>
 * By default a column absent from these constraints cannot be filtered on. With
 * {@link Builder#schemaFallback(boolean) schema fallback} enabled, such a column is looked up
 * through the backend's own schema introspection at compile time instead; fallback columns are
 * never nullable.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TypeConstraints types = TypeConstraints.builder()
 *     .string("name", "email")
 *     .numeric("age", "height")
 *     .nullable("email")
 *     .build();
 *
 * TypeConstraints types = TypeConstraints.fromMap(Map.of(
 *     "string", List.of("name", "email"),
 *     "numeric", List.of("age", "height"),
 *     "nullable", "email"));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TypeConstraints {

    private static final Set<String> KEYS = Set.of("string", "numeric", "nullable", "schemaFallback");

    private final Map<String, ColumnType> columns;
    private final Set<String> nullable;
    private final boolean schemaFallback;

    private TypeConstraints(Set<String> strings, Set<String> numerics, Set<String> nullable, boolean schemaFallback) {
        Set<String> overlap = new TreeSet<>(strings);
        overlap.retainAll(numerics);
        if (!overlap.isEmpty()) {
            throw new IllegalConstraintException("Column(s) " + overlap + " declared as both string and numeric");
        }

        Map<String, ColumnType> typed = new LinkedHashMap<>();
        strings.forEach(name -> typed.put(name, ColumnType.STRING));
        numerics.forEach(name -> typed.put(name, ColumnType.NUMERIC));

        Set<String> untyped = new TreeSet<>(nullable);
        untyped.removeAll(typed.keySet());
        if (!untyped.isEmpty()) {
            throw new IllegalConstraintException("Nullable column(s) " + untyped + " have no declared type");
        }

        this.columns = Collections.unmodifiableMap(typed);
        this.nullable = Collections.unmodifiableSet(new LinkedHashSet<>(nullable));
        this.schemaFallback = schemaFallback;
    }

    /**
     * Creates constraints from a configuration map with the keys {@code string}, {@code numeric},
     * {@code nullable} (each a single name or a list of names) and {@code schemaFallback} (boolean).
     *
     * @param config the configuration map
     * @return the validated constraints
     * @throws IllegalConstraintException on unknown keys, malformed values, or a violated invariant
     */
    public static TypeConstraints fromMap(Map<String, ?> config) {
        if (config == null) {
            throw new IllegalConstraintException("Type constraints configuration cannot be null");
        }
        ConfigUtils.requireKnownKeys(config, KEYS, "type constraint");

        Object fallback = config.get("schemaFallback");
        if (fallback != null && !(fallback instanceof Boolean)) {
            throw new IllegalConstraintException("schemaFallback must be a boolean, got '" + fallback + "'");
        }

        return new TypeConstraints(
                ConfigUtils.toNameSet(config.get("string"), "string columns"),
                ConfigUtils.toNameSet(config.get("numeric"), "numeric columns"),
                ConfigUtils.toNameSet(config.get("nullable"), "nullable columns"),
                Boolean.TRUE.equals(fallback)
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the declared type of a column.
     *
     * @param column the column name
     * @return {@link ColumnType#STRING}, {@link ColumnType#NUMERIC}, or {@link ColumnType#UNKNOWN} if undeclared
     */
    public ColumnType typeOf(String column) {
        return columns.getOrDefault(column, ColumnType.UNKNOWN);
    }

    public boolean isNullable(String column) {
        return nullable.contains(column);
    }

    /**
     * Returns every declared column with its type, in declaration order (string columns first).
     *
     * @return unmodifiable column-to-type map
     */
    public Map<String, ColumnType> columns() {
        return columns;
    }

    public Set<String> nullableColumns() {
        return nullable;
    }

    public boolean schemaFallback() {
        return schemaFallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeConstraints other)) return false;
        return schemaFallback == other.schemaFallback
                && columns.equals(other.columns)
                && nullable.equals(other.nullable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, nullable, schemaFallback);
    }

    @Override
    public String toString() {
        return "TypeConstraints{columns=" + columns + ", nullable=" + nullable + ", schemaFallback=" + schemaFallback + '}';
    }

    public static final class Builder {
        private final Set<String> strings = new LinkedHashSet<>();
        private final Set<String> numerics = new LinkedHashSet<>();
        private final Set<String> nullable = new LinkedHashSet<>();
        private boolean schemaFallback = false;

        private Builder() {}

        public Builder string(String... columns) {
            strings.addAll(ConfigUtils.toNameSet(columns, "string columns"));
            return this;
        }

        public Builder numeric(String... columns) {
            numerics.addAll(ConfigUtils.toNameSet(columns, "numeric columns"));
            return this;
        }

        public Builder nullable(String... columns) {
            nullable.addAll(ConfigUtils.toNameSet(columns, "nullable columns"));
            return this;
        }

        public Builder schemaFallback(boolean enabled) {
            this.schemaFallback = enabled;
            return this;
        }

        public TypeConstraints build() {
            return new TypeConstraints(strings, numerics, nullable, schemaFallback);
        }
    }
}
