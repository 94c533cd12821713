package io.github.cyfko.jsonquery.core.config;

import io.github.cyfko.jsonquery.core.api.LogicalRole;
import io.github.cyfko.jsonquery.core.api.MatchMode;
import io.github.cyfko.jsonquery.core.api.NumericOperator;
import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;
import io.github.cyfko.jsonquery.core.utils.ConfigUtils;

import java.util.*;

/**
 * Accepted literal strings for each {@link LogicalRole}.
 * <p>
 * A filter node is a logical node if and only if its {@code operator} equals one of these
 * aliases. Comparison is exact and case-sensitive; no trimming or normalisation is applied.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Every role has at least one non-blank alias</li>
 *   <li>No alias belongs to two roles</li>
 *   <li>No alias shadows a built-in comparison operator ({@code ==}, {@code match-any}, ...)</li>
 * </ul>
 * <p>Violations raise {@link IllegalConstraintException} at construction.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * OperatorAliases aliases = OperatorAliases.builder()
 *     .and("and", "&&")
 *     .or("or", "||")
 *     .not("not", "!")
 *     .build();
 *
 * // From a decoded configuration document, single string or list per role
 * OperatorAliases aliases = OperatorAliases.fromMap(Map.of(
 *     "and", List.of("and", "AND"),
 *     "or", "or",
 *     "not", "not"));
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class OperatorAliases {

    private final Map<LogicalRole, Set<String>> aliases;
    private final Map<String, LogicalRole> roles;

    private OperatorAliases(Map<LogicalRole, Set<String>> aliases) {
        Map<LogicalRole, Set<String>> byRole = new EnumMap<>(LogicalRole.class);
        Map<String, LogicalRole> byAlias = new HashMap<>();

        for (LogicalRole role : LogicalRole.values()) {
            Set<String> names = aliases.getOrDefault(role, Set.of());
            if (names.isEmpty()) {
                throw new IllegalConstraintException("No alias configured for logical operator " + role);
            }
            for (String alias : names) {
                if (NumericOperator.fromSymbol(alias).isPresent() || MatchMode.fromSymbol(alias).isPresent()) {
                    throw new IllegalConstraintException(String.format(
                            "Alias '%s' of %s collides with a comparison operator", alias, role));
                }
                LogicalRole previous = byAlias.putIfAbsent(alias, role);
                if (previous != null) {
                    throw new IllegalConstraintException(String.format(
                            "Alias '%s' is configured for both %s and %s", alias, previous, role));
                }
            }
            byRole.put(role, names);
        }

        this.aliases = Collections.unmodifiableMap(byRole);
        this.roles = Collections.unmodifiableMap(byAlias);
    }

    /**
     * Default aliases: {@code "and"}, {@code "or"} and {@code "not"}.
     *
     * @return default aliases
     */
    public static OperatorAliases defaults() {
        Builder builder = builder();
        for (LogicalRole role : LogicalRole.values()) {
            builder.alias(role, role.defaultAlias());
        }
        return builder.build();
    }

    /**
     * Creates aliases from a role-keyed map whose values are a single string or a collection of strings.
     *
     * @param aliases aliases per role
     * @return the validated aliases
     * @throws IllegalConstraintException if a role is missing or an invariant is violated
     */
    public static OperatorAliases of(Map<LogicalRole, ?> aliases) {
        if (aliases == null) {
            throw new IllegalConstraintException("Operator aliases cannot be null");
        }
        Builder builder = builder();
        aliases.forEach((role, value) -> {
            if (role == null) {
                throw new IllegalConstraintException("Operator aliases contain a null role");
            }
            builder.alias(role, ConfigUtils.toNameSet(value, role + " aliases"));
        });
        return builder.build();
    }

    /**
     * Creates aliases from a configuration map keyed by {@code and}, {@code or}, {@code not}.
     *
     * @param config the configuration map
     * @return the validated aliases
     * @throws IllegalConstraintException on unknown keys, a missing role, or a violated invariant
     */
    public static OperatorAliases fromMap(Map<String, ?> config) {
        if (config == null) {
            throw new IllegalConstraintException("Operator aliases configuration cannot be null");
        }
        Map<String, LogicalRole> keys = new HashMap<>();
        for (LogicalRole role : LogicalRole.values()) {
            keys.put(role.defaultAlias(), role);
        }
        ConfigUtils.requireKnownKeys(config, keys.keySet(), "operator alias");

        Map<LogicalRole, Object> byRole = new EnumMap<>(LogicalRole.class);
        config.forEach((key, value) -> byRole.put(keys.get(key), value));
        return of(byRole);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the aliases accepted for a role.
     *
     * @param role the logical role
     * @return the unmodifiable, non-empty alias set
     */
    public Set<String> aliasesFor(LogicalRole role) {
        return aliases.get(Objects.requireNonNull(role, "role"));
    }

    /**
     * Classifies an operator literal.
     *
     * @param operator the {@code operator} of a filter node
     * @return the role it selects, or empty when it is not a logical alias
     */
    public Optional<LogicalRole> roleOf(String operator) {
        return operator == null ? Optional.empty() : Optional.ofNullable(roles.get(operator));
    }

    /**
     * Returns every configured alias.
     *
     * @return an unmodifiable set of all aliases across roles
     */
    public Set<String> allAliases() {
        return roles.keySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OperatorAliases other)) return false;
        return aliases.equals(other.aliases);
    }

    @Override
    public int hashCode() {
        return aliases.hashCode();
    }

    @Override
    public String toString() {
        return "OperatorAliases" + aliases;
    }

    public static final class Builder {
        private final Map<LogicalRole, Set<String>> aliases = new EnumMap<>(LogicalRole.class);

        private Builder() {}

        /**
         * Adds aliases for a role. Repeated calls accumulate.
         */
        public Builder alias(LogicalRole role, String... aliases) {
            return alias(role, ConfigUtils.toNameSet(aliases, role + " aliases"));
        }

        public Builder alias(LogicalRole role, Collection<String> aliases) {
            Objects.requireNonNull(role, "role");
            this.aliases.computeIfAbsent(role, r -> new LinkedHashSet<>())
                    .addAll(ConfigUtils.toNameSet(aliases, role + " aliases"));
            return this;
        }

        public Builder and(String... aliases) { return alias(LogicalRole.AND, aliases); }
        public Builder or(String... aliases) { return alias(LogicalRole.OR, aliases); }
        public Builder not(String... aliases) { return alias(LogicalRole.NOT, aliases); }

        public OperatorAliases build() {
            Map<LogicalRole, Set<String>> copy = new EnumMap<>(LogicalRole.class);
            aliases.forEach((role, names) -> copy.put(role, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
            return new OperatorAliases(copy);
        }
    }
}
