package io.github.cyfko.jsonquery.core.spi;

import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.api.MatchMode;
import io.github.cyfko.jsonquery.core.api.NumericOperator;
import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;

import java.util.*;

/**
 * Immutable mapping of operator literals to {@link CustomOperatorProvider} instances.
 * <p>
 * Unlike a process-wide registry, one instance belongs to one
 * {@link io.github.cyfko.jsonquery.core.QueryResolver}, so two resolvers can give the same
 * literal different meanings and no registration can change a resolver after construction.
 * </p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * CustomOperatorRegistry<JpaColumn, PredicateResolver<User>> operators =
 *     CustomOperatorRegistry.<JpaColumn, PredicateResolver<User>>builder()
 *         .register(new SoundexProvider())
 *         .build();
 *
 * Optional<CustomOperatorProvider<...>> provider = operators.find("soundex", ColumnType.STRING);
 * }</pre>
 *
 * @param <H> backend column handle type
 * @param <P> backend predicate type
 * @since 1.0.0
 */
public final class CustomOperatorRegistry<H, P> {

    private static final CustomOperatorRegistry<?, ?> EMPTY = new CustomOperatorRegistry<>(Map.of());

    private final Map<String, CustomOperatorProvider<H, P>> providers;

    private CustomOperatorRegistry(Map<String, CustomOperatorProvider<H, P>> providers) {
        this.providers = Collections.unmodifiableMap(providers);
    }

    @SuppressWarnings("unchecked")
    public static <H, P> CustomOperatorRegistry<H, P> empty() {
        return (CustomOperatorRegistry<H, P>) EMPTY;
    }

    public static <H, P> Builder<H, P> builder() {
        return new Builder<>();
    }

    /**
     * Looks up the provider of an operator for a column type.
     *
     * @param operator the operator literal
     * @param type     the column's type
     * @return the provider, or empty if the literal is unregistered or the provider does not support {@code type}
     */
    public Optional<CustomOperatorProvider<H, P>> find(String operator, ColumnType type) {
        CustomOperatorProvider<H, P> provider = providers.get(operator);
        if (provider == null || !provider.supportedTypes().contains(type)) {
            return Optional.empty();
        }
        return Optional.of(provider);
    }

    /**
     * Returns every registered operator literal.
     *
     * @return an unmodifiable set of operator literals
     */
    public Set<String> operators() {
        return providers.keySet();
    }

    public boolean isEmpty() {
        return providers.isEmpty();
    }

    public static final class Builder<H, P> {
        private final Map<String, CustomOperatorProvider<H, P>> providers = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers a provider for each of its supported operators.
         *
         * @param provider the provider
         * @return this builder
         * @throws IllegalConstraintException if the provider declares no operator or type, an
         *         operator is blank, built in, or already registered
         */
        public Builder<H, P> register(CustomOperatorProvider<H, P> provider) {
            if (provider == null) {
                throw new IllegalConstraintException("Custom operator provider cannot be null");
            }
            Set<String> operators = provider.supportedOperators();
            if (operators == null || operators.isEmpty()) {
                throw new IllegalConstraintException("Custom operator provider declares no operator");
            }
            Set<ColumnType> types = provider.supportedTypes();
            if (types == null || types.isEmpty() || types.contains(ColumnType.UNKNOWN)) {
                throw new IllegalConstraintException(
                        "Custom operator provider must support STRING and/or NUMERIC columns, got " + types);
            }

            for (String operator : operators) {
                if (operator == null || operator.isBlank()) {
                    throw new IllegalConstraintException("Custom operator cannot be null nor blank");
                }
                if (NumericOperator.fromSymbol(operator).isPresent() || MatchMode.fromSymbol(operator).isPresent()) {
                    throw new IllegalConstraintException("Operator [" + operator + "] is built in and cannot be overridden.");
                }
                if (providers.putIfAbsent(operator, provider) != null) {
                    throw new IllegalConstraintException("Operator [" + operator + "] is already registered.");
                }
            }
            return this;
        }

        public CustomOperatorRegistry<H, P> build() {
            return new CustomOperatorRegistry<>(new LinkedHashMap<>(providers));
        }
    }
}
