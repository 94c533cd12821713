package io.github.cyfko.jsonquery.core;

import io.github.cyfko.jsonquery.core.api.ColumnSpec;
import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.api.LogicalRole;
import io.github.cyfko.jsonquery.core.config.OperatorAliases;
import io.github.cyfko.jsonquery.core.config.QueryLimits;
import io.github.cyfko.jsonquery.core.config.TypeConstraints;
import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;
import io.github.cyfko.jsonquery.core.spi.CustomOperatorRegistry;
import io.github.cyfko.jsonquery.core.spi.FilterBackend;

import java.util.*;
import java.util.logging.Logger;

/**
 * Immutable compile configuration bound to one backend schema.
 * <p>
 * A {@code QueryResolver} gathers everything the {@link io.github.cyfko.jsonquery.core.compiler.FilterCompiler}
 * needs to turn an untrusted filter tree into a predicate: the backend, the logical operator
 * aliases, the column type table, the structural limits, and the custom operators. It is built
 * once, typically at application start-up, and then shared by every compilation.
 * </p>
 *
 * <h2>Construction Checks</h2>
 * <ul>
 *   <li>Backend, aliases and type constraints are mandatory</li>
 *   <li>Every typed column must be resolvable by the backend</li>
 *   <li>A typed column the backend can type must have the declared type</li>
 *   <li>No custom operator may reuse a logical alias</li>
 * </ul>
 * <p>
 * Any violation is a deployment defect and raises {@link IllegalConstraintException}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * QueryResolver<JpaColumn, PredicateResolver<User>, TypedQuery<User>> resolver = new QueryResolver<>(
 *     new JpaFilterBackend<>(em, User.class),
 *     OperatorAliases.defaults(),
 *     TypeConstraints.builder().string("name").numeric("age").build(),
 *     QueryLimits.strict());
 *
 * TypedQuery<User> query = FilterCompiler.apply(resolver, filter);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable and safe to share, provided the backend is.
 * </p>
 *
 * @param <H> backend column handle type
 * @param <P> backend predicate type
 * @param <R> backend filter application result type
 * @since 1.0.0
 */
public final class QueryResolver<H, P, R> {

    private static final Logger logger = Logger.getLogger(QueryResolver.class.getName());

    private final FilterBackend<H, P, R> backend;
    private final OperatorAliases aliases;
    private final TypeConstraints types;
    private final QueryLimits limits;
    private final CustomOperatorRegistry<H, P> customOperators;
    private final Map<String, ColumnSpec<H>> columns;

    public QueryResolver(FilterBackend<H, P, R> backend, OperatorAliases aliases, TypeConstraints types) {
        this(backend, aliases, types, QueryLimits.defaults());
    }

    public QueryResolver(FilterBackend<H, P, R> backend, OperatorAliases aliases, TypeConstraints types,
                         QueryLimits limits) {
        this(backend, aliases, types, limits, CustomOperatorRegistry.empty());
    }

    /**
     * Creates a resolver.
     *
     * @param backend         the backend providing columns and predicates
     * @param aliases         the logical operator aliases
     * @param types           the column type table
     * @param limits          the structural limits, {@link QueryLimits#defaults()} when {@code null}
     * @param customOperators extra comparison operators, none when {@code null}
     * @throws IllegalConstraintException if a mandatory argument is missing, a typed column cannot
     *         be resolved or its backend type contradicts the declared one, or a custom operator
     *         collides with a logical alias
     */
    public QueryResolver(FilterBackend<H, P, R> backend, OperatorAliases aliases, TypeConstraints types,
                         QueryLimits limits, CustomOperatorRegistry<H, P> customOperators) {
        if (backend == null) {
            throw new IllegalConstraintException("Filter backend cannot be null");
        }
        if (aliases == null) {
            throw new IllegalConstraintException("Operator aliases cannot be null");
        }
        if (types == null) {
            throw new IllegalConstraintException("Type constraints cannot be null");
        }

        this.backend = backend;
        this.aliases = aliases;
        this.types = types;
        this.limits = limits != null ? limits : QueryLimits.defaults();
        this.customOperators = customOperators != null ? customOperators : CustomOperatorRegistry.empty();

        for (String operator : this.customOperators.operators()) {
            if (aliases.roleOf(operator).isPresent()) {
                throw new IllegalConstraintException(
                        "Custom operator '" + operator + "' collides with a logical operator alias");
            }
        }

        Map<String, ColumnSpec<H>> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, ColumnType> entry : types.columns().entrySet()) {
            String name = entry.getKey();
            H handle = backend.resolveColumn(name)
                    .orElseThrow(() -> new IllegalConstraintException(
                            "Column '" + name + "' is declared but cannot be resolved by the backend"));
            ColumnType actual = backend.columnType(handle);
            if (actual != ColumnType.UNKNOWN && actual != entry.getValue()) {
                throw new IllegalConstraintException(String.format(
                        "Column '%s' is declared %s but the backend reports %s", name, entry.getValue(), actual));
            }
            resolved.put(name, new ColumnSpec<>(name, handle, entry.getValue(), types.isNullable(name)));
        }
        this.columns = Collections.unmodifiableMap(resolved);

        logger.fine(() -> String.format("Query resolver ready: %d column(s), limits %s, %d custom operator(s), schema fallback %s",
                columns.size(), this.limits, this.customOperators.operators().size(), types.schemaFallback()));
    }

    /**
     * Finds the column a comparison refers to.
     * <p>
     * Declared columns are looked up first. With schema fallback enabled, an undeclared column is
     * resolved and typed by the backend on each call; it is never nullable and is ignored when
     * the backend reports an {@link ColumnType#UNKNOWN} type.
     * </p>
     *
     * @param name the column name
     * @return the column, or empty if it cannot be filtered on
     */
    public Optional<ColumnSpec<H>> findColumn(String name) {
        ColumnSpec<H> declared = columns.get(name);
        if (declared != null || !types.schemaFallback()) {
            return Optional.ofNullable(declared);
        }

        return backend.resolveColumn(name).flatMap(handle -> {
            ColumnType type = backend.columnType(handle);
            return type == ColumnType.UNKNOWN
                    ? Optional.empty()
                    : Optional.of(new ColumnSpec<>(name, handle, type, false));
        });
    }

    public Set<String> aliasesFor(LogicalRole role) {
        return aliases.aliasesFor(role);
    }

    public Optional<LogicalRole> roleOf(String operator) {
        return aliases.roleOf(operator);
    }

    /**
     * Returns the type of a column, including schema fallback.
     *
     * @param column the column name
     * @return the type, {@link ColumnType#UNKNOWN} if the column cannot be filtered on
     */
    public ColumnType typeOf(String column) {
        return findColumn(column).map(ColumnSpec::type).orElse(ColumnType.UNKNOWN);
    }

    public boolean isNullable(String column) {
        return types.isNullable(column);
    }

    public QueryLimits limits() {
        return limits;
    }

    public FilterBackend<H, P, R> backend() {
        return backend;
    }

    public CustomOperatorRegistry<H, P> customOperators() {
        return customOperators;
    }

    /**
     * Returns the declared columns, resolved against the backend.
     *
     * @return an unmodifiable map of column name to column, in declaration order
     */
    public Map<String, ColumnSpec<H>> columns() {
        return columns;
    }
}
