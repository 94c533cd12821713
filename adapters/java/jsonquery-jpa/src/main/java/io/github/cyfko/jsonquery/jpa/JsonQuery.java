package io.github.cyfko.jsonquery.jpa;

import io.github.cyfko.jsonquery.core.QueryResolver;
import io.github.cyfko.jsonquery.core.compiler.FilterCompiler;
import io.github.cyfko.jsonquery.core.config.OperatorAliases;
import io.github.cyfko.jsonquery.core.config.QueryLimits;
import io.github.cyfko.jsonquery.core.config.TypeConstraints;
import io.github.cyfko.jsonquery.core.exception.FilterCompilationException;
import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;
import io.github.cyfko.jsonquery.core.spi.CustomOperatorRegistry;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;

/**
 * Entry point for filtering one entity with decoded JSON filters.
 * <p>
 * Binds a {@link JpaFilterBackend} and a {@link QueryResolver} together so that a filter
 * received from a client turns into a {@link TypedQuery} in one call.
 * </p>
 *
 * <pre>{@code
 * JsonQuery<User> users = JsonQuery.of(em, User.class,
 *     OperatorAliases.defaults(),
 *     TypeConstraints.builder().string("name", "email").numeric("age").nullable("email").build(),
 *     QueryLimits.strict());
 *
 * Map<String, Object> filter = objectMapper.readValue(body, new TypeReference<>() {});
 * List<User> result = users.query(filter).setMaxResults(50).getResultList();
 * }</pre>
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
public final class JsonQuery<E> {

    private final QueryResolver<JpaColumn, PredicateResolver<E>, TypedQuery<E>> resolver;

    private JsonQuery(QueryResolver<JpaColumn, PredicateResolver<E>, TypedQuery<E>> resolver) {
        this.resolver = resolver;
    }

    public static <E> JsonQuery<E> of(EntityManager em, Class<E> entityClass,
                                      OperatorAliases aliases, TypeConstraints types) {
        return of(em, entityClass, aliases, types, QueryLimits.defaults());
    }

    public static <E> JsonQuery<E> of(EntityManager em, Class<E> entityClass,
                                      OperatorAliases aliases, TypeConstraints types, QueryLimits limits) {
        return of(em, entityClass, aliases, types, limits, CustomOperatorRegistry.empty());
    }

    /**
     * Creates a query factory for an entity.
     *
     * @param em              the entity manager used to create queries
     * @param entityClass     the entity to filter
     * @param aliases         the logical operator aliases
     * @param types           the filterable attributes
     * @param limits          the structural limits, defaults when {@code null}
     * @param customOperators extra comparison operators, none when {@code null}
     * @return the query factory
     * @throws IllegalConstraintException if the configuration is invalid for this entity
     */
    public static <E> JsonQuery<E> of(EntityManager em, Class<E> entityClass,
                                      OperatorAliases aliases, TypeConstraints types, QueryLimits limits,
                                      CustomOperatorRegistry<JpaColumn, PredicateResolver<E>> customOperators) {
        JpaFilterBackend<E> backend = new JpaFilterBackend<>(em, entityClass);
        return new JsonQuery<>(new QueryResolver<>(backend, aliases, types, limits, customOperators));
    }

    /**
     * Compiles a filter into a query selecting the matching entities.
     *
     * @param filter the decoded filter tree
     * @return the query
     * @throws FilterCompilationException if the filter is rejected
     */
    public TypedQuery<E> query(Object filter) {
        return FilterCompiler.apply(resolver, filter);
    }

    /**
     * Compiles a filter into a predicate, for use in a caller-built criteria query.
     *
     * @param filter the decoded filter tree
     * @return the deferred predicate
     * @throws FilterCompilationException if the filter is rejected
     */
    public PredicateResolver<E> predicate(Object filter) {
        return FilterCompiler.compile(resolver, filter).predicate();
    }

    public QueryResolver<JpaColumn, PredicateResolver<E>, TypedQuery<E>> resolver() {
        return resolver;
    }
}
