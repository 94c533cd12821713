package io.github.cyfko.jsonquery.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred JPA predicate produced by compiling a filter tree.
 * <p>
 * Compilation does not need a query: each node becomes a resolver that builds its
 * {@link Predicate} once a {@link Root}, a {@link CriteriaQuery} and a {@link CriteriaBuilder}
 * are available. The same compiled resolver can therefore be applied to several queries, for
 * instance a select and its count.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * PredicateResolver<User> adults = (root, query, cb) -> cb.ge(root.get("age"), 18);
 *
 * CriteriaQuery<Long> count = cb.createQuery(Long.class);
 * Root<User> root = count.from(User.class);
 * count.select(cb.count(root)).where(adults.resolve(root, count, cb));
 * }</pre>
 *
 * @param <E> the entity type
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Builds the predicate for the given query.
     *
     * @param root  the root entity of the query
     * @param query the query under construction
     * @param cb    the criteria builder
     * @return the predicate
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
