package io.github.cyfko.jsonquery.core.spi;

import io.github.cyfko.jsonquery.core.api.CaseMode;
import io.github.cyfko.jsonquery.core.api.ColumnType;
import io.github.cyfko.jsonquery.core.api.NumericOperator;

import java.util.List;
import java.util.Optional;

/**
 * Backend-agnostic contract through which the compiler resolves columns and builds predicates.
 * <p>
 * {@code FilterBackend} is the only collaborator of the core. It decouples the compiler from
 * the query technology that eventually runs the filter (a JPA Criteria query, an in-memory
 * collection filter, a search index request, ...). The compiler never inspects a predicate:
 * it only asks the backend to create leaf predicates, to combine them, and finally to apply
 * the root predicate.
 * </p>
 *
 * <h2>Type Parameters</h2>
 * <ul>
 *   <li>{@code H}: column handle, obtained once per column through {@link #resolveColumn(String)}</li>
 *   <li>{@code P}: opaque predicate produced for one node</li>
 *   <li>{@code R}: result of {@link #applyFilter(Object)}, e.g. an executable query</li>
 * </ul>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li>Predicate factories must be side-effect free and synchronous</li>
 *   <li>{@link #and(List)} and {@link #or(List)} receive children in input order and may receive
 *       an empty or singleton list</li>
 *   <li>Patterns given to {@link #stringMatch} already contain {@link #wildcard()} characters
 *       and must not be escaped again</li>
 *   <li>Implementations used by a shared {@link io.github.cyfko.jsonquery.core.QueryResolver}
 *       must be safe for concurrent use</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * class JpaFilterBackend<E> implements FilterBackend<JpaColumn, PredicateResolver<E>, TypedQuery<E>> {
 *     public PredicateResolver<E> compare(JpaColumn column, NumericOperator op, Object value) {
 *         return (root, query, cb) -> switch (op) {
 *             case EQ -> cb.equal(root.get(column.name()), value);
 *             ...
 *         };
 *     }
 *     ...
 * }
 * }</pre>
 *
 * @param <H> column handle type
 * @param <P> predicate type
 * @param <R> filter application result type
 * @since 1.0.0
 */
public interface FilterBackend<H, P, R> {

    /**
     * Resolves a column name against the backend schema.
     *
     * @param name the column name, exact and case-sensitive
     * @return the column handle, or empty if the schema has no such column
     */
    Optional<H> resolveColumn(String name);

    /**
     * Introspects the type category of a resolved column.
     *
     * @param column a handle returned by {@link #resolveColumn(String)}
     * @return {@link ColumnType#STRING}, {@link ColumnType#NUMERIC}, or {@link ColumnType#UNKNOWN} for any other type
     */
    ColumnType columnType(H column);

    /**
     * Builds a binary numeric comparison {@code column <op> value}.
     *
     * @param column the numeric column
     * @param op     the comparison operator
     * @param value  the non-null numeric operand
     * @return the comparison predicate
     */
    P compare(H column, NumericOperator op, Number value);

    /**
     * Builds a pattern match on a string column.
     *
     * @param column   the string column
     * @param caseMode whether the match is case-sensitive
     * @param pattern  the search pattern, wildcards already placed
     * @return the match predicate
     */
    P stringMatch(H column, CaseMode caseMode, String pattern);

    /**
     * Builds a predicate satisfied when the column holds no value.
     *
     * @param column a nullable column
     * @return the null-check predicate
     */
    P isNull(H column);

    /**
     * Combines predicates with logical AND, preserving their order.
     *
     * @param predicates the children, possibly empty
     * @return the conjunction
     */
    P and(List<P> predicates);

    /**
     * Combines predicates with logical OR, preserving their order.
     *
     * @param predicates the children, possibly empty
     * @return the disjunction
     */
    P or(List<P> predicates);

    /**
     * Negates a predicate.
     *
     * @param predicate the predicate to negate
     * @return the negation
     */
    P not(P predicate);

    /**
     * Applies a fully combined root predicate to the backend's query context.
     *
     * @param predicate the root predicate
     * @return the backend's result-producing handle
     */
    R applyFilter(P predicate);

    /**
     * Returns the multi-character wildcard of {@link #stringMatch} patterns.
     *
     * @return the wildcard character, {@code '%'} by default
     */
    default char wildcard() {
        return '%';
    }
}
