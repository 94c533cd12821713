package io.github.cyfko.jsonquery.core.spi;

import io.github.cyfko.jsonquery.core.api.ColumnSpec;
import io.github.cyfko.jsonquery.core.api.ColumnType;

import java.util.Set;

/**
 * Contract for comparison operators beyond the built-in numeric operators and match modes.
 * <p>
 * Providers are registered in a {@link CustomOperatorRegistry} handed to the
 * {@link io.github.cyfko.jsonquery.core.QueryResolver}. The compiler consults them only for
 * operator literals that are not built in for the column's type.
 * </p>
 * <p>
 * <strong>Validation Strategy:</strong> the compiler has already checked the column and its
 * nullability. The provider validates the value itself and throws
 * {@link io.github.cyfko.jsonquery.core.exception.FilterValidationException} with a clear
 * message when it does not fit.
 * </p>
 *
 * <h3>Example Implementation:</h3>
 * <pre>{@code
 * public class BetweenTenProvider implements CustomOperatorProvider<String, String> {
 *     public Set<String> supportedOperators() { return Set.of("~="); }
 *     public Set<ColumnType> supportedTypes() { return Set.of(ColumnType.NUMERIC); }
 *
 *     public String toPredicate(FilterBackend<String, String, ?> backend, ColumnSpec<String> column,
 *                               String operator, Object value) {
 *         if (!(value instanceof Number n)) {
 *             throw new FilterValidationException("~= requires a number");
 *         }
 *         return backend.and(List.of(
 *                 backend.compare(column.handle(), NumericOperator.GTE, n.intValue() - 10),
 *                 backend.compare(column.handle(), NumericOperator.LTE, n.intValue() + 10)));
 *     }
 * }
 * }</pre>
 *
 * @param <H> backend column handle type
 * @param <P> backend predicate type
 * @since 1.0.0
 */
public interface CustomOperatorProvider<H, P> {

    /**
     * Returns the operator literals handled by this provider (exact, case-sensitive).
     *
     * @return a non-null, non-empty set of operator literals
     */
    Set<String> supportedOperators();

    /**
     * Returns the column types this provider can filter.
     *
     * @return a non-empty subset of {@link ColumnType#STRING} and {@link ColumnType#NUMERIC}
     */
    Set<ColumnType> supportedTypes();

    /**
     * Builds the predicate for one comparison node.
     *
     * @param backend  the backend, for building and combining predicates
     * @param column   the resolved column
     * @param operator the operator literal, one of {@link #supportedOperators()}
     * @param value    the node value, possibly {@code null} on a nullable column
     * @return the predicate
     */
    P toPredicate(FilterBackend<H, P, ?> backend, ColumnSpec<H> column, String operator, Object value);
}
