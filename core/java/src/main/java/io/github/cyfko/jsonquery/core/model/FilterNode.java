package io.github.cyfko.jsonquery.core.model;

import io.github.cyfko.jsonquery.core.exception.FilterValidationException;

import java.util.Map;

/**
 * Validated view over one decoded node of a filter tree.
 * <p>
 * A filter tree arrives as generic decoded JSON: every node is a {@link Map} with a string
 * {@code operator} and a {@code value}. Comparison nodes add a {@code column} and, for string
 * columns, a {@code case}. Whether a node is logical or a comparison is decided solely by its
 * operator, so this view only checks the keys every node shares; {@link #column()} and
 * {@link #caseMode()} are read on demand by the compiler.
 * </p>
 *
 * <h2>Node Shapes</h2>
 * <pre>{@code
 * {"operator": "and", "value": [ ...nodes ]}
 * {"operator": "not", "value": { ...node }}
 * {"column": "age", "operator": ">=", "value": 18}
 * {"column": "name", "operator": "match-prefix", "value": "Jo", "case": "ignore"}
 * }</pre>
 *
 * @param operator the operator literal
 * @param value    the node value, possibly {@code null}
 * @param fields   the raw node
 * @since 1.0.0
 */
public record FilterNode(String operator, Object value, Map<?, ?> fields) {

    public static final String OPERATOR = "operator";
    public static final String VALUE = "value";
    public static final String COLUMN = "column";
    public static final String CASE = "case";

    /**
     * Wraps a decoded node after checking its shared structure.
     *
     * @param raw the decoded node
     * @return the node view
     * @throws FilterValidationException if {@code raw} is not a map, has no string operator, or has no value key
     */
    public static FilterNode of(Object raw) {
        if (!(raw instanceof Map<?, ?> fields)) {
            throw new FilterValidationException("Filter node must be an object, got " + describe(raw));
        }
        Object operator = fields.get(OPERATOR);
        if (!(operator instanceof String op)) {
            throw new FilterValidationException("Filter node requires a string '" + OPERATOR + "', got " + describe(operator));
        }
        if (!fields.containsKey(VALUE)) {
            throw new FilterValidationException("Filter node with operator '" + op + "' has no '" + VALUE + "'");
        }
        return new FilterNode(op, fields.get(VALUE), fields);
    }

    /**
     * Returns the column a comparison node filters on.
     *
     * @return the column name
     * @throws FilterValidationException if the node has no string column
     */
    public String column() {
        Object column = fields.get(COLUMN);
        if (!(column instanceof String name)) {
            throw new FilterValidationException(
                    "Comparison with operator '" + operator + "' requires a string '" + COLUMN + "', got " + describe(column));
        }
        return name;
    }

    /**
     * Returns the raw {@code case} field of a string comparison.
     *
     * @return the case literal, or {@code null} if absent
     */
    public Object caseMode() {
        return fields.get(CASE);
    }

    static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
