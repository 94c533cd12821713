package io.github.cyfko.jsonquery.core.utils;

import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Helpers shared by the configuration records to normalise loosely-typed configuration values.
 * <p>
 * Configuration may come from code or from a decoded JSON/YAML document, where a list of
 * names is often written as a single string when it has only one entry. These helpers accept
 * both forms and fail with {@link IllegalConstraintException} on anything else.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigUtils {

    private static final BigDecimal MAX_LIMIT = BigDecimal.valueOf(Integer.MAX_VALUE);

    private ConfigUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Flattens a single name or a collection of names into an ordered, unmodifiable set.
     *
     * @param value a {@link String}, a {@link Collection} of strings, an array of strings, or {@code null}
     * @param what  description of the setting, used in error messages
     * @return the names in input order, duplicates removed; empty when {@code value} is {@code null}
     * @throws IllegalConstraintException if an entry is not a non-blank string
     */
    public static Set<String> toNameSet(Object value, String what) {
        if (value == null) {
            return Set.of();
        }

        Collection<?> entries;
        if (value instanceof String single) {
            entries = List.of(single);
        } else if (value instanceof Collection<?> collection) {
            entries = collection;
        } else if (value instanceof String[] array) {
            entries = Arrays.asList(array);
        } else {
            throw new IllegalConstraintException(String.format(
                    "%s must be a string or a list of strings, got %s", what, value.getClass().getSimpleName()));
        }

        Set<String> names = new LinkedHashSet<>();
        for (Object entry : entries) {
            if (!(entry instanceof String name) || name.isBlank()) {
                throw new IllegalConstraintException(String.format(
                        "%s contains an invalid entry: %s", what, entry == null ? "null" : "'" + entry + "'"));
            }
            names.add(name);
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Reads a structural limit from a configuration value.
     *
     * @param value a non-negative integral {@link Number}, or {@code null} for unbounded
     * @param what  name of the limit, used in error messages
     * @return the limit, {@code 0} meaning unbounded
     * @throws IllegalConstraintException if the value is not a non-negative integer
     */
    public static int toLimit(Object value, String what) {
        if (value == null) {
            return 0;
        }
        if (!(value instanceof Number number) || value instanceof Double || value instanceof Float) {
            throw new IllegalConstraintException(String.format(
                    "Limit '%s' must be an integer, got '%s'", what, value));
        }
        BigDecimal limit;
        if (value instanceof BigDecimal decimal) {
            limit = decimal;
        } else if (value instanceof BigInteger integer) {
            limit = new BigDecimal(integer);
        } else {
            limit = BigDecimal.valueOf(number.longValue());
        }
        if (limit.signum() != 0 && limit.stripTrailingZeros().scale() > 0) {
            throw new IllegalConstraintException(String.format(
                    "Limit '%s' must be an integer, got '%s'", what, value));
        }
        if (limit.signum() < 0 || limit.compareTo(MAX_LIMIT) > 0) {
            throw new IllegalConstraintException(String.format(
                    "Limit '%s' must be between 0 and %d, got %s", what, Integer.MAX_VALUE, value));
        }
        return limit.intValueExact();
    }

    /**
     * Rejects configuration keys outside {@code allowed}.
     *
     * @param config  the configuration map
     * @param allowed the accepted keys
     * @param what    description of the configuration, used in error messages
     * @throws IllegalConstraintException if an unknown key is present
     */
    public static void requireKnownKeys(Map<String, ?> config, Set<String> allowed, String what) {
        for (String key : config.keySet()) {
            if (!allowed.contains(key)) {
                throw new IllegalConstraintException(String.format(
                        "Unknown %s key '%s'. Accepted keys: %s", what, key, new TreeSet<>(allowed)));
            }
        }
    }
}
