package io.github.cyfko.jsonquery.core.config;

import io.github.cyfko.jsonquery.core.exception.IllegalConstraintException;
import io.github.cyfko.jsonquery.core.utils.ConfigUtils;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural limits enforced while compiling a filter tree, protecting the backend against
 * oversized or adversarial input.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxBreadth</strong>: maximum number of direct children of one logical node</li>
 *   <li><strong>maxDepth</strong>: maximum nesting level of any node, the root being level 1</li>
 *   <li><strong>maxElements</strong>: maximum number of nodes (logical and comparison) in the tree</li>
 * </ul>
 * <p>
 * A value of {@code 0} means unbounded. Limits are enforced, not advisory: a violation aborts
 * the compilation with a {@link io.github.cyfko.jsonquery.core.exception.QueryLimitException}.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default: at most 64 elements, breadth and depth unbounded
 * QueryLimits limits = QueryLimits.defaults();
 *
 * // Strict (for public APIs with untrusted input)
 * QueryLimits limits = QueryLimits.strict();
 *
 * // Relaxed (for internal trusted systems)
 * QueryLimits limits = QueryLimits.relaxed();
 *
 * // Custom
 * QueryLimits limits = QueryLimits.builder()
 *     .maxDepth(32)
 *     .maxElements(64)
 *     .build();
 *
 * // From a decoded configuration document; absent keys keep their default
 * QueryLimits limits = QueryLimits.fromMap(Map.of("depth", 32));
 * }</pre>
 *
 * @param maxBreadth  maximum children per logical node, {@code 0} for unbounded
 * @param maxDepth    maximum nesting level, {@code 0} for unbounded
 * @param maxElements maximum node count, {@code 0} for unbounded
 * @since 1.0.0
 */
public record QueryLimits(int maxBreadth, int maxDepth, int maxElements) {

    /** Element limit applied when none is configured. */
    public static final int DEFAULT_MAX_ELEMENTS = 64;

    private static final Set<String> KEYS = Set.of("breadth", "depth", "elements");

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalConstraintException if any limit is negative
     */
    public QueryLimits {
        requireNonNegative(maxBreadth, "breadth");
        requireNonNegative(maxDepth, "depth");
        requireNonNegative(maxElements, "elements");
    }

    /**
     * Default limits: {@value #DEFAULT_MAX_ELEMENTS} elements, breadth and depth unbounded.
     *
     * @return default limits
     */
    public static QueryLimits defaults() {
        return new QueryLimits(0, 0, DEFAULT_MAX_ELEMENTS);
    }

    /**
     * Limits for filters coming from untrusted clients.
     * <ul>
     *   <li>Max Breadth: 16</li>
     *   <li>Max Depth: 8</li>
     *   <li>Max Elements: 32</li>
     * </ul>
     *
     * @return strict limits
     */
    public static QueryLimits strict() {
        return new QueryLimits(16, 8, 32);
    }

    /**
     * Limits for internal, trusted callers.
     * <ul>
     *   <li>Max Breadth: unbounded</li>
     *   <li>Max Depth: 64</li>
     *   <li>Max Elements: 1024</li>
     * </ul>
     *
     * @return relaxed limits
     */
    public static QueryLimits relaxed() {
        return new QueryLimits(0, 64, 1024);
    }

    /**
     * No structural limit at all. The compiler still never overflows the thread stack.
     *
     * @return unbounded limits
     */
    public static QueryLimits unbounded() {
        return new QueryLimits(0, 0, 0);
    }

    /**
     * Reads limits from a configuration map with the keys {@code breadth}, {@code depth} and
     * {@code elements}.
     * <p>
     * Keys that are absent keep their {@link #defaults() default}; a key mapped to {@code null}
     * or {@code 0} is unbounded.
     * </p>
     *
     * @param config the configuration map
     * @return the limits
     * @throws IllegalConstraintException if a key is unknown or a value is not a non-negative integer
     */
    public static QueryLimits fromMap(Map<String, ?> config) {
        if (config == null) {
            throw new IllegalConstraintException("Query limits configuration cannot be null");
        }
        ConfigUtils.requireKnownKeys(config, KEYS, "query limit");

        QueryLimits defaults = defaults();
        return new QueryLimits(
                config.containsKey("breadth") ? ConfigUtils.toLimit(config.get("breadth"), "breadth") : defaults.maxBreadth(),
                config.containsKey("depth") ? ConfigUtils.toLimit(config.get("depth"), "depth") : defaults.maxDepth(),
                config.containsKey("elements") ? ConfigUtils.toLimit(config.get("elements"), "elements") : defaults.maxElements()
        );
    }

    /**
     * Creates a builder initialised with the {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public boolean isBreadthBounded() { return maxBreadth > 0; }
    public boolean isDepthBounded() { return maxDepth > 0; }
    public boolean isElementsBounded() { return maxElements > 0; }

    private static void requireNonNegative(int value, String what) {
        if (value < 0) {
            throw new IllegalConstraintException(String.format(
                    "Limit '%s' must be positive or 0 (unbounded), got %d", what, value));
        }
    }

    public static class Builder {
        private int _maxBreadth = 0;
        private int _maxDepth = 0;
        private int _maxElements = DEFAULT_MAX_ELEMENTS;

        private Builder() {}

        public QueryLimits build() {
            return new QueryLimits(_maxBreadth, _maxDepth, _maxElements);
        }

        public Builder maxBreadth(int maxBreadth) { this._maxBreadth = maxBreadth; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
        public Builder maxElements(int maxElements) { this._maxElements = maxElements; return this; }

        public Builder from(QueryLimits limits) {
            Objects.requireNonNull(limits, "limits");
            this._maxBreadth = limits.maxBreadth();
            this._maxDepth = limits.maxDepth();
            this._maxElements = limits.maxElements();
            return this;
        }
    }
}
