package io.github.cyfko.jsonquery.core.compiler;

import io.github.cyfko.jsonquery.core.QueryResolver;
import io.github.cyfko.jsonquery.core.api.*;
import io.github.cyfko.jsonquery.core.config.QueryLimits;
import io.github.cyfko.jsonquery.core.exception.*;
import io.github.cyfko.jsonquery.core.model.FilterNode;
import io.github.cyfko.jsonquery.core.spi.CustomOperatorProvider;
import io.github.cyfko.jsonquery.core.spi.FilterBackend;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Compiles a decoded filter tree into a single backend predicate.
 * <p>
 * The tree is walked depth-first, left to right. Every node is counted and checked against
 * the resolver's {@link QueryLimits} before it is interpreted, so an oversized tree is rejected
 * as soon as the walk reaches the offending node. Logical nodes are kept on an explicit stack
 * rather than the call stack, which bounds the memory used by deep trees to the heap.
 * </p>
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each node (depth = parent depth + 1, root depth = 1):
 *   - count the node
 *   - check depth, then breadth, then count + breadth against the limits
 *   - AND / OR alias: compile every child in order, combine with backend.and / backend.or
 *   - NOT alias:      compile the single child, wrap with backend.not
 *   - otherwise:      comparison on a typed column
 * </pre>
 * <p>
 * Breadth is the number of children of an AND / OR node, {@code 1} for a NOT node and
 * {@code 0} for a comparison.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Map<String, Object> filter = Map.of(
 *     "operator", "and",
 *     "value", List.of(
 *         Map.of("column", "age", "operator", ">=", "value", 18),
 *         Map.of("column", "name", "operator", "match-prefix", "value", "Jo", "case", "ignore")));
 *
 * CompiledFilter<PredicateResolver<User>> compiled = FilterCompiler.compile(resolver, filter);
 * TypedQuery<User> query = FilterCompiler.apply(resolver, filter);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless. Every call owns its own {@link CompileState}.
 * </p>
 *
 * @since 1.0.0
 * @see QueryResolver
 * @see FilterBackend
 */
public final class FilterCompiler {

    private static final Logger logger = Logger.getLogger(FilterCompiler.class.getName());

    private FilterCompiler() {
        // Utility class - prevent instantiation
    }

    /**
     * Compiles a filter tree into a predicate.
     *
     * @param resolver the compile configuration
     * @param filter   the root node of the decoded filter tree
     * @return the predicate and the number of nodes compiled
     * @throws QueryLimitException          if the tree exceeds a structural limit
     * @throws FilterValidationException    if a node is malformed or a value has the wrong type
     * @throws UnknownOperatorException     if a comparison operator is not supported for its column
     * @throws UnresolvableColumnException  if a comparison refers to an unknown column
     * @throws NullPointerException         if {@code resolver} is null
     */
    public static <H, P> CompiledFilter<P> compile(QueryResolver<H, P, ?> resolver, Object filter) {
        if (resolver == null) {
            throw new NullPointerException("resolver cannot be null");
        }

        CompileState<P> state = new CompileState<>();
        CompileState.Frame<P> root = new CompileState.Frame<>(null, List.of(filter), 0);
        state.push(root);

        while (true) {
            CompileState.Frame<P> frame = state.peek();
            if (frame.hasNext()) {
                enter(resolver, state, frame, frame.nextChild());
                continue;
            }

            state.pop();
            if (state.isEmpty()) {
                break;
            }
            state.peek().predicates.add(combine(resolver.backend(), frame));
        }

        int elements = state.elementCount();
        logger.fine(() -> String.format("Compiled filter of %d element(s)", elements));
        return new CompiledFilter<>(root.predicates.get(0), elements);
    }

    /**
     * Compiles a filter tree and applies it through the backend.
     *
     * @param resolver the compile configuration
     * @param filter   the root node of the decoded filter tree
     * @return the backend's result for the compiled predicate
     * @throws FilterCompilationException if the tree is rejected; the backend is then never asked to apply anything
     */
    public static <H, P, R> R apply(QueryResolver<H, P, R> resolver, Object filter) {
        CompiledFilter<P> compiled = compile(resolver, filter);
        return resolver.backend().applyFilter(compiled.predicate());
    }

    private static <H, P> void enter(QueryResolver<H, P, ?> resolver, CompileState<P> state,
                                     CompileState.Frame<P> parent, Object raw) {
        FilterNode node = FilterNode.of(raw);
        Optional<LogicalRole> role = resolver.roleOf(node.operator());
        Object value = node.value();

        int breadth;
        if (role.isEmpty()) {
            breadth = 0;
        } else if (role.get().takesSequence() && value instanceof List<?> children) {
            breadth = children.size();
        } else {
            breadth = 1;
        }

        int depth = parent.depth + 1;
        checkLimits(resolver.limits(), state.visit(), depth, breadth);

        if (role.isEmpty()) {
            parent.predicates.add(compileComparison(resolver, node));
            return;
        }

        switch (role.get()) {
            case AND, OR -> {
                if (!(value instanceof List<?> children)) {
                    throw new FilterValidationException(String.format(
                            "Operator '%s' requires a list of filters, got %s", node.operator(), describe(value)));
                }
                state.push(new CompileState.Frame<>(role.get(), children, depth));
            }
            case NOT -> {
                if (value instanceof List) {
                    throw new FilterValidationException(String.format(
                            "Operator '%s': cannot apply NOT to a sequence", node.operator()));
                }
                state.push(new CompileState.Frame<>(LogicalRole.NOT, Collections.singletonList(value), depth));
            }
        }
    }

    private static void checkLimits(QueryLimits limits, int count, int depth, int breadth) {
        if (limits.isDepthBounded() && depth > limits.maxDepth()) {
            throw new MaximumDepthException(limits.maxDepth());
        }
        if (limits.isBreadthBounded() && breadth > limits.maxBreadth()) {
            throw new MaximumBreadthException(limits.maxBreadth());
        }
        if (limits.isElementsBounded() && (long) count + breadth > limits.maxElements()) {
            throw new MaximumElementsException(limits.maxElements());
        }
    }

    private static <H, P> P combine(FilterBackend<H, P, ?> backend, CompileState.Frame<P> frame) {
        return switch (frame.role) {
            case AND -> backend.and(List.copyOf(frame.predicates));
            case OR -> backend.or(List.copyOf(frame.predicates));
            case NOT -> backend.not(frame.predicates.get(0));
        };
    }

    private static <H, P> P compileComparison(QueryResolver<H, P, ?> resolver, FilterNode node) {
        String name = node.column();
        ColumnSpec<H> column = resolver.findColumn(name)
                .orElseThrow(() -> new UnresolvableColumnException(name));

        String operator = node.operator();
        Object value = node.value();
        if (value instanceof List || value instanceof Map) {
            // only custom operators take structured values
            CustomOperatorProvider<H, P> provider = resolver.customOperators()
                    .find(operator, column.type())
                    .orElseThrow(() -> new FilterValidationException(String.format(
                            "Column '%s' cannot be compared to a %s", name, describe(value))));
            return provider.toPredicate(resolver.backend(), column, operator, value);
        }

        FilterBackend<H, P, ?> backend = resolver.backend();
        if (value == null) {
            return compileNullCheck(resolver, column, operator);
        }

        switch (column.type()) {
            case NUMERIC -> {
                Optional<NumericOperator> op = NumericOperator.fromSymbol(operator);
                if (op.isPresent()) {
                    if (!(value instanceof Number number)) {
                        throw new FilterValidationException(String.format(
                                "Numeric column '%s' requires a number, got %s", name, describe(value)));
                    }
                    return backend.compare(column.handle(), op.get(), number);
                }
            }
            case STRING -> {
                Optional<MatchMode> mode = MatchMode.fromSymbol(operator);
                if (mode.isPresent()) {
                    CaseMode caseMode = caseModeOf(node, name);
                    if (!(value instanceof String text)) {
                        throw new FilterValidationException(String.format(
                                "String column '%s' requires a string, got %s", name, describe(value)));
                    }
                    return backend.stringMatch(column.handle(), caseMode, mode.get().toPattern(text, backend.wildcard()));
                }
            }
            default -> throw new IllegalStateException("Column '" + name + "' has no filterable type");
        }

        return compileCustom(resolver, column, operator, value);
    }

    private static <H, P> P compileNullCheck(QueryResolver<H, P, ?> resolver, ColumnSpec<H> column, String operator) {
        if (!column.nullable()) {
            throw new FilterValidationException(String.format(
                    "Column '%s' is not nullable and cannot be compared to null", column.name()));
        }

        FilterBackend<H, P, ?> backend = resolver.backend();
        Optional<NumericOperator> op = NumericOperator.fromSymbol(operator);
        Optional<MatchMode> mode = MatchMode.fromSymbol(operator);
        if (op.orElse(null) == NumericOperator.EQ || mode.orElse(null) == MatchMode.STRICT) {
            return backend.isNull(column.handle());
        }
        if (op.orElse(null) == NumericOperator.NE) {
            return backend.not(backend.isNull(column.handle()));
        }

        boolean builtIn = column.type() == ColumnType.NUMERIC ? op.isPresent() : mode.isPresent();
        if (builtIn) {
            throw new FilterValidationException(String.format(
                    "Operator '%s' cannot compare column '%s' to null", operator, column.name()));
        }
        return compileCustom(resolver, column, operator, null);
    }

    private static <H, P> P compileCustom(QueryResolver<H, P, ?> resolver, ColumnSpec<H> column,
                                          String operator, Object value) {
        CustomOperatorProvider<H, P> provider = resolver.customOperators()
                .find(operator, column.type())
                .orElseThrow(() -> new UnknownOperatorException(operator, column.name(), column.type()));
        return provider.toPredicate(resolver.backend(), column, operator, value);
    }

    private static CaseMode caseModeOf(FilterNode node, String column) {
        Object raw = node.caseMode();
        if (!(raw instanceof String symbol)) {
            throw new FilterValidationException(String.format(
                    "String comparison on column '%s' requires a '%s' of 'strict' or 'ignore', got %s",
                    column, FilterNode.CASE, describe(raw)));
        }
        return CaseMode.fromSymbol(symbol).orElseThrow(() -> new FilterValidationException(String.format(
                "String comparison on column '%s' has an invalid '%s': '%s'", column, FilterNode.CASE, symbol)));
    }

    private static String describe(Object value) {
        if (value == null) return "null";
        if (value instanceof List) return "list";
        if (value instanceof Map) return "object";
        return value.getClass().getSimpleName();
    }
}
