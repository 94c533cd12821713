package io.github.cyfko.jsonquery.core.api;

/**
 * Outcome of compiling one filter tree.
 *
 * @param predicate    the combined backend predicate for the root node
 * @param elementCount the number of nodes in the tree
 * @param <P>          backend predicate type
 * @since 1.0.0
 */
public record CompiledFilter<P>(P predicate, int elementCount) {
}
