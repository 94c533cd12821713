package io.github.cyfko.jsonquery.core.compiler;

import io.github.cyfko.jsonquery.core.api.LogicalRole;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable bookkeeping of one compilation: the running element count and the stack of logical
 * nodes whose children are still being compiled.
 * <p>
 * One instance exists per {@link FilterCompiler#compile compile} call and never escapes it.
 * </p>
 *
 * @param <P> backend predicate type
 */
final class CompileState<P> {

    private final Deque<Frame<P>> stack = new ArrayDeque<>();
    private int elementCount;

    /** Counts a newly visited node and returns the running total. */
    int visit() {
        return ++elementCount;
    }

    int elementCount() {
        return elementCount;
    }

    void push(Frame<P> frame) {
        stack.push(frame);
    }

    Frame<P> peek() {
        return stack.peek();
    }

    Frame<P> pop() {
        return stack.pop();
    }

    boolean isEmpty() {
        return stack.isEmpty();
    }

    /**
     * A logical node in progress.
     * <p>
     * {@code role} is {@code null} for the synthetic frame holding the root node, whose single
     * collected predicate is the compilation result.
     * </p>
     */
    static final class Frame<P> {
        final LogicalRole role;
        final List<?> children;
        final int depth;
        final List<P> predicates;
        private int next;

        Frame(LogicalRole role, List<?> children, int depth) {
            this.role = role;
            this.children = children;
            this.depth = depth;
            this.predicates = new ArrayList<>(children.size());
        }

        boolean hasNext() {
            return next < children.size();
        }

        Object nextChild() {
            return children.get(next++);
        }
    }
}
