package org.semantic.term;

import java.util.List;

/**
 * Per-language capability that exposes the immediate children of a parsed term.
 * This is the only thing the evaluator needs to know about a front-end's syntax tree.
 *
 * @param <T> Term type produced by the front-end.
 */
@FunctionalInterface
public interface ITermDecomposer<T> {

    /**
     * Returns the immediate children of a term, in source order.
     *
     * @param term The term to decompose.
     * @return The children; an empty list for leaves.
     */
    List<T> children(T term);
}
