package org.semantic.term;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * One layer of a term: the term itself plus its immediate children in some shape.
 * An algebra sees a node whose children are {@link Subterm}s.
 *
 * @param term     The term this layer was projected from.
 * @param children The children, in source order.
 * @param <T>      Term type.
 * @param <C>      Child shape.
 */
public record Node<T, C>(T term, List<C> children) {

    public Node {
        Objects.requireNonNull(term, "term");
        children = List.copyOf(children);
    }

    /**
     * Transforms every child, keeping the term.
     */
    public <D> Node<T, D> map(Function<? super C, ? extends D> f) {
        List<D> mapped = new ArrayList<>(children.size());
        for (C child : children) {
            mapped.add(f.apply(child));
        }
        return new Node<>(term, mapped);
    }

    public C child(int index) {
        return children.get(index);
    }

    public int arity() {
        return children.size();
    }
}
