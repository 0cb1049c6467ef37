package org.semantic.term;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry mapping concrete term classes to the decomposer of the front-end that produced them.
 * Lets terms from several languages share one evaluation run.
 *
 * @param <T> Common supertype of all registered term classes.
 */
public final class DecomposerRegistry<T> implements ITermDecomposer<T> {

    private final Map<Class<?>, ITermDecomposer<T>> decomposers = new HashMap<>();

    /**
     * Registers a decomposer for the given term class and its subtypes. A class or interface
     * registered here also serves every class implementing it, directly or through a
     * sub-interface.
     *
     * @param termType   The concrete term class.
     * @param decomposer Projects the children of a term of that class.
     * @param <S>        Concrete term type parameter.
     * @return This registry.
     */
    public <S extends T> DecomposerRegistry<T> register(Class<S> termType, Function<? super S, ? extends List<? extends T>> decomposer) {
        decomposers.put(termType, term -> List.copyOf(decomposer.apply(termType.cast(term))));
        return this;
    }

    /**
     * Resolves the decomposer for a term class. Superclasses are tried nearest first; at each
     * level the implemented interfaces are searched breadth-first, including their
     * super-interfaces.
     *
     * @param termType The term class to look up.
     * @return The decomposer, if one is registered for the class or one of its supertypes.
     */
    public Optional<ITermDecomposer<T>> resolve(Class<?> termType) {
        for (Class<?> clazz = termType; clazz != null; clazz = clazz.getSuperclass()) {
            ITermDecomposer<T> found = decomposers.get(clazz);
            if (found != null) return Optional.of(found);
            Optional<ITermDecomposer<T>> viaInterface = resolveInterfaces(clazz);
            if (viaInterface.isPresent()) return viaInterface;
        }
        return Optional.empty();
    }

    private Optional<ITermDecomposer<T>> resolveInterfaces(Class<?> clazz) {
        Deque<Class<?>> pending = new ArrayDeque<>(List.of(clazz.getInterfaces()));
        Set<Class<?>> visited = new HashSet<>();
        while (!pending.isEmpty()) {
            Class<?> iface = pending.poll();
            if (!visited.add(iface)) continue;
            ITermDecomposer<T> found = decomposers.get(iface);
            if (found != null) return Optional.of(found);
            pending.addAll(List.of(iface.getInterfaces()));
        }
        return Optional.empty();
    }

    @Override
    public List<T> children(T term) {
        ITermDecomposer<T> decomposer = resolve(term.getClass())
                .orElseThrow(() -> new IllegalStateException(
                        "No decomposer registered for term type " + term.getClass().getName()));
        return decomposer.children(term);
    }
}
