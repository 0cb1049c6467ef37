package org.semantic.data;

import java.util.Objects;
import java.util.function.Function;

/**
 * A named unit of source (a file or logical compilation unit) wrapping its body.
 * <p>
 * In the pending module table the body is a parsed term. When the module is handed to an
 * analysis, the body is replaced by a {@link org.semantic.term.Subterm} via {@link #map(Function)}
 * so the analysis decides when the body is actually evaluated.
 *
 * @param name The module name used for import resolution.
 * @param path The file path the module was parsed from.
 * @param body The module body.
 * @param <B>  Body type.
 */
public record Module<B>(ModuleName name, String path, B body) {

    public Module {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(body, "body");
    }

    /**
     * Creates a module whose path equals its name.
     */
    public static <B> Module<B> of(String name, B body) {
        return new Module<>(new ModuleName(name), name, body);
    }

    /**
     * Returns a module with the same name and path and a transformed body.
     *
     * @param f   The body transformation.
     * @param <C> New body type.
     * @return The transformed module.
     */
    public <C> Module<C> map(Function<? super B, ? extends C> f) {
        return new Module<>(name, path, f.apply(body));
    }
}
