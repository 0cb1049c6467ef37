package org.semantic.term;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DecomposerRegistry}.
 */
@Tag("unit")
class DecomposerRegistryTest {

    interface Syntax {
    }

    record Leaf(String name) implements Syntax {
    }

    record Pair(Syntax left, Syntax right) implements Syntax {
    }

    interface Statement extends Syntax {
    }

    record Block(List<Syntax> statements) implements Statement {
    }

    record Unknown() implements Syntax {
    }

    interface Expression extends Syntax {
    }

    record Call(Syntax callee, Syntax argument) implements Expression {
    }

    @Test
    void dispatchesOnConcreteClass() {
        DecomposerRegistry<Syntax> registry = new DecomposerRegistry<Syntax>()
                .register(Leaf.class, leaf -> List.of())
                .register(Pair.class, pair -> List.of(pair.left(), pair.right()));
        Leaf a = new Leaf("a");
        Leaf b = new Leaf("b");

        assertThat(registry.children(new Pair(a, b))).containsExactly(a, b);
        assertThat(registry.children(a)).isEmpty();
    }

    @Test
    void resolvesThroughImplementedInterface() {
        DecomposerRegistry<Syntax> registry = new DecomposerRegistry<Syntax>()
                .register(Statement.class, statement -> ((Block) statement).statements());
        Leaf a = new Leaf("a");

        assertThat(registry.resolve(Block.class)).isPresent();
        assertThat(registry.children(new Block(List.of(a)))).containsExactly(a);
    }

    @Test
    void resolvesThroughSuperInterfaceOfImplementedInterface() {
        DecomposerRegistry<Syntax> registry = new DecomposerRegistry<Syntax>()
                .register(Syntax.class, syntax -> syntax instanceof Call call
                        ? List.of(call.callee(), call.argument())
                        : List.of());
        Leaf f = new Leaf("f");
        Leaf x = new Leaf("x");

        assertThat(registry.resolve(Call.class)).isPresent();
        assertThat(registry.children(new Call(f, x))).containsExactly(f, x);
    }

    @Test
    void closestRegistrationWins() {
        DecomposerRegistry<Syntax> registry = new DecomposerRegistry<Syntax>()
                .register(Syntax.class, syntax -> List.of())
                .register(Expression.class, expression -> List.of(((Call) expression).callee()));
        Leaf f = new Leaf("f");

        assertThat(registry.children(new Call(f, new Leaf("x")))).containsExactly(f);
    }

    @Test
    void unregisteredTermTypeIsAProgrammingError() {
        DecomposerRegistry<Syntax> registry = new DecomposerRegistry<Syntax>()
                .register(Leaf.class, leaf -> List.of());

        assertThat(registry.resolve(Unknown.class)).isEmpty();
        assertThatThrownBy(() -> registry.children(new Unknown()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Unknown");
    }
}
