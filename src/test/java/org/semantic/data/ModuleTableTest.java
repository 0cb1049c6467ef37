package org.semantic.data;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ModuleTable}.
 */
@Tag("unit")
class ModuleTableTest {

    private static final ModuleName MAIN = new ModuleName("main");
    private static final ModuleName LIB = new ModuleName("lib");

    @Test
    void fromModulesGroupsSameNamedModulesInOrder() {
        Module<String> lib1 = Module.of("lib", "first");
        Module<String> main = Module.of("main", "entry");
        Module<String> lib2 = Module.of("lib", "second");

        ModuleTable<Module<String>> table = ModuleTable.fromModules(List.of(lib1, main, lib2));

        assertThat(table.names()).containsExactly(LIB, MAIN);
        assertThat(table.lookup(LIB)).contains(List.of(lib1, lib2));
        assertThat(table.lookup(MAIN)).contains(List.of(main));
    }

    @Test
    void insertAppendsWithoutMutatingReceiver() {
        ModuleTable<String> empty = ModuleTable.empty();
        ModuleTable<String> one = empty.insert(LIB, "a");
        ModuleTable<String> two = one.insert(LIB, "b");

        assertThat(empty.isEmpty()).isTrue();
        assertThat(one.lookup(LIB)).contains(List.of("a"));
        assertThat(two.lookup(LIB)).contains(List.of("a", "b"));
        assertThat(two.size()).isEqualTo(1);
    }

    @Test
    void lookupOfUnknownNameIsEmpty() {
        assertThat(ModuleTable.<String>empty().lookup(MAIN)).isEmpty();
        assertThat(ModuleTable.<String>empty().contains(MAIN)).isFalse();
    }
}
