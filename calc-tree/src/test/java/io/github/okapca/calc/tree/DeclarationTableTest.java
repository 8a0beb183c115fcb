package io.github.okapca.calc.tree;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DeclarationTableTest extends CalcTreeTestBase {

    @Test
    void keepsFirstDeclarationOrder() {
        final DeclarationTable table = new DeclarationTable();
        table.declare("--b", "1");
        table.declare("--a", "2");
        table.declare("--b", "1");

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.toMap()).containsExactly(entry("--b", "1"), entry("--a", "2"));
    }

    @Test
    void rejectsRedefinitionWithDifferentText() {
        final DeclarationTable table = new DeclarationTable();
        table.declare("--p", "var(--x)");

        assertThatThrownBy(() -> table.declare("--p", "var(--y)"))
            .isInstanceOf(DeclarationConflictException.class)
            .hasMessageContaining("--p");
        assertThat(table.toMap()).containsExactly(entry("--p", "var(--x)"));
    }

    @Test
    void snapshotIsDetachedAndReadOnly() {
        final DeclarationTable table = new DeclarationTable();
        table.declare("--a", "1");
        final Map<String, String> snapshot = table.toMap();
        table.declare("--b", "2");

        assertThat(snapshot).containsOnlyKeys("--a");
        assertThatThrownBy(() -> snapshot.put("--c", "3"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
