package org.shadowlang.compiler.frontend.semantics;

import org.shadowlang.compiler.api.SourceInfo;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SymbolTable}, covering scope nesting, resolution from the
 * innermost scope outwards and the storage names handed out to shadowing bindings.
 */
public class SymbolTableTest {

    private static final SourceInfo AT = new SourceInfo("test.sl", 1, 1);

    private SymbolTable table;

    @BeforeEach
    void setUp() {
        table = new SymbolTable();
    }

    @Test
    @Tag("unit")
    void testResolveSearchesOutwards() {
        // Arrange
        table.declare("x", Type.INT, false, AT);
        table.enterScope();
        table.enterScope();

        // Act & Assert
        assertThat(table.resolve("x")).get().extracting(Symbol::storageName).isEqualTo("v_x");
        assertThat(table.isDeclaredInCurrentScope("x")).isFalse();
        assertThat(table.resolve("y")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testShadowingBindingsGetNumberedStorage() {
        // Arrange
        Symbol outer = table.declare("x", Type.INT, false, AT);
        table.enterScope();

        // Act
        Symbol inner = table.declare("x", Type.FLOAT, true, AT);

        // Assert
        assertThat(inner.storageName()).isEqualTo("v_x@2");
        assertThat(inner.shadowedStorageName()).isEqualTo(outer.storageName());
        assertThat(table.resolve("x")).contains(inner);

        table.leaveScope();
        assertThat(table.resolve("x")).contains(outer);
    }

    @Test
    @Tag("unit")
    void testStorageNumbersAreUniqueAcrossSiblingScopes() {
        // Arrange
        table.declare("x", Type.INT, false, AT);

        // Act
        table.enterScope();
        Symbol first = table.declare("x", Type.INT, true, AT);
        table.leaveScope();
        table.enterScope();
        Symbol second = table.declare("x", Type.INT, true, AT);
        table.leaveScope();

        // Assert
        assertThat(first.storageName()).isEqualTo("v_x@2");
        assertThat(second.storageName()).isEqualTo("v_x@3");
        assertThat(table.getAllSymbols()).extracting(Symbol::storageName)
                .containsExactly("v_x", "v_x@2", "v_x@3");
        assertThat(table.getRootScope().getChildren()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testDeclaringTwiceInOneScopeFails() {
        // Arrange
        table.declare("x", Type.INT, false, AT);

        // Act & Assert
        assertThatThrownBy(() -> table.declare("x", Type.INT, true, AT))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @Tag("unit")
    void testRefineTypeUpdatesScopeAndStorageIndex() {
        // Arrange
        Symbol unknown = table.declare("y", Type.UNKNOWN, false, AT);
        table.enterScope();

        // Act
        Symbol refined = table.refineType(unknown, Type.STRING);

        // Assert
        assertThat(refined.type()).isEqualTo(Type.STRING);
        assertThat(table.resolve("y")).contains(refined);
        assertThat(table.byStorageName("v_y")).contains(refined);
    }

    @Test
    @Tag("unit")
    void testLeavingTheRootScopeStaysAtRoot() {
        // Act
        table.leaveScope();

        // Assert
        assertThat(table.getCurrentScope()).isSameAs(table.getRootScope());
        assertThat(table.getRootScope().getParent()).isNull();
    }
}
