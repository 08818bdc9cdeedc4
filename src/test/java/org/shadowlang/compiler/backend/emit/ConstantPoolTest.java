package org.shadowlang.compiler.backend.emit;

import org.shadowlang.compiler.api.AssemblyDocument.ConstantEntry;
import org.shadowlang.compiler.api.AssemblyDocument.DataEntry;
import org.shadowlang.compiler.api.SourceInfo;
import org.shadowlang.compiler.frontend.parser.ast.Constant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ConstantPool}.
 */
public class ConstantPoolTest {

    private static final SourceInfo AT = new SourceInfo("test.sl", 1, 1);

    private ConstantPool pool;

    @BeforeEach
    void setUp() {
        pool = new ConstantPool();
    }

    private static Constant literal(String text) {
        return new Constant(text, AT);
    }

    @Test
    @Tag("unit")
    void testScalarsShareOneCounterAndAreDeduplicated() {
        // Act
        String first = pool.add(literal("42"));
        String again = pool.add(literal("42"));
        String flag = pool.add(literal("true"));
        String negative = pool.add(literal("-8"));

        // Assert
        assertThat(first).isEqualTo("c0").isEqualTo(again);
        assertThat(flag).isEqualTo("c1");
        assertThat(negative).isEqualTo("c2");
        assertThat(pool.constants()).containsExactly(
                new ConstantEntry("c0", "42"),
                new ConstantEntry("c1", "1"),
                new ConstantEntry("c2", "-8"));
    }

    @Test
    @Tag("unit")
    void testFloatIsStoredAsBitPattern() {
        // Act
        pool.add(literal("1.5"));
        pool.add(literal("-2.0"));

        // Assert
        assertThat(pool.constants()).containsExactly(
                new ConstantEntry("c0", "0x3FF8000000000000"),
                new ConstantEntry("c1", "0xC000000000000000"));
    }

    @Test
    @Tag("unit")
    void testStringsBecomeDataWithLength() {
        // Act
        String text = pool.add(literal("\"hello\""));
        String empty = pool.add(literal("\"\""));

        // Assert
        assertThat(text).isEqualTo("s0");
        assertThat(empty).isEqualTo("s1");
        assertThat(pool.data()).containsExactly(
                new DataEntry("s0", "db", "\"hello\""),
                new DataEntry("s1", "db", "0"));
        assertThat(pool.constants()).containsExactly(
                new ConstantEntry("s0@len", "5"),
                new ConstantEntry("s1@len", "0"));
    }

    @Test
    @Tag("unit")
    void testNameOfUnpooledLiteralFails() {
        assertThatThrownBy(() -> pool.nameOf(literal("7")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("7");
    }
}
