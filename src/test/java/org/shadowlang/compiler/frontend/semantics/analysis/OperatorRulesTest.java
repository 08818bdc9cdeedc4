package org.shadowlang.compiler.frontend.semantics.analysis;

import org.shadowlang.compiler.frontend.parser.ast.Operator;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the typing rules in {@link OperatorRules}.
 */
public class OperatorRulesTest {

    @ParameterizedTest
    @EnumSource(value = Operator.class, names = {"PLUS", "MINUS", "MULTIPLY", "DIVIDE"})
    @Tag("unit")
    void testArithmeticKeepsNumericType(Operator operator) {
        assertThat(OperatorRules.binaryResult(operator, Type.INT, Type.INT)).contains(Type.INT);
        assertThat(OperatorRules.binaryResult(operator, Type.FLOAT, Type.FLOAT)).contains(Type.FLOAT);
        assertThat(OperatorRules.binaryResult(operator, Type.STRING, Type.STRING)).isEmpty();
        assertThat(OperatorRules.binaryResult(operator, Type.BOOL, Type.BOOL)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = Operator.Category.class, names = {"ARITHMETIC", "COMPARISON", "LOGICAL"})
    @Tag("unit")
    void testMixedOperandsNeverType(Operator.Category category) {
        for (Operator operator : Operator.values()) {
            if (operator.category() == category) {
                assertThat(OperatorRules.binaryResult(operator, Type.INT, Type.FLOAT)).isEmpty();
            }
        }
    }

    @ParameterizedTest
    @EnumSource(value = Type.class, names = {"INT", "FLOAT", "STRING", "BOOL"})
    @Tag("unit")
    void testComparisonAcceptsAnyTypeAndYieldsBool(Type type) {
        assertThat(OperatorRules.binaryResult(Operator.LESS, type, type)).contains(Type.BOOL);
        assertThat(OperatorRules.binaryResult(Operator.EQUAL, type, type)).contains(Type.BOOL);
    }

    @Test
    @Tag("unit")
    void testLogicalNeedsBool() {
        assertThat(OperatorRules.binaryResult(Operator.AND, Type.BOOL, Type.BOOL)).contains(Type.BOOL);
        assertThat(OperatorRules.binaryResult(Operator.OR, Type.INT, Type.INT)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUnaryRules() {
        assertThat(OperatorRules.unaryResult(Operator.NEGATE, Type.FLOAT)).contains(Type.FLOAT);
        assertThat(OperatorRules.unaryResult(Operator.NEGATE, Type.STRING)).isEmpty();
        assertThat(OperatorRules.unaryResult(Operator.NOT, Type.BOOL)).contains(Type.BOOL);
        assertThat(OperatorRules.unaryResult(Operator.NOT, Type.INT)).isEmpty();
        assertThat(OperatorRules.unaryResult(Operator.PLUS, Type.INT)).isEmpty();
    }
}
