package org.shadowlang.compiler.frontend;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.diagnostics.Diagnostic;
import org.shadowlang.compiler.diagnostics.DiagnosticsEngine;
import org.shadowlang.compiler.frontend.lexer.Lexer;
import org.shadowlang.compiler.frontend.parser.AstPrinter;
import org.shadowlang.compiler.frontend.parser.Parser;
import org.shadowlang.compiler.frontend.parser.TokenStream;
import org.shadowlang.compiler.frontend.parser.ast.Assignment;
import org.shadowlang.compiler.frontend.parser.ast.Ast;
import org.shadowlang.compiler.frontend.parser.ast.Condition;
import org.shadowlang.compiler.frontend.parser.ast.Constant;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.parser.ast.Loop;
import org.shadowlang.compiler.frontend.parser.ast.Statement;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify the shape of the trees the parser builds, using the canonical tree notation
 * of {@link AstPrinter}, and the errors it reports for malformed input.
 */
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private Ast parse(String source) {
        diagnostics = new DiagnosticsEngine();
        return new Parser(new TokenStream(new Lexer(source, "test.sl")), diagnostics).parse();
    }

    private Statement parseSingle(String source) {
        Ast ast = parse(source);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(ast.root().statements()).hasSize(1);
        return ast.root().statements().get(0);
    }

    private Diagnostic parseError(String source) {
        Ast ast = parse(source);
        assertThat(ast).isNull();
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        return diagnostics.getDiagnostics().get(0);
    }

    /**
     * Verifies that binary operators associate to the right without precedence, that unary
     * minus applies to the whole following expression, and that negative literals survive.
     */
    @Test
    @Tag("unit")
    void testExpressionWithoutPrecedence() {
        Statement statement = parseSingle("shadow a = 6 + 7 * variable / -(5 -- (-8 * -10000.1234))");

        assertThat(AstPrinter.tree(statement))
                .isEqualTo("shadow a = (6 + (7 * (variable / (-(5 - (-(-8 * -10000.1234)))))))");
    }

    @Test
    @Tag("unit")
    void testUnaryOperatorTakesTheRestOfTheExpression() {
        assertThat(AstPrinter.tree(parseSingle("a = !x && y"))).isEqualTo("a = (!(x && y))");
        assertThat(AstPrinter.tree(parseSingle("a = (!x) && y"))).isEqualTo("a = ((!x) && y)");
    }

    @Test
    @Tag("unit")
    void testParenthesesGroupTheLeftOperand() {
        assertThat(AstPrinter.tree(parseSingle("a = (1 + 2) * 3"))).isEqualTo("a = ((1 + 2) * 3)");
        assertThat(AstPrinter.tree(parseSingle("a = ((b))"))).isEqualTo("a = b");
    }

    /**
     * {@code a OP1 b OP2 c} parses as {@code a OP1 (b OP2 c)} for every binary operator.
     */
    @ParameterizedTest
    @ValueSource(strings = {"+", "-", "*", "/", "==", "!=", "<=", ">=", "<", ">", "&&", "||"})
    @Tag("unit")
    void testEveryBinaryOperatorIsRightAssociative(String operator) {
        for (String second : List.of("+", "*", "==", "&&", "<")) {
            String source = "x = a " + operator + " b " + second + " c";
            assertThat(AstPrinter.tree(parseSingle(source)))
                    .as(source)
                    .isEqualTo("x = (a " + operator + " (b " + second + " c))");
        }
    }

    @Test
    @Tag("unit")
    void testIfWithoutElseHasEmptyElseBlock() {
        Statement statement = parseSingle("if a == b { a = 6 }");

        assertThat(statement).isInstanceOf(Condition.class);
        Condition condition = (Condition) statement;
        assertThat(condition.elseBlock().isEmpty()).isTrue();
        assertThat(AstPrinter.tree(condition)).isEqualTo("if (a == b) {a = 6} else {}");
    }

    @Test
    @Tag("unit")
    void testIfElse() {
        Condition condition = (Condition) parseSingle("if a == b {a=6} else {a=1}");

        assertThat(condition.elseBlock().isEmpty()).isFalse();
        assertThat(AstPrinter.tree(condition)).isEqualTo("if (a == b) {a = 6} else {a = 1}");
    }

    @Test
    @Tag("unit")
    void testNestedStatements() {
        String source = String.join("\n",
                "if x {",
                "    for ;; {",
                "        if y { z = 1 } else { z = 2 }",
                "    }",
                "}");

        assertThat(AstPrinter.tree(parseSingle(source)))
                .isEqualTo("if x {for <none>; ; <none> {if y {z = 1} else {z = 2}}} else {}");
    }

    @Test
    @Tag("unit")
    void testParallelAssignmentAndLiteralTypes() {
        Assignment assignment = (Assignment) parseSingle("a, shadow b, c, d = 1, 2.5, \"s\", true");

        assertThat(AstPrinter.tree(assignment)).isEqualTo("a, shadow b, c, d = 1, 2.5, \"s\", true");
        assertThat(assignment.targets().get(1).shadow()).isTrue();
        assertThat(assignment.values()).extracting(Expression::type)
                .containsExactly(Type.INT, Type.FLOAT, Type.STRING, Type.BOOL);
        assertThat(((Constant) assignment.values().get(2)).value()).isEqualTo("s");
    }

    @Test
    @Tag("unit")
    void testForWithInitTestAndStep() {
        Loop loop = (Loop) parseSingle("for i, j = 0, 1; i < 10; i = i+1 { a = i }");

        assertThat(loop.init().targets()).hasSize(2);
        assertThat(loop.tests()).hasSize(1);
        assertThat(loop.step().targets()).hasSize(1);
        assertThat(AstPrinter.tree(loop)).isEqualTo("for i, j = 0, 1; (i < 10); i = (i + 1) {a = i}");
    }

    @Test
    @Tag("unit")
    void testForWithSeveralTestsAndNoInitOrStep() {
        Loop loop = (Loop) parseSingle("for ; a < 3, b; { a = a + 1 }");

        assertThat(loop.init().isEmpty()).isTrue();
        assertThat(loop.step().isEmpty()).isTrue();
        assertThat(AstPrinter.tree(loop)).isEqualTo("for <none>; (a < 3), b; <none> {a = (a + 1)}");
    }

    @Test
    @Tag("unit")
    void testForWithEmptyHeader() {
        Loop loop = (Loop) parseSingle("for ;; {}");

        assertThat(loop.tests()).isEmpty();
        assertThat(loop.body().isEmpty()).isTrue();
        assertThat(AstPrinter.tree(loop)).isEqualTo("for <none>; ; <none> {}");
    }

    @Test
    @Tag("unit")
    void testEmptyProgram() {
        Ast ast = parse("  // nothing here\n");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(ast.root().statements()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testMissingAssignmentOperator() {
        Diagnostic error = parseError("a b");

        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
        assertThat(error.message()).isEqualTo("Expected '=' in assignment, but found 'b'.");
        assertThat(error.source().columnNumber()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testMissingValue() {
        assertThat(parseError("a = ").message()).isEqualTo("Expected expression after '=', but found end of input.");
    }

    @Test
    @Tag("unit")
    void testUnclosedBlock() {
        assertThat(parseError("if a { b = 1").message())
                .isEqualTo("Expected statement or '}' in 'if' block, but found end of input.");
    }

    @Test
    @Tag("unit")
    void testUnclosedParenthesis() {
        assertThat(parseError("a = (1 + 2").message())
                .isEqualTo("Expected ')' to close '(' at line 1, but found end of input.");
    }

    @Test
    @Tag("unit")
    void testStrayTokenAtTopLevel() {
        assertThat(parseError("a = 1 }").message()).isEqualTo("Expected statement, but found '}'.");
        assertThat(parseError("= 1").message()).isEqualTo("Expected statement, but found '='.");
    }

    @Test
    @Tag("unit")
    void testArityMismatch() {
        Diagnostic error = parseError("a, b = 1");

        assertThat(error.code()).isEqualTo(CompilerErrorCode.ASSIGNMENT_ARITY_MISMATCH);
        assertThat(error.message()).isEqualTo("Assignment has 2 target(s) but 1 value(s).");
    }

    @Test
    @Tag("unit")
    void testNotIsNoBinaryOperator() {
        Diagnostic error = parseError("a = b ! c");

        assertThat(error.code()).isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
        assertThat(error.message()).isEqualTo("Operator '!' cannot be used as a binary operator.");
    }

    @Test
    @Tag("unit")
    void testLoopHeaderNeedsSemicolons() {
        assertThat(parseError("for i = 0 { }").message())
                .isEqualTo("Expected ';' after loop initialization, but found '{'.");
    }
}
