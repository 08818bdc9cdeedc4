package org.shadowlang.compiler;

import org.shadowlang.compiler.api.AssemblyDocument;
import org.shadowlang.compiler.api.AssemblyDocument.Instruction;
import org.shadowlang.compiler.api.CompilationException;
import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.api.ErrorCategory;
import org.shadowlang.compiler.backend.link.ToolchainSettings;
import org.shadowlang.compiler.diagnostics.Diagnostic;
import org.shadowlang.junit.extensions.logging.ExpectLog;
import org.shadowlang.junit.extensions.logging.LogLevel;
import org.shadowlang.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains tests for the {@link Compiler} pipeline: which phase reports which errors, and how
 * the options change the result.
 */
@ExtendWith(LogWatchExtension.class)
public class CompilerTest {

    private static Compiler compiler(CompilerOptions.LexerMode mode) {
        return new Compiler(new CompilerOptions(mode, false, true, ToolchainSettings.defaults()));
    }

    @ParameterizedTest
    @EnumSource(CompilerOptions.LexerMode.class)
    @Tag("unit")
    void testValidProgramCompiles(CompilerOptions.LexerMode mode) throws Exception {
        // Act
        AssemblyDocument document = compiler(mode).compile("a, b = 1, 2\nif a < b { a = b }", "test.sl");

        // Assert
        assertThat(document.program()).first().isEqualTo(Instruction.label("_start"));
        assertThat(document.program()).last().isEqualTo(Instruction.of("call", "exit"));
        assertThat(document.variables()).hasSize(2);
    }

    /**
     * The parser fails on line 1 while the lexer only fails on line 2; the lexical error is the
     * only one reported, whether the lexer runs on its own thread or is pulled.
     */
    @ParameterizedTest
    @EnumSource(CompilerOptions.LexerMode.class)
    @Tag("unit")
    void testLexicalErrorReplacesParseErrors(CompilerOptions.LexerMode mode) {
        // Act
        CompilationException e = catchThrowableOfType(
                () -> compiler(mode).compile("x = = 1\ny = @", "test.sl"), CompilationException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.code()).isEqualTo(CompilerErrorCode.UNRECOGNIZED_CHARACTER);
            assertThat(d.code().category()).isEqualTo(ErrorCategory.LEXICAL);
            assertThat(d.message()).contains("'@'");
        });
    }

    @ParameterizedTest
    @EnumSource(CompilerOptions.LexerMode.class)
    @Tag("unit")
    void testParseErrorWithoutLexicalError(CompilerOptions.LexerMode mode) {
        // Act
        CompilationException e = catchThrowableOfType(
                () -> compiler(mode).compile("x = = 1\ny = 2", "test.sl"), CompilationException.class);

        // Assert
        assertThat(e.getDiagnostics()).singleElement()
                .extracting(Diagnostic::code)
                .isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
    }

    @Test
    @Tag("unit")
    void testAllSemanticErrorsAreReported() {
        // Act
        CompilationException e = catchThrowableOfType(
                () -> new Compiler().compile("x = y\nz = w", "test.sl"), CompilationException.class);

        // Assert
        assertThat(e.getDiagnostics()).extracting(Diagnostic::message).containsExactly(
                "Unresolved identifier 'y'.",
                "Unresolved identifier 'w'.");
        assertThat(e.getMessage()).isEqualTo(
                "[ERROR] test.sl:1:5: Unresolved identifier 'y'.\n[ERROR] test.sl:2:5: Unresolved identifier 'w'.");
    }

    @Test
    @Tag("unit")
    void testFailFastStopsAtFirstSemanticError() {
        // Arrange
        Compiler compiler = new Compiler(new CompilerOptions(
                CompilerOptions.LexerMode.PULL, true, true, ToolchainSettings.defaults()));

        // Act & Assert
        assertThatThrownBy(() -> compiler.compile("x = y\nz = w", "test.sl"))
                .isInstanceOfSatisfying(CompilationException.class, e -> assertThat(e.getDiagnostics())
                        .singleElement()
                        .extracting(Diagnostic::message)
                        .isEqualTo("Unresolved identifier 'y'."));
    }

    @Test
    @Tag("unit")
    @ExpectLog(level = LogLevel.WARN, messagePattern = ".*'shadow q' does not shadow any outer variable\\.")
    void testWarningsDoNotStopCompilation() throws Exception {
        // Arrange
        Compiler compiler = new Compiler();

        // Act
        AssemblyDocument document = compiler.compile("shadow q = 1", "test.sl");

        // Assert
        assertThat(document.variables()).extracting(AssemblyDocument.DataEntry::name).containsExactly("v_q");
        assertThat(compiler.getDiagnostics()).singleElement()
                .extracting(Diagnostic::type)
                .isEqualTo(Diagnostic.Type.WARNING);
    }

    @Test
    @Tag("unit")
    void testOptimizeOffKeepsThePlainLowering() throws Exception {
        // Arrange
        CompilerOptions plain = CompilerOptions.defaults().withOptimize(false);

        // Act
        AssemblyDocument optimized = new Compiler().compile("x = 1", "test.sl");
        AssemblyDocument unoptimized = new Compiler(plain).compile("x = 1", "test.sl");

        // Assert
        assertThat(unoptimized.program()).contains(Instruction.of("push", "rax"), Instruction.of("pop", "rax"));
        assertThat(optimized.program()).doesNotContain(Instruction.of("push", "rax"));
    }

    @Test
    @Tag("unit")
    void testEmptyProgramOnlyExits() throws Exception {
        // Act
        AssemblyDocument document = new Compiler().compile("", "empty.sl");

        // Assert
        assertThat(document.program()).containsExactly(
                Instruction.label("_start"),
                Instruction.of("and", "rsp, -16"),
                Instruction.of("xor", "edi, edi"),
                Instruction.of("call", "exit"));
        assertThat(document.constants()).isEmpty();
        assertThat(document.variables()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDiagnosticsAreResetBetweenRuns() throws Exception {
        // Arrange
        Compiler compiler = new Compiler();
        assertThatThrownBy(() -> compiler.compile("x = y", "bad.sl")).isInstanceOf(CompilationException.class);

        // Act
        compiler.compile("x = 1", "good.sl");

        // Assert
        assertThat(compiler.getDiagnostics()).isEmpty();
    }
}
