package org.shadowlang.compiler;

import org.shadowlang.compiler.api.AssemblyDocument;
import org.shadowlang.compiler.api.CompilationException;
import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.api.ICompiler;
import org.shadowlang.compiler.backend.emit.EmissionRegistry;
import org.shadowlang.compiler.backend.emit.Emitter;
import org.shadowlang.compiler.diagnostics.Diagnostic;
import org.shadowlang.compiler.diagnostics.DiagnosticsEngine;
import org.shadowlang.compiler.frontend.TreeWalker;
import org.shadowlang.compiler.frontend.lexer.Lexer;
import org.shadowlang.compiler.frontend.lexer.TokenPipeline;
import org.shadowlang.compiler.frontend.parser.AstPrinter;
import org.shadowlang.compiler.frontend.parser.Parser;
import org.shadowlang.compiler.frontend.parser.TokenStream;
import org.shadowlang.compiler.frontend.parser.ast.Assignment;
import org.shadowlang.compiler.frontend.parser.ast.Ast;
import org.shadowlang.compiler.frontend.parser.ast.AstNode;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.semantics.SemanticAnalyzer;
import org.shadowlang.compiler.frontend.semantics.SemanticException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * The main compiler implementation. This class orchestrates the pipeline from source code to
 * an assembly document: lexing and parsing, semantic analysis, code generation. After each
 * phase with errors it throws a {@link CompilationException} carrying all diagnostics.
 * <p>
 * A lexical error wins over parse errors: the lexer stops at the bad character, so the parser
 * sees a truncated token stream and its errors are discarded. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private static final List<CompilerErrorCode> PARSE_ERRORS =
            List.of(CompilerErrorCode.UNEXPECTED_TOKEN, CompilerErrorCode.ASSIGNMENT_ARITY_MISMATCH);

    private final CompilerOptions options;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    /**
     * Constructs a compiler with the default options.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The compiler options.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    @Override
    public AssemblyDocument compile(String source, String programName) throws CompilationException {
        Ast typed = check(source, programName);

        // Phase 3: Code generation
        Emitter emitter = new Emitter(options.optimize()
                ? EmissionRegistry.initializeWithDefaults()
                : EmissionRegistry.empty());
        try {
            AssemblyDocument document = emitter.emit(typed);
            log.info("{} compiled to {} program line(s).", programName, document.program().size());
            return document;
        } catch (RuntimeException re) {
            throw new CompilationException(re.getMessage(), re);
        }
    }

    @Override
    public Ast check(String source, String programName) throws CompilationException {
        diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexing and parsing
        Ast parsed = parse(source, programName);
        failOnErrors();

        // Phase 2: Semantic analysis
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, parsed.symbolTable(), options.failFast());
        Ast typed = null;
        try {
            typed = analyzer.analyze(parsed);
        } catch (SemanticException e) {
            diagnostics.reportError(e.getCode(), e.getMessage(), e.getSource());
        }
        for (Diagnostic diagnostic : diagnostics.getDiagnostics()) {
            if (diagnostic.type() == Diagnostic.Type.WARNING) {
                log.warn("{}", diagnostic);
            }
        }
        failOnErrors();
        if (log.isDebugEnabled()) {
            logTypedAssignments(typed);
        }
        return typed;
    }

    /**
     * @return The diagnostics of the most recent compilation.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics.getDiagnostics();
    }

    private Ast parse(String source, String programName) {
        Lexer lexer = new Lexer(source, programName);
        Ast ast;
        Optional<Diagnostic> lexicalError;
        if (options.lexerMode() == CompilerOptions.LexerMode.CONCURRENT) {
            try (TokenPipeline pipeline = TokenPipeline.start(lexer)) {
                ast = new Parser(new TokenStream(pipeline), diagnostics).parse();
                lexicalError = pipeline.awaitLexicalError();
            }
        } else {
            ast = new Parser(new TokenStream(lexer), diagnostics).parse();
            // Lex the rest so an error behind a parse error is still found.
            lexer.scanTokens();
            lexicalError = lexer.lexicalError();
        }
        if (lexicalError.isPresent()) {
            diagnostics.discardErrors(PARSE_ERRORS);
            diagnostics.report(lexicalError.get());
            log.debug("Lexical error replaces parse errors: {}", lexicalError.get().message());
        }
        return ast;
    }

    private static void logTypedAssignments(Ast typed) {
        Consumer<AstNode> logValues = node -> {
            for (Expression value : ((Assignment) node).values()) {
                log.debug("Typed {}: {}", value.source(), AstPrinter.typedTree(value));
            }
        };
        new TreeWalker(Map.of(Assignment.class, logValues)).walk(typed.root());
    }

    private void failOnErrors() throws CompilationException {
        if (diagnostics.hasErrors()) {
            log.debug("Stopping after {} error(s).", diagnostics.errorCount());
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
    }
}
