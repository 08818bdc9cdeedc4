package org.shadowlang.compiler.frontend.semantics;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.diagnostics.DiagnosticsEngine;
import org.shadowlang.compiler.frontend.parser.ast.Assignment;
import org.shadowlang.compiler.frontend.parser.ast.Ast;
import org.shadowlang.compiler.frontend.parser.ast.Block;
import org.shadowlang.compiler.frontend.parser.ast.Condition;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.parser.ast.Loop;
import org.shadowlang.compiler.frontend.parser.ast.Statement;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.shadowlang.compiler.frontend.parser.ast.Variable;
import org.shadowlang.compiler.frontend.semantics.analysis.AnalysisContext;
import org.shadowlang.compiler.frontend.semantics.analysis.ExpressionAnalyzer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Performs semantic analysis on the AST: it creates the scopes, binds every variable,
 * resolves every expression's type and rejects ill-typed programs.
 * <p>
 * The parsed tree is not modified. Analysis returns a rebuilt, typed tree whose blocks and
 * loops are the keys of the scopes in the {@link SymbolTable}.
 * <p>
 * Scoping: the root block uses the root scope; every other block gets a fresh scope; a loop
 * header (init, tests, step) gets its own scope that encloses the body's scope. The test of an
 * {@code if} is analyzed in the enclosing scope.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final AnalysisContext context;
    private final ExpressionAnalyzer expressions;

    /**
     * Constructs a new semantic analyzer that reports all errors it can find.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to use for analysis.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable) {
        this(diagnostics, symbolTable, false);
    }

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to use for analysis.
     * @param failFast If true, the first error throws a {@link SemanticException}.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable, boolean failFast) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        this.context = new AnalysisContext(symbolTable, diagnostics, failFast);
        this.expressions = new ExpressionAnalyzer(context);
    }

    /**
     * Analyzes the given AST. Normal errors are reported to the diagnostics engine.
     * @param ast The parsed AST.
     * @return The typed AST, sharing this analyzer's symbol table.
     * @throws SemanticException on a critical error, or on the first error in fail-fast mode.
     */
    public Ast analyze(Ast ast) {
        symbolTable.resetScope();
        List<Statement> statements = statements(ast.root().statements());
        Block root = new Block(statements, ast.root().source());
        symbolTable.bind(root, symbolTable.getRootScope());
        return new Ast(root, symbolTable);
    }

    /**
     * @return The diagnostics engine this analyzer reports to.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    private List<Statement> statements(List<Statement> statements) {
        List<Statement> typed = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            typed.add(statement(statement));
        }
        return typed;
    }

    private Statement statement(Statement statement) {
        if (statement instanceof Assignment assignment) {
            return assignment(assignment);
        }
        if (statement instanceof Condition condition) {
            return condition(condition);
        }
        if (statement instanceof Loop loop) {
            return loop(loop);
        }
        if (statement instanceof Block block) {
            return block(block);
        }
        throw context.critical(CompilerErrorCode.MALFORMED_TREE,
                "Unsupported statement node " + statement.getClass().getSimpleName() + ".", statement.source());
    }

    private Block block(Block block) {
        SymbolTable.Scope scope = symbolTable.enterScope();
        List<Statement> statements = statements(block.statements());
        symbolTable.leaveScope();
        Block typed = new Block(statements, block.source());
        symbolTable.bind(typed, scope);
        return typed;
    }

    private Condition condition(Condition condition) {
        Expression test = test(condition.test(), "if");
        Block thenBlock = block(condition.thenBlock());
        Block elseBlock = block(condition.elseBlock());
        return new Condition(test, thenBlock, elseBlock, condition.source());
    }

    private Loop loop(Loop loop) {
        SymbolTable.Scope header = symbolTable.enterScope();
        Assignment init = assignment(loop.init());
        List<Expression> tests = new ArrayList<>(loop.tests().size());
        for (Expression test : loop.tests()) {
            tests.add(test(test, "for"));
        }
        // The step runs after the body but sees only the header's bindings.
        Assignment step = assignment(loop.step());
        Block body = block(loop.body());
        symbolTable.leaveScope();
        Loop typed = new Loop(init, tests, step, body, loop.source());
        symbolTable.bind(typed, header);
        return typed;
    }

    private Expression test(Expression test, String keyword) {
        Expression typed = expressions.analyze(test);
        if (typed.type() != Type.BOOL && typed.type() != Type.UNKNOWN) {
            context.error(CompilerErrorCode.CONDITION_NOT_BOOL,
                    String.format("Condition of '%s' must be bool, but is %s.", keyword, typed.type().displayName()),
                    typed.source());
        }
        return typed;
    }

    private Assignment assignment(Assignment assignment) {
        if (assignment.targets().size() != assignment.values().size()) {
            throw context.critical(CompilerErrorCode.MALFORMED_TREE,
                    String.format("Assignment has %d target(s) but %d value(s).",
                            assignment.targets().size(), assignment.values().size()),
                    assignment.source());
        }
        // Values first: in 'shadow x = x + 1' the right-hand side reads the outer x.
        List<Expression> values = new ArrayList<>(assignment.values().size());
        for (Expression value : assignment.values()) {
            values.add(expressions.analyze(value));
        }
        List<Variable> targets = new ArrayList<>(assignment.targets().size());
        Set<String> assigned = new HashSet<>();
        for (int i = 0; i < assignment.targets().size(); i++) {
            Variable target = assignment.targets().get(i);
            if (!assigned.add(target.name())) {
                context.error(CompilerErrorCode.REDECLARATION,
                        String.format("Variable '%s' is assigned more than once in the same assignment.", target.name()),
                        target.source());
                targets.add(target);
                continue;
            }
            targets.add(bindTarget(target, values.get(i).type()));
        }
        return new Assignment(targets, values, assignment.source());
    }

    private Variable bindTarget(Variable target, Type valueType) {
        String name = target.name();
        Optional<Symbol> visible = symbolTable.resolve(name);
        if (target.shadow()) {
            if (symbolTable.isDeclaredInCurrentScope(name)) {
                context.error(CompilerErrorCode.REDECLARATION,
                        String.format("Variable '%s' is already declared in this scope.", name), target.source());
                Symbol existing = visible.orElseThrow();
                return target.resolve(existing.type(), existing.storageName());
            }
            if (visible.isEmpty()) {
                context.warning(String.format("'shadow %s' does not shadow any outer variable.", name), target.source());
            }
            Symbol symbol = symbolTable.declare(name, valueType, true, target.source());
            return target.resolve(symbol.type(), symbol.storageName());
        }
        if (visible.isEmpty()) {
            Symbol symbol = symbolTable.declare(name, valueType, false, target.source());
            return target.resolve(symbol.type(), symbol.storageName());
        }
        Symbol existing = visible.get();
        if (existing.type() == Type.UNKNOWN && valueType != Type.UNKNOWN) {
            existing = symbolTable.refineType(existing, valueType);
        } else if (valueType != Type.UNKNOWN && valueType != existing.type()) {
            context.error(CompilerErrorCode.ASSIGNMENT_TYPE_MISMATCH,
                    String.format("Cannot assign a value of type %s to variable '%s' of type %s.",
                            valueType.displayName(), name, existing.type().displayName()),
                    target.source());
        }
        return target.resolve(existing.type(), existing.storageName());
    }
}
