package org.shadowlang.compiler.backend.emit;

import org.shadowlang.compiler.api.AssemblyDocument;
import org.shadowlang.compiler.api.AssemblyDocument.DataEntry;
import org.shadowlang.compiler.api.AssemblyDocument.Instruction;
import org.shadowlang.compiler.frontend.parser.ast.Assignment;
import org.shadowlang.compiler.frontend.parser.ast.Ast;
import org.shadowlang.compiler.frontend.parser.ast.Block;
import org.shadowlang.compiler.frontend.parser.ast.Condition;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.parser.ast.Loop;
import org.shadowlang.compiler.frontend.parser.ast.Statement;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.shadowlang.compiler.frontend.parser.ast.Variable;
import org.shadowlang.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.shadowlang.compiler.backend.emit.ConstantPool.LENGTH_SUFFIX;

/**
 * The Emitter is the final stage of the compiler backend. It lowers the typed AST into an
 * {@link AssemblyDocument} for x86-64 Linux in yasm syntax, then runs the registered
 * {@link IEmissionRule}s over the program section.
 * <p>
 * The entry point {@code _start} aligns the stack, runs the program and calls the C library's
 * {@code exit} with status 0.
 */
public class Emitter {

    private static final Logger log = LoggerFactory.getLogger(Emitter.class);

    /** The header directives of every document. */
    public static final List<String> HEADER = List.of("bits 64", "default rel", "extern exit", "global _start");
    /** The program entry symbol. */
    public static final String ENTRY = "_start";

    private final EmissionRegistry registry;

    /**
     * Constructs an emitter applying the default rules.
     */
    public Emitter() {
        this(EmissionRegistry.initializeWithDefaults());
    }

    /**
     * @param registry The rules to apply to the generated program.
     */
    public Emitter(EmissionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Emits the assembly document for a fully typed AST.
     * @param ast The AST after semantic analysis, without UNKNOWN types.
     * @return The document.
     */
    public AssemblyDocument emit(Ast ast) {
        ConstantPool constants = ConstantPool.collect(ast.root());
        CodeBuffer code = new CodeBuffer();
        Lowering lowering = new Lowering(code, new ExpressionEmitter(code, constants, ast.symbolTable()));

        code.label(ENTRY);
        code.emit("and", "rsp, -16");
        lowering.statements(ast.root().statements());
        code.emit("xor", "edi, edi");
        code.emit("call", "exit");

        List<Instruction> program = code.instructions();
        for (IEmissionRule rule : registry.rules()) {
            program = rule.apply(program);
        }
        log.debug("Emitted {} constant(s) and {} instruction line(s).", constants.constants().size(), program.size());
        return new AssemblyDocument(HEADER, constants.constants(), variables(ast, constants), program);
    }

    private List<DataEntry> variables(Ast ast, ConstantPool constants) {
        List<DataEntry> variables = new ArrayList<>();
        for (Symbol symbol : ast.symbolTable().getAllSymbols()) {
            variables.add(new DataEntry(symbol.storageName(), "dq", "0"));
            if (symbol.type() == Type.STRING) {
                variables.add(new DataEntry(symbol.storageName() + LENGTH_SUFFIX, "dq", "0"));
            }
        }
        variables.addAll(constants.data());
        return variables;
    }

    /**
     * Statement lowering for one program.
     */
    private static final class Lowering {
        private final CodeBuffer code;
        private final ExpressionEmitter expressions;

        Lowering(CodeBuffer code, ExpressionEmitter expressions) {
            this.code = code;
            this.expressions = expressions;
        }

        void statements(List<Statement> statements) {
            for (Statement statement : statements) {
                statement(statement);
            }
        }

        void statement(Statement statement) {
            if (statement instanceof Assignment assignment) {
                assignment(assignment);
            } else if (statement instanceof Condition condition) {
                condition(condition);
            } else if (statement instanceof Loop loop) {
                loop(loop);
            } else if (statement instanceof Block block) {
                statements(block.statements());
            }
        }

        /**
         * All values are evaluated before any target is written, so {@code a, b = b, a} swaps.
         */
        void assignment(Assignment assignment) {
            for (Expression value : assignment.values()) {
                expressions.emit(value);
            }
            List<Variable> targets = assignment.targets();
            for (int i = targets.size() - 1; i >= 0; i--) {
                Variable target = targets.get(i);
                code.emit("pop", "rax");
                code.emit("mov", "[" + target.symbol() + "], rax");
                if (target.type() == Type.STRING) {
                    code.emit("pop", "rax");
                    code.emit("mov", "[" + target.symbol() + LENGTH_SUFFIX + "], rax");
                }
            }
        }

        void condition(Condition condition) {
            int id = code.nextLabelId();
            String elseLabel = "else_" + id;
            String endLabel = "end_" + id;
            expressions.emit(condition.test());
            code.emit("pop", "rax");
            code.emit("cmp", "rax, 0");
            code.emit("je", elseLabel);
            statements(condition.thenBlock().statements());
            code.emit("jmp", endLabel);
            code.label(elseLabel);
            statements(condition.elseBlock().statements());
            code.label(endLabel);
        }

        void loop(Loop loop) {
            int id = code.nextLabelId();
            String topLabel = "loop_" + id;
            String endLabel = "loop_end_" + id;
            assignment(loop.init());
            code.label(topLabel);
            if (!loop.tests().isEmpty()) {
                expressions.emit(loop.tests().get(0));
                for (int i = 1; i < loop.tests().size(); i++) {
                    expressions.emit(loop.tests().get(i));
                    code.emit("pop", "rbx");
                    code.emit("pop", "rax");
                    code.emit("and", "rax, rbx");
                    code.emit("push", "rax");
                }
                code.emit("pop", "rax");
                code.emit("cmp", "rax, 0");
                code.emit("je", endLabel);
            }
            statements(loop.body().statements());
            assignment(loop.step());
            code.emit("jmp", topLabel);
            code.label(endLabel);
        }
    }
}
