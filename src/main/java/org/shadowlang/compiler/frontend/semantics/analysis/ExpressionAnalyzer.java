package org.shadowlang.compiler.frontend.semantics.analysis;

import org.shadowlang.compiler.api.CompilerErrorCode;
import org.shadowlang.compiler.frontend.parser.ast.BinaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Constant;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.shadowlang.compiler.frontend.parser.ast.UnaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Variable;
import org.shadowlang.compiler.frontend.semantics.Symbol;
import org.shadowlang.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Resolves the type of expressions and binds the variables they read.
 * An expression whose type cannot be determined gets {@link Type#UNKNOWN}; operators over an
 * UNKNOWN operand report nothing, so one mistake yields one error.
 */
public class ExpressionAnalyzer {

    private final AnalysisContext context;

    /**
     * @param context The analysis run this analyzer belongs to.
     */
    public ExpressionAnalyzer(AnalysisContext context) {
        this.context = context;
    }

    /**
     * @param expression The parsed expression.
     * @return A copy of the expression with all types and bindings resolved.
     */
    public Expression analyze(Expression expression) {
        if (expression instanceof Constant constant) {
            return constant(constant);
        }
        if (expression instanceof Variable variable) {
            return variable(variable);
        }
        if (expression instanceof UnaryOp unary) {
            return unary(unary);
        }
        if (expression instanceof BinaryOp binary) {
            return binary(binary);
        }
        throw context.critical(CompilerErrorCode.MALFORMED_TREE,
                "Unsupported expression node " + expression.getClass().getSimpleName() + ".", expression.source());
    }

    private Expression constant(Constant constant) {
        Type type = Constant.classify(constant.literal());
        if (type == Type.UNKNOWN) {
            context.error(CompilerErrorCode.INVALID_LITERAL,
                    String.format("Invalid literal '%s'.", constant.literal()), constant.source());
            return new Constant(constant.literal(), Type.UNKNOWN, constant.source());
        }
        if (type == Type.INT) {
            try {
                Long.parseLong(constant.literal());
            } catch (NumberFormatException e) {
                context.error(CompilerErrorCode.INVALID_LITERAL,
                        String.format("Integer literal '%s' is out of range.", constant.literal()), constant.source());
                return new Constant(constant.literal(), Type.UNKNOWN, constant.source());
            }
        }
        return new Constant(constant.literal(), type, constant.source());
    }

    private Expression variable(Variable variable) {
        SymbolTable symbols = context.symbols();
        Optional<Symbol> visible = symbols.resolve(variable.name());
        if (variable.shadow()) {
            if (symbols.isDeclaredInCurrentScope(variable.name())) {
                context.error(CompilerErrorCode.REDECLARATION,
                        String.format("Variable '%s' is already declared in this scope.", variable.name()),
                        variable.source());
                Symbol existing = visible.orElseThrow();
                return variable.resolve(existing.type(), existing.storageName());
            }
            if (visible.isEmpty()) {
                context.error(CompilerErrorCode.UNRESOLVED_IDENTIFIER,
                        String.format("Cannot shadow '%s': no variable of that name is in scope.", variable.name()),
                        variable.source());
                return variable;
            }
            Symbol copy = symbols.declare(variable.name(), visible.get().type(), true, variable.source());
            return variable.resolve(copy.type(), copy.storageName());
        }
        if (visible.isEmpty()) {
            context.error(CompilerErrorCode.UNRESOLVED_IDENTIFIER,
                    String.format("Unresolved identifier '%s'.", variable.name()), variable.source());
            return variable;
        }
        return variable.resolve(visible.get().type(), visible.get().storageName());
    }

    private Expression unary(UnaryOp unary) {
        Expression operand = analyze(unary.operand());
        Type type = Type.UNKNOWN;
        if (operand.type() != Type.UNKNOWN) {
            Optional<Type> result = OperatorRules.unaryResult(unary.operator(), operand.type());
            if (result.isPresent()) {
                type = result.get();
            } else {
                context.error(CompilerErrorCode.OPERAND_TYPE_MISMATCH,
                        String.format("Operator '%s' cannot be applied to %s.",
                                unary.operator().symbol(), operand.type().displayName()),
                        unary.source());
            }
        }
        return new UnaryOp(unary.operator(), operand, type, unary.source());
    }

    private Expression binary(BinaryOp binary) {
        Expression left = analyze(binary.left());
        Expression right = analyze(binary.right());
        Type type = Type.UNKNOWN;
        if (left.type() != Type.UNKNOWN && right.type() != Type.UNKNOWN) {
            Optional<Type> result = OperatorRules.binaryResult(binary.operator(), left.type(), right.type());
            if (result.isPresent()) {
                type = result.get();
            } else {
                context.error(CompilerErrorCode.OPERAND_TYPE_MISMATCH,
                        String.format("Operator '%s' cannot be applied to %s and %s.",
                                binary.operator().symbol(), left.type().displayName(), right.type().displayName()),
                        binary.source());
            }
        }
        return new BinaryOp(binary.operator(), left, right, type, binary.source());
    }
}
