package org.shadowlang.compiler.backend.emit;

import org.shadowlang.compiler.frontend.parser.ast.BinaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Constant;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.parser.ast.Operator;
import org.shadowlang.compiler.frontend.parser.ast.Type;
import org.shadowlang.compiler.frontend.parser.ast.UnaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Variable;
import org.shadowlang.compiler.frontend.semantics.Symbol;
import org.shadowlang.compiler.frontend.semantics.SymbolTable;

import static org.shadowlang.compiler.backend.emit.ConstantPool.LENGTH_SUFFIX;

/**
 * Lowers typed expressions to the operand-stack discipline: every expression leaves its value
 * on top of the machine stack. Int, float and bool values take one qword; a string takes two,
 * its length below and its pointer on top.
 * <p>
 * Floats travel through general purpose registers as raw bits and are moved into SSE
 * registers only for the operation itself.
 */
public class ExpressionEmitter {

    private final CodeBuffer code;
    private final ConstantPool constants;
    private final SymbolTable symbols;

    /**
     * @param code The buffer receiving the instructions.
     * @param constants The pooled literals of the program.
     * @param symbols The symbol table of the typed tree.
     */
    public ExpressionEmitter(CodeBuffer code, ConstantPool constants, SymbolTable symbols) {
        this.code = code;
        this.constants = constants;
        this.symbols = symbols;
    }

    /**
     * Emits code that pushes the value of the expression.
     * @param expression A typed expression.
     */
    public void emit(Expression expression) {
        if (expression instanceof Constant constant) {
            constant(constant);
        } else if (expression instanceof Variable variable) {
            variable(variable);
        } else if (expression instanceof UnaryOp unary) {
            unary(unary);
        } else if (expression instanceof BinaryOp binary) {
            binary(binary);
        }
    }

    private void constant(Constant constant) {
        String name = constants.nameOf(constant);
        if (constant.type() == Type.STRING) {
            code.emit("mov", "rax, " + name + LENGTH_SUFFIX);
            code.emit("push", "rax");
            code.emit("lea", "rax, [" + name + "]");
            code.emit("push", "rax");
        } else {
            code.emit("mov", "rax, " + name);
            code.emit("push", "rax");
        }
    }

    private void variable(Variable variable) {
        if (variable.shadow()) {
            copyShadowedValue(variable);
        }
        String slot = variable.symbol();
        if (variable.type() == Type.STRING) {
            code.emit("mov", "rax, [" + slot + LENGTH_SUFFIX + "]");
            code.emit("push", "rax");
        }
        code.emit("mov", "rax, [" + slot + "]");
        code.emit("push", "rax");
    }

    // 'shadow x' read in an expression starts the new binding with the outer value.
    private void copyShadowedValue(Variable variable) {
        Symbol symbol = symbols.byStorageName(variable.symbol())
                .orElseThrow(() -> new IllegalStateException("No binding for " + variable.symbol()));
        String outer = symbol.shadowedStorageName();
        if (outer == null) {
            return;
        }
        code.emit("mov", "rax, [" + outer + "]");
        code.emit("mov", "[" + symbol.storageName() + "], rax");
        if (variable.type() == Type.STRING) {
            code.emit("mov", "rax, [" + outer + LENGTH_SUFFIX + "]");
            code.emit("mov", "[" + symbol.storageName() + LENGTH_SUFFIX + "], rax");
        }
    }

    private void unary(UnaryOp unary) {
        emit(unary.operand());
        code.emit("pop", "rax");
        if (unary.operator() == Operator.NOT) {
            code.emit("xor", "rax, 1");
        } else if (unary.type() == Type.FLOAT) {
            code.emit("btc", "rax, 63");
        } else {
            code.emit("neg", "rax");
        }
        code.emit("push", "rax");
    }

    private void binary(BinaryOp binary) {
        emit(binary.left());
        emit(binary.right());
        Type operandType = binary.left().type();
        if (operandType == Type.STRING) {
            stringComparison(binary.operator());
            return;
        }
        code.emit("pop", "rbx");
        code.emit("pop", "rax");
        switch (binary.operator().category()) {
            case ARITHMETIC -> {
                if (operandType == Type.FLOAT) {
                    floatArithmetic(binary.operator());
                } else {
                    intArithmetic(binary.operator());
                }
            }
            case COMPARISON -> {
                if (operandType == Type.FLOAT) {
                    code.emit("movq", "xmm0, rax");
                    code.emit("movq", "xmm1, rbx");
                    code.emit("ucomisd", "xmm0, xmm1");
                    setFlag(unsignedCondition(binary.operator()));
                } else {
                    code.emit("cmp", "rax, rbx");
                    setFlag(signedCondition(binary.operator()));
                }
            }
            case LOGICAL -> code.emit(binary.operator() == Operator.AND ? "and" : "or", "rax, rbx");
            default -> throw new IllegalStateException("Not a binary operator: " + binary.operator());
        }
        code.emit("push", "rax");
    }

    private void intArithmetic(Operator operator) {
        switch (operator) {
            case PLUS -> code.emit("add", "rax, rbx");
            case MINUS -> code.emit("sub", "rax, rbx");
            case MULTIPLY -> code.emit("imul", "rax, rbx");
            case DIVIDE -> {
                code.emit("cqo");
                code.emit("idiv", "rbx");
            }
            default -> throw new IllegalStateException("Not an arithmetic operator: " + operator);
        }
    }

    private void floatArithmetic(Operator operator) {
        String instruction = switch (operator) {
            case PLUS -> "addsd";
            case MINUS -> "subsd";
            case MULTIPLY -> "mulsd";
            case DIVIDE -> "divsd";
            default -> throw new IllegalStateException("Not an arithmetic operator: " + operator);
        };
        code.emit("movq", "xmm0, rax");
        code.emit("movq", "xmm1, rbx");
        code.emit(instruction, "xmm0, xmm1");
        code.emit("movq", "rax, xmm0");
    }

    /**
     * Compares two strings byte by byte over the shorter length with {@code repe cmpsb}; if that
     * prefix is equal the lengths decide. Both paths leave unsigned flags for left against right.
     */
    private void stringComparison(Operator operator) {
        int id = code.nextLabelId();
        String lengths = "strcmp_len_" + id;
        String decided = "strcmp_done_" + id;
        code.emit("pop", "rdi");
        code.emit("pop", "r9");
        code.emit("pop", "rsi");
        code.emit("pop", "r8");
        code.emit("mov", "rcx, r8");
        code.emit("cmp", "rcx, r9");
        code.emit("cmova", "rcx, r9");
        code.emit("test", "rcx, rcx");
        code.emit("jz", lengths);
        code.emit("repe cmpsb");
        code.emit("jne", decided);
        code.label(lengths);
        code.emit("cmp", "r8, r9");
        code.label(decided);
        setFlag(unsignedCondition(operator));
        code.emit("push", "rax");
    }

    private void setFlag(String condition) {
        code.emit("set" + condition, "al");
        code.emit("movzx", "rax, al");
    }

    private static String signedCondition(Operator operator) {
        return switch (operator) {
            case EQUAL -> "e";
            case NOT_EQUAL -> "ne";
            case LESS -> "l";
            case LESS_EQUAL -> "le";
            case GREATER -> "g";
            case GREATER_EQUAL -> "ge";
            default -> throw new IllegalStateException("Not a comparison: " + operator);
        };
    }

    private static String unsignedCondition(Operator operator) {
        return switch (operator) {
            case EQUAL -> "e";
            case NOT_EQUAL -> "ne";
            case LESS -> "b";
            case LESS_EQUAL -> "be";
            case GREATER -> "a";
            case GREATER_EQUAL -> "ae";
            default -> throw new IllegalStateException("Not a comparison: " + operator);
        };
    }
}
