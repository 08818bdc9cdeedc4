package org.shadowlang.compiler.frontend.parser;

import org.shadowlang.compiler.frontend.parser.ast.Assignment;
import org.shadowlang.compiler.frontend.parser.ast.BinaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Block;
import org.shadowlang.compiler.frontend.parser.ast.Condition;
import org.shadowlang.compiler.frontend.parser.ast.Constant;
import org.shadowlang.compiler.frontend.parser.ast.Expression;
import org.shadowlang.compiler.frontend.parser.ast.Loop;
import org.shadowlang.compiler.frontend.parser.ast.Statement;
import org.shadowlang.compiler.frontend.parser.ast.UnaryOp;
import org.shadowlang.compiler.frontend.parser.ast.Variable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST in two notations.
 * <ul>
 *   <li>{@link #toSource(Block)} prints source code that parses back into the same tree.</li>
 *   <li>{@link #tree(Statement)} and {@link #tree(Expression)} print a compact, fully
 *       parenthesized notation without positions, e.g. {@code (a + (b * c))}. Two trees with the
 *       same notation are structurally identical.</li>
 * </ul>
 */
public final class AstPrinter {

    private static final String INDENT = "    ";

    private AstPrinter() {}

    /**
     * @param root The root block of a program.
     * @return Source code for the program, one statement per line.
     */
    public static String toSource(Block root) {
        StringBuilder sb = new StringBuilder();
        for (Statement statement : root.statements()) {
            appendStatement(sb, statement, 0);
        }
        return sb.toString();
    }

    private static void appendStatement(StringBuilder sb, Statement statement, int depth) {
        String indent = INDENT.repeat(depth);
        if (statement instanceof Assignment assignment) {
            sb.append(indent).append(source(assignment)).append('\n');
        } else if (statement instanceof Condition condition) {
            sb.append(indent).append("if ").append(source(condition.test())).append(" {\n");
            appendBody(sb, condition.thenBlock(), depth);
            if (condition.elseBlock().isEmpty()) {
                sb.append(indent).append("}\n");
            } else {
                sb.append(indent).append("} else {\n");
                appendBody(sb, condition.elseBlock(), depth);
                sb.append(indent).append("}\n");
            }
        } else if (statement instanceof Loop loop) {
            String tests = loop.tests().stream().map(AstPrinter::source).collect(Collectors.joining(", "));
            sb.append(indent).append("for ")
                    .append(source(loop.init())).append(';')
                    .append(tests.isEmpty() ? "" : " " + tests).append(';')
                    .append(loop.step().isEmpty() ? "" : " " + source(loop.step())).append(" {\n");
            appendBody(sb, loop.body(), depth);
            sb.append(indent).append("}\n");
        } else if (statement instanceof Block block) {
            // The grammar has no bare blocks; print the contents inline.
            for (Statement inner : block.statements()) {
                appendStatement(sb, inner, depth);
            }
        }
    }

    private static void appendBody(StringBuilder sb, Block block, int depth) {
        for (Statement statement : block.statements()) {
            appendStatement(sb, statement, depth + 1);
        }
    }

    private static String source(Assignment assignment) {
        if (assignment.isEmpty()) {
            return "";
        }
        return assignment.targets().stream().map(AstPrinter::source).collect(Collectors.joining(", "))
                + " = "
                + assignment.values().stream().map(AstPrinter::source).collect(Collectors.joining(", "));
    }

    /**
     * @param expression An expression.
     * @return Source code that parses back into the same expression.
     */
    public static String source(Expression expression) {
        if (expression instanceof Constant constant) {
            return constant.literal();
        }
        if (expression instanceof Variable variable) {
            return variable.shadow() ? "shadow " + variable.name() : variable.name();
        }
        if (expression instanceof UnaryOp unary) {
            // Parenthesized, so '-' never merges with a numeric literal.
            return unary.operator().symbol() + "(" + source(unary.operand()) + ")";
        }
        BinaryOp binary = (BinaryOp) expression;
        String left = source(binary.left());
        // The right operand extends to the end of the expression anyway; a compound left one
        // would otherwise absorb the operator.
        if (binary.left() instanceof BinaryOp || binary.left() instanceof UnaryOp) {
            left = "(" + left + ")";
        }
        return left + " " + binary.operator().symbol() + " " + source(binary.right());
    }

    /**
     * @param statement A statement.
     * @return The canonical tree notation of the statement.
     */
    public static String tree(Statement statement) {
        if (statement instanceof Assignment assignment) {
            if (assignment.isEmpty()) {
                return "<none>";
            }
            return join(assignment.targets()) + " = " + join(assignment.values());
        }
        if (statement instanceof Condition condition) {
            return "if " + tree(condition.test()) + " " + tree(condition.thenBlock())
                    + " else " + tree(condition.elseBlock());
        }
        if (statement instanceof Loop loop) {
            return "for " + tree(loop.init()) + "; " + join(loop.tests()) + "; " + tree(loop.step())
                    + " " + tree(loop.body());
        }
        Block block = (Block) statement;
        return block.statements().stream().map(AstPrinter::tree).collect(Collectors.joining("; ", "{", "}"));
    }

    /**
     * @param expression An expression.
     * @return The canonical tree notation of the expression.
     */
    public static String tree(Expression expression) {
        return tree(expression, false);
    }

    /**
     * Like {@link #tree(Expression)}, with every node suffixed by its type, e.g. {@code (a:int + 1:int):int}.
     * @param expression An expression.
     * @return The typed tree notation of the expression.
     */
    public static String typedTree(Expression expression) {
        return tree(expression, true);
    }

    private static String tree(Expression expression, boolean withTypes) {
        String text;
        if (expression instanceof Constant constant) {
            text = constant.literal();
        } else if (expression instanceof Variable variable) {
            text = variable.shadow() ? "shadow " + variable.name() : variable.name();
        } else if (expression instanceof UnaryOp unary) {
            text = "(" + unary.operator().symbol() + tree(unary.operand(), withTypes) + ")";
        } else {
            BinaryOp binary = (BinaryOp) expression;
            text = "(" + tree(binary.left(), withTypes) + " " + binary.operator().symbol() + " "
                    + tree(binary.right(), withTypes) + ")";
        }
        return withTypes ? text + ":" + expression.type().displayName() : text;
    }

    private static String join(List<? extends Expression> expressions) {
        return expressions.stream().map(AstPrinter::tree).collect(Collectors.joining(", "));
    }
}
