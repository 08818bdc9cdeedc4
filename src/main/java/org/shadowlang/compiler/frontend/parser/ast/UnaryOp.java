package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

import java.util.List;

/**
 * A unary operation, negate or not. It applies to the entire expression that follows it.
 *
 * @param operator {@link Operator#NEGATE} or {@link Operator#NOT}.
 * @param operand The operand.
 * @param type The result type.
 * @param source The position of the operator.
 */
public record UnaryOp(
        Operator operator,
        Expression operand,
        Type type,
        SourceInfo source
) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
