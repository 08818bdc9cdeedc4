package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

import java.util.List;

/**
 * A binary operation.
 *
 * @param operator The operator.
 * @param left The left operand.
 * @param right The right operand; with right-recursive parsing, the whole rest of the chain.
 * @param type The result type.
 * @param source The position of the operator.
 */
public record BinaryOp(
        Operator operator,
        Expression left,
        Expression right,
        Type type,
        SourceInfo source
) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
