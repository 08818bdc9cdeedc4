package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

import java.util.List;

/**
 * An {@code if} statement. Without an {@code else} branch, the else block is empty.
 *
 * @param test The condition, must be bool.
 * @param thenBlock The block run when the test holds.
 * @param elseBlock The block run otherwise, possibly empty.
 * @param source The position of the {@code if} keyword.
 */
public record Condition(
        Expression test,
        Block thenBlock,
        Block elseBlock,
        SourceInfo source
) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(test, thenBlock, elseBlock);
    }
}
