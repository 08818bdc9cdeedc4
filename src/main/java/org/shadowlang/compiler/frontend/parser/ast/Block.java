package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A sequence of statements with its own scope. The scope is not stored in the node; the
 * {@link org.shadowlang.compiler.frontend.semantics.SymbolTable} maps each block instance to it.
 * Blocks are therefore compared by identity wherever scopes are involved.
 *
 * @param statements The statements in source order.
 * @param source The position of the opening brace, or of the first token for the root block.
 */
public record Block(
        List<Statement> statements,
        SourceInfo source
) implements Statement {

    /**
     * Compact constructor making the statement list immutable.
     */
    public Block {
        statements = List.copyOf(statements);
    }

    /**
     * @return true if the block contains no statements.
     */
    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }
}
