package org.shadowlang.compiler.frontend.parser.ast;

/**
 * An expression node. The parser leaves most types {@link Type#UNKNOWN};
 * semantic analysis rebuilds the expression with resolved types.
 */
public sealed interface Expression extends AstNode permits Variable, Constant, BinaryOp, UnaryOp {

    /**
     * @return The type of the value this expression produces.
     */
    Type type();
}
