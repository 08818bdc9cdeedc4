package org.shadowlang.compiler.frontend.parser.ast;

/**
 * A statement node.
 */
public sealed interface Statement extends AstNode permits Assignment, Condition, Loop, Block {
}
