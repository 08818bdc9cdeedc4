package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.frontend.semantics.SymbolTable;

/**
 * The compilation unit: the root block and the symbol table holding all scopes.
 * The root block's scope is the table's global scope.
 *
 * @param root The top-level block.
 * @param symbolTable The scopes of all blocks, empty until analysis has run.
 */
public record Ast(Block root, SymbolTable symbolTable) {
}
