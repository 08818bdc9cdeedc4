package org.shadowlang.compiler.frontend.parser.ast;

import org.shadowlang.compiler.api.SourceInfo;

/**
 * A variable reference, either as an assignment target or inside an expression.
 *
 * @param name The name as written in source code.
 * @param type The type of the binding this variable resolves to.
 * @param shadow true if written as {@code shadow name}, which declares a new binding.
 * @param symbol The storage name of the resolved binding, {@code null} before analysis.
 * @param source The position of the name (or of the {@code shadow} keyword).
 */
public record Variable(
        String name,
        Type type,
        boolean shadow,
        String symbol,
        SourceInfo source
) implements Expression {

    /**
     * Creates an unresolved variable as produced by the parser.
     * @param name The variable name.
     * @param shadow Whether the variable was written with {@code shadow}.
     * @param source The source position.
     */
    public Variable(String name, boolean shadow, SourceInfo source) {
        this(name, Type.UNKNOWN, shadow, null, source);
    }

    /**
     * @param resolvedType The type of the binding.
     * @param storageName The storage name of the binding.
     * @return A copy of this variable bound to the given binding.
     */
    public Variable resolve(Type resolvedType, String storageName) {
        return new Variable(name, resolvedType, shadow, storageName, source);
    }
}
