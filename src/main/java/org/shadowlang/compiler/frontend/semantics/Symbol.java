package org.shadowlang.compiler.frontend.semantics;

import org.shadowlang.compiler.api.SourceInfo;
import org.shadowlang.compiler.frontend.parser.ast.Type;

/**
 * Represents a single variable binding in the symbol table.
 *
 * @param name The variable name as written in source code.
 * @param type The type fixed by the first assignment, {@link Type#UNKNOWN} if that failed.
 * @param shadowing true if the binding was introduced with {@code shadow}.
 * @param storageName The unique name of the binding's storage slot, e.g. {@code v_x@2}.
 * @param shadowedStorageName The storage name of the binding this one masks, or {@code null}.
 * @param declaredAt The position of the declaring variable.
 */
public record Symbol(
        String name,
        Type type,
        boolean shadowing,
        String storageName,
        String shadowedStorageName,
        SourceInfo declaredAt
) {

    /**
     * @param newType The type to fix.
     * @return A copy of this symbol with the given type.
     */
    public Symbol withType(Type newType) {
        return new Symbol(name, newType, shadowing, storageName, shadowedStorageName, declaredAt);
    }
}
