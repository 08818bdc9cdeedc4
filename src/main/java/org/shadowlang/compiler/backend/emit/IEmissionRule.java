package org.shadowlang.compiler.backend.emit;

import org.shadowlang.compiler.api.AssemblyDocument.Instruction;

import java.util.List;

/**
 * Rewriter rule that can modify the program section after code generation.
 */
public interface IEmissionRule {

    /**
     * Applies this rule to the given instruction stream.
     *
     * @param program The instructions, in emission order.
     * @return The rewritten instructions.
     */
    List<Instruction> apply(List<Instruction> program);
}
