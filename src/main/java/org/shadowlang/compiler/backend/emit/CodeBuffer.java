package org.shadowlang.compiler.backend.emit;

import org.shadowlang.compiler.api.AssemblyDocument.Instruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the program section during code generation and hands out label numbers.
 * Label numbers increase monotonically over the whole program, so every construct can derive
 * unique labels from one number.
 */
public class CodeBuffer {

    private final List<Instruction> instructions = new ArrayList<>();
    private int nextLabelId = 0;

    /**
     * @param mnemonic The instruction mnemonic.
     * @param operands The operands, comma separated.
     */
    public void emit(String mnemonic, String operands) {
        instructions.add(Instruction.of(mnemonic, operands));
    }

    /**
     * @param mnemonic An instruction without operands.
     */
    public void emit(String mnemonic) {
        emit(mnemonic, "");
    }

    /**
     * @param name The label to define at the current position.
     */
    public void label(String name) {
        instructions.add(Instruction.label(name));
    }

    /**
     * @return A fresh label number.
     */
    public int nextLabelId() {
        return nextLabelId++;
    }

    /**
     * @return The instructions emitted so far.
     */
    public List<Instruction> instructions() {
        return Collections.unmodifiableList(instructions);
    }
}
