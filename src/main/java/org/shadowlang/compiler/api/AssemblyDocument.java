package org.shadowlang.compiler.api;

import java.util.List;

/**
 * The output of code generation: a four-section assembly document for the external assembler.
 * This is an immutable data carrier; {@link #render()} produces the text the assembler reads.
 *
 * @param header Directives selecting the target and declaring external and global symbols.
 * @param constants Symbolic constants, one per distinct literal.
 * @param variables Storage slots and string literal data.
 * @param program The instructions, in emission order.
 */
public record AssemblyDocument(
        List<String> header,
        List<ConstantEntry> constants,
        List<DataEntry> variables,
        List<Instruction> program
) {

    /**
     * A constant definition, {@code name equ value}.
     *
     * @param name The symbol name.
     * @param value The value expression.
     */
    public record ConstantEntry(String name, String value) {
    }

    /**
     * A data definition, {@code name directive initial}.
     *
     * @param name The label of the data.
     * @param directive The storage directive, e.g. {@code dq} or {@code db}.
     * @param initial The initial value.
     */
    public record DataEntry(String name, String directive, String initial) {
    }

    /**
     * One line of the program section. A line defines a label, holds an instruction, or both.
     *
     * @param label The label defined at this line, or an empty string.
     * @param mnemonic The instruction mnemonic, or an empty string for a pure label line.
     * @param operands The operands, comma separated, or an empty string.
     */
    public record Instruction(String label, String mnemonic, String operands) {

        /**
         * @param mnemonic The mnemonic.
         * @param operands The operands.
         * @return An unlabeled instruction.
         */
        public static Instruction of(String mnemonic, String operands) {
            return new Instruction("", mnemonic, operands);
        }

        /**
         * @param name The label name.
         * @return A line defining only a label.
         */
        public static Instruction label(String name) {
            return new Instruction(name, "", "");
        }

        /**
         * @return true if this line defines a label.
         */
        public boolean hasLabel() {
            return !label.isEmpty();
        }
    }

    /**
     * Compact constructor making all sections immutable.
     */
    public AssemblyDocument {
        header = List.copyOf(header);
        constants = List.copyOf(constants);
        variables = List.copyOf(variables);
        program = List.copyOf(program);
    }

    /**
     * @param newProgram The replacement program section.
     * @return A copy of this document with another program section.
     */
    public AssemblyDocument withProgram(List<Instruction> newProgram) {
        return new AssemblyDocument(header, constants, variables, newProgram);
    }

    /**
     * Renders the document as assembler source, with aligned columns. The data section holds
     * the variables and the text section holds the program.
     * @return The assembler source text.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (String line : header) {
            sb.append(line).append('\n');
        }
        sb.append('\n');
        for (ConstantEntry constant : constants) {
            sb.append(String.format("%-24s%-8s%s\n", constant.name(), "equ", constant.value()));
        }
        sb.append('\n').append("section .data").append('\n');
        for (DataEntry data : variables) {
            sb.append(String.format("%-24s%-8s%s\n", data.name(), data.directive(), data.initial()));
        }
        sb.append('\n').append("section .text").append('\n');
        for (Instruction instruction : program) {
            if (instruction.hasLabel()) {
                sb.append(instruction.label()).append(':').append('\n');
            }
            if (!instruction.mnemonic().isEmpty()) {
                String line = String.format("%-24s%-8s%s", "", instruction.mnemonic(), instruction.operands());
                sb.append(line.stripTrailing()).append('\n');
            }
        }
        return sb.toString();
    }
}
