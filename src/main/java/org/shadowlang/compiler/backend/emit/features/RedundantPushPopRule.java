package org.shadowlang.compiler.backend.emit.features;

import org.shadowlang.compiler.api.AssemblyDocument.Instruction;
import org.shadowlang.compiler.backend.emit.IEmissionRule;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Folds adjacent {@code push}/{@code pop} pairs left behind by the stack-based lowering:
 * {@code push r / pop r} disappears, {@code push a / pop b} becomes {@code mov b, a}.
 * A pair separated by a label is kept, since a jump may enter between the two.
 * The rule repeats until no pair is left, so nested pairs fold as well.
 */
public class RedundantPushPopRule implements IEmissionRule {

    private static final Pattern REGISTER = Pattern.compile("r[a-z0-9]+");

    @Override
    public List<Instruction> apply(List<Instruction> program) {
        List<Instruction> current = program;
        boolean changed = true;
        while (changed) {
            changed = false;
            List<Instruction> out = new ArrayList<>(current.size());
            int i = 0;
            while (i < current.size()) {
                Instruction first = current.get(i);
                Instruction second = i + 1 < current.size() ? current.get(i + 1) : null;
                if (second != null && isFoldable(first, second)) {
                    if (!first.operands().equals(second.operands())) {
                        out.add(Instruction.of("mov", second.operands() + ", " + first.operands()));
                    }
                    i += 2;
                    changed = true;
                } else {
                    out.add(first);
                    i++;
                }
            }
            current = out;
        }
        return current;
    }

    private boolean isFoldable(Instruction push, Instruction pop) {
        return !push.hasLabel() && !pop.hasLabel()
                && push.mnemonic().equals("push") && pop.mnemonic().equals("pop")
                && REGISTER.matcher(push.operands()).matches()
                && REGISTER.matcher(pop.operands()).matches();
    }
}
