package org.shadowlang.compiler.backend.emit;

import org.shadowlang.compiler.backend.emit.features.RedundantPushPopRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for emission rules applied in order.
 */
public final class EmissionRegistry {

    private final List<IEmissionRule> rules = new ArrayList<>();

    /**
     * Registers a new emission rule.
     * @param rule The rule to register.
     */
    public void register(IEmissionRule rule) { rules.add(rule); }

    /**
     * @return The list of registered emission rules.
     */
    public List<IEmissionRule> rules() { return rules; }

    /**
     * Initializes a new emission registry with the default rules.
     * @return A new registry with default rules.
     */
    public static EmissionRegistry initializeWithDefaults() {
        EmissionRegistry reg = new EmissionRegistry();
        reg.register(new RedundantPushPopRule());
        return reg;
    }

    /**
     * @return A registry without rules; the program is emitted as generated.
     */
    public static EmissionRegistry empty() {
        return new EmissionRegistry();
    }
}
