package io.catena.core.chain.step;

import io.catena.core.exception.ValidationException;

/// Discriminator of the closed set of step variants.
public enum StepType {
    MODULE_CALL("module_call"),
    CHAIN_CALL("chain_call");

    private final String wireName;

    StepType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a step type from its definition name.
    ///
    /// @param name `module_call` or `chain_call`, not null
    /// @return matching type, never null
    /// @throws ValidationException if no type carries that name
    public static StepType fromWireName(String name) {
        for (StepType type : values()) {
            if (type.wireName.equals(name)) {
                return type;
            }
        }
        throw new ValidationException("Unknown step type: " + name);
    }
}
