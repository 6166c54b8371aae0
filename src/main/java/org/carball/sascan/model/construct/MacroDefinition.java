package org.carball.sascan.model.construct;

public record MacroDefinition(String name, int parameterCount) {

    public MacroDefinition {
        if (parameterCount < 0) {
            throw new IllegalArgumentException("Parameter count must not be negative: " + parameterCount);
        }
    }
}
