package com.cburch.logsim.comp.specs;

import com.cburch.logsim.data.Name;

import java.util.Objects;

/**
 * One parsed device declaration, before validation.
 *
 * @param name      device name
 * @param kind      device kind
 * @param qualifier digits written after the kind, or null when absent
 */
public record DeviceSpec(Name name, DeviceKind kind, String qualifier) {

    public DeviceSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean hasQualifier() {
        return qualifier != null && !qualifier.isEmpty();
    }

    /** Qualifier as an int, or -1 if absent or too large. */
    public int qualifierAsInt() {
        if (!hasQualifier()) return -1;
        try {
            return Integer.parseInt(qualifier);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
