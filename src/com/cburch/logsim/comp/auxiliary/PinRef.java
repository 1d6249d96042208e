package com.cburch.logsim.comp.auxiliary;

import com.cburch.logsim.data.Name;

import java.util.Objects;

/**
 * Textual reference to a pin: {@code device[.pin]}. The pin part is null for
 * an unqualified reference.
 */
public record PinRef(Name device, Name pin) {

    public PinRef {
        Objects.requireNonNull(device, "device");
    }

    public static PinRef of(Name device) {
        return new PinRef(device, null);
    }

    public boolean isQualified() {
        return pin != null;
    }

    @Override
    public String toString() {
        return pin == null ? device.text() : device.text() + "." + pin.text();
    }
}
