package com.cburch.logsim.comp.auxiliary;

import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

/**
 * Output terminal of a device. Holds the most recently computed signal; any
 * number of inputs may read it.
 */
public final class OutputPin {
    private final Device owner;
    private final Name name;        // null para la salida única sin nombre
    private Signal signal = Signal.LOW;

    public OutputPin(Device owner, Name name) {
        this.owner = owner;
        this.name = name;
    }

    public Device owner() { return owner; }
    public Name name()    { return name; }
    public Signal signal() { return signal; }

    /**
     * Updates the pin.
     *
     * @return true if the value changed
     */
    public boolean set(Signal value) {
        if (value == null) throw new IllegalArgumentException("Signal cannot be null");
        if (value == signal) return false;
        signal = value;
        return true;
    }

    public PinRef ref() {
        return new PinRef(owner.name(), name);
    }

    @Override
    public String toString() {
        return ref().toString();
    }
}
