package com.cburch.logsim.comp.auxiliary;

import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

/**
 * Input terminal of a device, bound to exactly one driving {@link OutputPin}.
 */
public final class InputPin {
    private final Device owner;
    private final Name name;
    private OutputPin source;

    public InputPin(Device owner, Name name) {
        this.owner = owner;
        this.name = name;
    }

    public Device owner()     { return owner; }
    public Name name()        { return name; }
    public OutputPin source() { return source; }

    public boolean isBound() {
        return source != null;
    }

    /** Binds this input once; rebinding is rejected. */
    public void bind(OutputPin driver) {
        if (driver == null) throw new IllegalArgumentException("Driver cannot be null");
        if (source != null) throw new IllegalStateException("Input " + this + " is already connected to " + source);
        source = driver;
    }

    /** Current value on the wire, as last written by the driver. */
    public Signal signal() {
        if (source == null) throw new IllegalStateException("Input " + this + " is not connected");
        return source.signal();
    }

    public PinRef ref() {
        return new PinRef(owner.name(), name);
    }

    @Override
    public String toString() {
        return ref().toString();
    }
}
