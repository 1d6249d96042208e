package com.cburch.logsim.comp.impl;

import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

/**
 * Input source whose level is set by the user between cycles.
 */
public final class SwitchDevice extends AbstractDevice {
    private boolean state;

    public SwitchDevice(Name name, boolean initialState) {
        super(name, DeviceKind.SWITCH);
        this.state = initialState;
        addOutput(null);
        out().set(Signal.of(state));
    }

    public boolean state() {
        return state;
    }

    /** Takes effect on the output right away; cycles read it from there. */
    public void setState(boolean high) {
        state = high;
        out().set(Signal.of(high));
    }

    /** @return true si la salida cambió */
    public boolean drive() {
        return out().set(Signal.of(state));
    }

    // El estado del switch lo fija el usuario: un reset no lo toca
    @Override
    protected void resetInternal() {
        out().set(Signal.of(state));
    }

    @Override
    protected int[] saveInternal() {
        return new int[] { state ? 1 : 0 };
    }

    @Override
    protected void restoreInternal(int[] internal) {
        state = internal[0] != 0;
    }
}
