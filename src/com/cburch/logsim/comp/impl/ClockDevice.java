package com.cburch.logsim.comp.impl;

import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

/**
 * Square-wave source. Every {@code halfPeriod} cycles the level toggles and the
 * output carries RISING or FALLING for that one cycle.
 */
public final class ClockDevice extends AbstractDevice {
    private final int halfPeriod;
    private int countdown;
    private boolean high;

    public ClockDevice(Name name, int halfPeriod) {
        super(name, DeviceKind.CLOCK);
        if (halfPeriod < 1) throw new IllegalArgumentException("Clock half-period must be >= 1: " + halfPeriod);
        this.halfPeriod = halfPeriod;
        addOutput(null);
        resetInternal();
    }

    public int halfPeriod() { return halfPeriod; }
    public int countdown()  { return countdown; }

    /**
     * Advances one cycle and writes this cycle's clock signal.
     *
     * @return the signal now on the output
     */
    public Signal tick() {
        boolean wasHigh = high;
        if (--countdown <= 0) {
            high = !high;
            countdown = halfPeriod;
        }
        Signal next = Signal.edge(wasHigh, high);
        out().set(next);
        return next;
    }

    @Override
    protected void resetInternal() {
        countdown = halfPeriod;
        high = false;
        out().set(Signal.LOW);
    }

    @Override
    protected int[] saveInternal() {
        return new int[] { countdown, high ? 1 : 0 };
    }

    @Override
    protected void restoreInternal(int[] internal) {
        countdown = internal[0];
        high = internal[1] != 0;
    }
}
