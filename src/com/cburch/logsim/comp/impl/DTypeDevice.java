package com.cburch.logsim.comp.impl;

import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.auxiliary.OutputPin;
import com.cburch.logsim.comp.auxiliary.PinNames;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

/**
 * Rising-edge D flip-flop with asynchronous SET and CLEAR.
 * <p>
 * A committed bit is only exposed on Q/QBAR by {@link #expose()}, which the
 * engine calls at the start of the following cycle.
 */
public final class DTypeDevice extends AbstractDevice {
    private final InputPin data, clk, set, clear;
    private final OutputPin q, qbar;

    private boolean stored;     // bit memorizado
    private boolean clkWasHigh; // nivel de CLK en el ciclo anterior

    public DTypeDevice(Name name, PinNames pins) {
        super(name, DeviceKind.DTYPE);
        this.data  = addInput(pins.data());
        this.clk   = addInput(pins.clk());
        this.set   = addInput(pins.set());
        this.clear = addInput(pins.clear());
        this.q     = addOutput(pins.q());
        this.qbar  = addOutput(pins.qbar());
        resetInternal();
    }

    /**
     * Writes the stored bit to Q and its complement to QBAR.
     *
     * @return true if either output changed
     */
    public boolean expose() {
        boolean a = q.set(Signal.of(stored));
        boolean b = qbar.set(Signal.of(!stored));
        return a || b;
    }

    /**
     * Latches against this cycle's settled inputs. SET wins over CLEAR, and
     * both win over the clock edge.
     *
     * @return true if the stored bit changed
     */
    public boolean commit() {
        boolean clkHigh = clk.signal().isHigh();
        boolean risingEdge = clkHigh && !clkWasHigh;
        clkWasHigh = clkHigh;

        boolean next = stored;
        if (set.signal().isHigh()) {
            next = true;
        } else if (clear.signal().isHigh()) {
            next = false;
        } else if (risingEdge) {
            next = data.signal().isHigh();
        }
        boolean changed = next != stored;
        stored = next;
        return changed;
    }

    @Override
    protected void resetInternal() {
        stored = false;
        clkWasHigh = false;
        expose();
    }

    @Override
    protected int[] saveInternal() {
        return new int[] { stored ? 1 : 0, clkWasHigh ? 1 : 0 };
    }

    @Override
    protected void restoreInternal(int[] internal) {
        stored = internal[0] != 0;
        clkWasHigh = internal[1] != 0;
    }
}
