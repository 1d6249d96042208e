package com.cburch.logsim.comp.impl;

import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

/**
 * Source that plays a fixed bit pattern, one bit per cycle, over and over.
 */
public final class SignalGenerator extends AbstractDevice {
    private final boolean[] waveform;
    private int phase;

    public SignalGenerator(Name name, String bits) {
        super(name, DeviceKind.SIGGEN);
        if (bits == null || bits.isEmpty()) throw new IllegalArgumentException("Empty waveform for " + name);
        waveform = new boolean[bits.length()];
        for (int i = 0; i < bits.length(); i++) {
            char c = bits.charAt(i);
            if (c != '0' && c != '1') throw new IllegalArgumentException("Non-binary waveform for " + name + ": " + bits);
            waveform[i] = c == '1';
        }
        addOutput(null);
    }

    public int length() {
        return waveform.length;
    }

    public String pattern() {
        StringBuilder sb = new StringBuilder(waveform.length);
        for (boolean b : waveform) sb.append(b ? '1' : '0');
        return sb.toString();
    }

    /** Emits the next bit of the pattern. */
    public Signal tick() {
        Signal next = Signal.of(waveform[phase]);
        phase = (phase + 1) % waveform.length;
        out().set(next);
        return next;
    }

    @Override
    protected void resetInternal() {
        phase = 0;
    }

    @Override
    protected int[] saveInternal() {
        return new int[] { phase };
    }

    @Override
    protected void restoreInternal(int[] internal) {
        phase = internal[0];
    }
}
