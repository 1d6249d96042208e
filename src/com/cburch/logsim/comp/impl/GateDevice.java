package com.cburch.logsim.comp.impl;

import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

import java.util.List;

/**
 * Combinational gate: AND, OR, NAND, NOR, XOR or NOT.
 */
public final class GateDevice extends AbstractDevice {

    public GateDevice(Name name, DeviceKind kind, List<Name> inputNames) {
        super(name, kind);
        if (!kind.isGate()) throw new IllegalArgumentException(kind + " is not a gate");
        int fixed = kind.fixedInputs();
        if (inputNames.isEmpty() || (fixed > 0 && inputNames.size() != fixed)) {
            throw new IllegalArgumentException(kind + " cannot have " + inputNames.size() + " inputs");
        }
        for (Name n : inputNames) addInput(n);
        addOutput(null);
    }

    /** Output for the current input values. Edge markers count as their level. */
    public Signal evaluate() {
        List<InputPin> in = inputs();
        return switch (kind) {
            case AND  -> Signal.of(allHigh(in));
            case NAND -> Signal.of(!allHigh(in));
            case OR   -> Signal.of(anyHigh(in));
            case NOR  -> Signal.of(!anyHigh(in));
            case XOR  -> Signal.of(in.get(0).signal().isHigh() != in.get(1).signal().isHigh());
            case NOT  -> in.get(0).signal().invert();
            case SWITCH, CLOCK, SIGGEN, DTYPE ->
                    throw new IllegalStateException(kind + " is not combinational");
        };
    }

    /**
     * Re-evaluates and writes the output.
     *
     * @return true if the output changed
     */
    public boolean propagate() {
        return out().set(evaluate());
    }

    private static boolean allHigh(List<InputPin> in) {
        for (InputPin p : in) if (!p.signal().isHigh()) return false;
        return true;
    }

    private static boolean anyHigh(List<InputPin> in) {
        for (InputPin p : in) if (p.signal().isHigh()) return true;
        return false;
    }

    @Override
    protected void resetInternal() {
        // sin estado interno
    }

    @Override
    protected int[] saveInternal() {
        return new int[0];
    }

    @Override
    protected void restoreInternal(int[] internal) {
        // sin estado interno
    }
}
