package com.cburch.logsim.comp.impl;

import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.auxiliary.OutputPin;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.Signal;

import java.util.*;

public abstract class AbstractDevice implements Device {
    protected final Name name;
    protected final DeviceKind kind;
    private final List<InputPin> inputs = new ArrayList<>();
    private final List<OutputPin> outputs = new ArrayList<>();

    protected AbstractDevice(Name name, DeviceKind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override
    public Name name() {
        return name;
    }

    @Override
    public DeviceKind kind() {
        return kind;
    }

    @Override
    public List<InputPin> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public List<OutputPin> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    @Override
    public Optional<InputPin> input(Name pin) {
        if (pin == null) {
            return inputs.size() == 1 ? Optional.of(inputs.get(0)) : Optional.empty();
        }
        for (InputPin in : inputs) {
            if (pin.equals(in.name())) return Optional.of(in);
        }
        return Optional.empty();
    }

    @Override
    public Optional<OutputPin> output(Name pin) {
        if (pin == null) {
            return outputs.size() == 1 ? Optional.of(outputs.get(0)) : Optional.empty();
        }
        for (OutputPin out : outputs) {
            if (pin.equals(out.name())) return Optional.of(out);
        }
        return Optional.empty();
    }

    /* ===== Construcción de pines (sólo desde las factories) ===== */

    protected InputPin addInput(Name pin) {
        if (pin == null) throw new IllegalArgumentException("Input pins must be named");
        if (input(pin).isPresent()) throw new IllegalArgumentException("Duplicate input " + pin + " on " + name);
        InputPin in = new InputPin(this, pin);
        inputs.add(in);
        return in;
    }

    protected OutputPin addOutput(Name pin) {
        OutputPin out = new OutputPin(this, pin);
        outputs.add(out);
        return out;
    }

    /** Single-output convenience for every kind but DTYPE. */
    protected OutputPin out() {
        return outputs.get(0);
    }

    /* ===== Estado ===== */

    @Override
    public void reset() {
        for (OutputPin o : outputs) o.set(Signal.LOW);
        resetInternal();
    }

    @Override
    public DeviceState saveState() {
        Signal[] sig = new Signal[outputs.size()];
        for (int i = 0; i < sig.length; i++) sig[i] = outputs.get(i).signal();
        return new DeviceState(sig, saveInternal());
    }

    @Override
    public void restoreState(DeviceState state) {
        Signal[] sig = state.outputs();
        if (sig.length != outputs.size()) {
            throw new IllegalArgumentException("State of " + state.outputs().length
                    + " outputs does not fit " + name + " (" + outputs.size() + ")");
        }
        for (int i = 0; i < sig.length; i++) outputs.get(i).set(sig[i]);
        restoreInternal(state.internal());
    }

    protected abstract void resetInternal();
    protected abstract int[] saveInternal();
    protected abstract void restoreInternal(int[] internal);

    @Override
    public String toString() {
        return name + ":" + kind + "[in=" + inputs.size() + ", out=" + outputs.size() + "]";
    }
}
