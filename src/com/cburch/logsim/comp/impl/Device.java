package com.cburch.logsim.comp.impl;

import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.auxiliary.OutputPin;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;

import java.util.List;
import java.util.Optional;

/**
 * A device of the network: a kind, a fixed set of pins and, for stateful
 * kinds, a little internal state that changes from cycle to cycle.
 */
public interface Device {
    Name name();
    DeviceKind kind();

    List<InputPin> inputs();
    List<OutputPin> outputs();

    /**
     * Looks an input up by name. A null name selects the only input of a
     * single-input device.
     */
    Optional<InputPin> input(Name pin);

    /**
     * Looks an output up by name. A null name selects the only output of a
     * single-output device.
     */
    Optional<OutputPin> output(Name pin);

    /** Puts outputs and internal state back to their power-on values. */
    void reset();

    DeviceState saveState();
    void restoreState(DeviceState state);
}
