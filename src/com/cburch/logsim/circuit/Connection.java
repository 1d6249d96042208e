package com.cburch.logsim.circuit;

import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.auxiliary.OutputPin;

/**
 * A wire from one output to one input.
 */
public record Connection(OutputPin source, InputPin destination) {

    @Override
    public String toString() {
        return source + " > " + destination;
    }
}
