package com.cburch.logsim.monitor;

import com.cburch.logsim.comp.auxiliary.OutputPin;
import com.cburch.logsim.comp.auxiliary.PinRef;
import com.cburch.logsim.data.Name;

import java.util.Objects;

/**
 * A device output whose signal is recorded once per cycle. The pin is null
 * for the unnamed output of a single-output device.
 */
public record MonitorPoint(Name device, Name pin) {

    public MonitorPoint {
        Objects.requireNonNull(device, "device");
    }

    public static MonitorPoint of(PinRef ref) {
        return new MonitorPoint(ref.device(), ref.pin());
    }

    public static MonitorPoint of(OutputPin pin) {
        return new MonitorPoint(pin.owner().name(), pin.name());
    }

    public PinRef ref() {
        return new PinRef(device, pin);
    }

    /** {@code D1.QBAR} or {@code N1}. */
    public String signalName() {
        return ref().toString();
    }

    @Override
    public String toString() {
        return signalName();
    }
}
