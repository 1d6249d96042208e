package com.cburch.logsim.comp;

import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.comp.auxiliary.PinNames;
import com.cburch.logsim.comp.specs.DeviceSpec;
import com.cburch.logsim.file.ErrorType;

public abstract class AbstractDeviceFactory implements DeviceFactory {
    protected final PinNames pins;

    protected AbstractDeviceFactory(PinNames pins) {
        this.pins = pins;
    }

    /** Rejects a qualifier on kinds that take none. */
    protected void requireNoQualifier(DeviceSpec spec) throws NetworkException {
        if (spec.hasQualifier()) {
            throw new NetworkException(ErrorType.UNEXPECTED_QUALIFIER, spec.kind().keyword());
        }
    }

    /**
     * Parses the qualifier as an int inside {@code [min, max]}.
     *
     * @param missing reported when there is no qualifier
     * @param invalid reported when it is out of range
     */
    protected int requireInt(DeviceSpec spec, int min, int max,
                             ErrorType missing, ErrorType invalid, Object... invalidArgs) throws NetworkException {
        if (!spec.hasQualifier()) throw new NetworkException(missing);
        int v = spec.qualifierAsInt();
        if (v < 0) throw new NetworkException(ErrorType.NUMBER_TOO_LARGE, spec.qualifier());
        if (v < min || v > max) throw new NetworkException(invalid, invalidArgs);
        return v;
    }
}
