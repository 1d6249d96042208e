package com.cburch.logsim.comp.factories;

import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.comp.AbstractDeviceFactory;
import com.cburch.logsim.comp.DeviceFactory;
import com.cburch.logsim.comp.auxiliary.PinNames;
import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.comp.impl.GateDevice;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.comp.specs.DeviceSpec;
import com.cburch.logsim.file.ErrorType;

public class GateFactory extends AbstractDeviceFactory implements DeviceFactory {
    private final int maxInputs;

    public GateFactory(PinNames pins, int maxInputs) {
        super(pins);
        this.maxInputs = maxInputs;
    }

    @Override
    public Device create(DeviceSpec spec) throws NetworkException {
        DeviceKind kind = spec.kind();
        int arity;
        if (kind.qualifier() == DeviceKind.Qualifier.ARITY) {
            arity = requireInt(spec, 1, maxInputs,
                    ErrorType.MISSING_ARITY, ErrorType.INVALID_ARITY, maxInputs);
        } else {
            // XOR y NOT: número de entradas fijo
            requireNoQualifier(spec);
            arity = kind.fixedInputs();
        }
        return new GateDevice(spec.name(), kind, pins.gateInputs(arity));
    }
}
