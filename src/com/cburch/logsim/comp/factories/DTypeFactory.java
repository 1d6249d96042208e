package com.cburch.logsim.comp.factories;

import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.comp.AbstractDeviceFactory;
import com.cburch.logsim.comp.DeviceFactory;
import com.cburch.logsim.comp.auxiliary.PinNames;
import com.cburch.logsim.comp.impl.DTypeDevice;
import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.comp.specs.DeviceSpec;

public class DTypeFactory extends AbstractDeviceFactory implements DeviceFactory {

    public DTypeFactory(PinNames pins) {
        super(pins);
    }

    @Override
    public Device create(DeviceSpec spec) throws NetworkException {
        requireNoQualifier(spec);
        return new DTypeDevice(spec.name(), pins);
    }
}
