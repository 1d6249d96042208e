package com.cburch.logsim.comp;

import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.comp.specs.DeviceSpec;

/**
 * Validates one kind-specific declaration and builds the device.
 */
public interface DeviceFactory {
    Device create(DeviceSpec spec) throws NetworkException;
}
