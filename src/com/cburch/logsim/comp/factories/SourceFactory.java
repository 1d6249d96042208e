package com.cburch.logsim.comp.factories;

import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.comp.AbstractDeviceFactory;
import com.cburch.logsim.comp.DeviceFactory;
import com.cburch.logsim.comp.auxiliary.PinNames;
import com.cburch.logsim.comp.impl.ClockDevice;
import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.comp.impl.SignalGenerator;
import com.cburch.logsim.comp.impl.SwitchDevice;
import com.cburch.logsim.comp.specs.DeviceSpec;
import com.cburch.logsim.file.ErrorType;
import com.cburch.logsim.util.StringUtil;

/**
 * SWITCH, CLOCK and SIGGEN: devices with no inputs.
 */
public class SourceFactory extends AbstractDeviceFactory implements DeviceFactory {

    public SourceFactory(PinNames pins) {
        super(pins);
    }

    @Override
    public Device create(DeviceSpec spec) throws NetworkException {
        return switch (spec.kind()) {
            case SWITCH -> {
                // "0" o "1" exactamente; "01" no es un bit
                String q = spec.qualifier();
                if (!"0".equals(q) && !"1".equals(q)) throw new NetworkException(ErrorType.INVALID_SWITCH_STATE);
                yield new SwitchDevice(spec.name(), "1".equals(q));
            }
            case CLOCK -> new ClockDevice(spec.name(),
                    requireInt(spec, 1, Integer.MAX_VALUE, ErrorType.MISSING_PERIOD, ErrorType.INVALID_PERIOD));
            case SIGGEN -> {
                if (!spec.hasQualifier()) throw new NetworkException(ErrorType.MISSING_WAVEFORM);
                if (!StringUtil.isBinary(spec.qualifier())) throw new NetworkException(ErrorType.INVALID_WAVEFORM);
                yield new SignalGenerator(spec.name(), spec.qualifier());
            }
            default -> throw new IllegalArgumentException(spec.kind() + " is not a source device");
        };
    }
}
