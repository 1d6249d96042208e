package com.cburch.logsim.monitor;

import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.file.ErrorType;

/**
 * A monitor point that cannot be added or removed.
 */
public class MonitorException extends NetworkException {

    public MonitorException(ErrorType type, Object... args) {
        super(type, args);
    }
}
