package com.cburch.logsim.comp.impl;

import com.cburch.logsim.data.Signal;

/**
 * Copy of a device's mutable state, used to roll a cycle back.
 *
 * @param outputs  output signals in pin order
 * @param internal kind-specific registers (countdown, stored bit, phase...)
 */
public record DeviceState(Signal[] outputs, int[] internal) {
}
