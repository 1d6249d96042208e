package com.cburch.logsim.proj;

import com.cburch.logsim.circuit.CycleResult;
import com.cburch.logsim.circuit.Network;
import com.cburch.logsim.circuit.Propagator;
import com.cburch.logsim.comp.impl.Device;
import com.cburch.logsim.comp.impl.SwitchDevice;
import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.file.ParseResult;
import com.cburch.logsim.monitor.Monitors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A running session over one parsed definition: the run / continue / reset
 * and switch controls a front end needs.
 */
public final class Simulation {
    private static final Logger LOGGER = LogManager.getLogger();

    private final Network network;
    private final Monitors monitors;
    private final Propagator propagator;

    /**
     * Result of {@link #run} or {@link #continueRun}.
     *
     * @param requested cycles asked for
     * @param completed cycles that settled in this call
     * @param failure   the failed cycle, or null when all settled
     */
    public record RunOutcome(int requested, int completed, CycleResult failure) {
        public boolean succeeded() {
            return failure == null;
        }
    }

    /**
     * @throws IllegalStateException if the definition had errors
     */
    public Simulation(ParseResult result) {
        Objects.requireNonNull(result);
        if (!result.isSimulatable()) {
            throw new IllegalStateException("Definition has " + result.errorCount() + " error(s); cannot simulate");
        }
        this.network = result.network();
        this.monitors = result.monitors();
        this.propagator = new Propagator(network, monitors, result.prefs().maxPasses());
    }

    public Network network() {
        return network;
    }

    public Monitors monitors() {
        return monitors;
    }

    public int cyclesCompleted() {
        return propagator.cycle();
    }

    /** Starts over: device state and traces back to power-on, then runs {@code cycles}. */
    public RunOutcome run(int cycles) {
        reset();
        return advance(cycles);
    }

    /** Appends {@code cycles} to the current run. */
    public RunOutcome continueRun(int cycles) {
        return advance(cycles);
    }

    /** Clocks, generators, flip-flops and traces back to their initial state. Switches keep their level. */
    public void reset() {
        propagator.reset();
    }

    /**
     * Sets a switch between cycles.
     *
     * @throws IllegalArgumentException if there is no switch with that name
     */
    public void setSwitch(String name, boolean high) {
        Device d = network.device(name)
                .filter(dev -> dev.kind() == DeviceKind.SWITCH)
                .orElseThrow(() -> new IllegalArgumentException("No switch named " + name));
        ((SwitchDevice) d).setState(high);
        LOGGER.debug("Switch {} set to {}", name, high ? 1 : 0);
    }

    private RunOutcome advance(int cycles) {
        if (cycles < 0) throw new IllegalArgumentException("Cycle count cannot be negative: " + cycles);
        int done = 0;
        for (int i = 0; i < cycles; i++) {
            CycleResult r = propagator.executeCycle();
            if (!r.converged()) {
                LOGGER.info("Run stopped after {} of {} cycle(s)", done, cycles);
                return new RunOutcome(cycles, done, r);
            }
            done++;
        }
        LOGGER.info("Ran {} cycle(s), {} in total", done, propagator.cycle());
        return new RunOutcome(cycles, done, null);
    }
}
