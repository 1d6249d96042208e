package com.cburch.logsim.monitor;

import com.cburch.logsim.circuit.Network;
import com.cburch.logsim.circuit.NetworkException;
import com.cburch.logsim.comp.auxiliary.OutputPin;
import com.cburch.logsim.data.Signal;
import com.cburch.logsim.file.ErrorType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Records the signal on selected outputs, one value per completed cycle.
 * <p>
 * {@link #sampleAll(int)} is the only writer of trace data, and it records
 * each cycle at most once. A point added after some cycles have run starts its
 * trace at that cycle, see {@link #startCycle}.
 */
public final class Monitors {
    private static final Logger LOGGER = LogManager.getLogger();

    private final Network network;
    private final int capacity;
    private final Map<MonitorPoint, Trace> traces = new LinkedHashMap<>();
    private int cyclesSampled;

    private static final class Trace {
        final OutputPin pin;
        final int startCycle;
        final List<Signal> values = new ArrayList<>();

        Trace(OutputPin pin, int startCycle) {
            this.pin = pin;
            this.startCycle = startCycle;
        }
    }

    /** Nombres de señales: las monitorizadas y el resto de salidas. */
    public record SignalNames(List<String> monitored, List<String> unmonitored) { }

    public Monitors(Network network, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("Monitor capacity must be >= 1: " + capacity);
        this.network = Objects.requireNonNull(network);
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return traces.size();
    }

    /**
     * Starts monitoring {@code point}.
     *
     * @throws MonitorException if the point is not an existing output, is
     *                          already monitored, or capacity is reached
     */
    public void add(MonitorPoint point) throws MonitorException {
        OutputPin pin;
        try {
            pin = network.resolveOutput(point.ref());
        } catch (NetworkException e) {
            throw new MonitorException(e.type(), e.args());
        }
        if (traces.containsKey(point)) throw new MonitorException(ErrorType.DUPLICATE_MONITOR, point);
        if (traces.size() >= capacity) throw new MonitorException(ErrorType.MONITOR_CAPACITY, capacity);

        traces.put(point, new Trace(pin, cyclesSampled));
        LOGGER.debug("Monitoring {} from cycle {}", point, cyclesSampled);
    }

    public void remove(MonitorPoint point) throws MonitorException {
        if (traces.remove(point) == null) throw new MonitorException(ErrorType.NOT_MONITORED, point);
        LOGGER.debug("Stopped monitoring {}", point);
    }

    public void removeAll() {
        traces.clear();
    }

    public boolean contains(MonitorPoint point) {
        return traces.containsKey(point);
    }

    public List<MonitorPoint> points() {
        return List.copyOf(traces.keySet());
    }

    /**
     * Appends the current value of every monitored output for the completed
     * cycle {@code cycle} (1-based). A cycle that was already sampled is
     * ignored, so repeated calls leave the traces unchanged.
     *
     * @return true if a value was appended
     * @throws IllegalArgumentException if {@code cycle} skips over unsampled cycles
     */
    public boolean sampleAll(int cycle) {
        if (cycle <= cyclesSampled) {
            LOGGER.debug("Cycle {} already sampled, ignored", cycle);
            return false;
        }
        if (cycle != cyclesSampled + 1) {
            throw new IllegalArgumentException("Cycle " + cycle + " follows unsampled cycles (last sampled "
                    + cyclesSampled + ")");
        }
        for (Trace t : traces.values()) t.values.add(t.pin.signal());
        cyclesSampled = cycle;
        return true;
    }

    /**
     * Read-only view of the values recorded so far.
     *
     * @throws IllegalArgumentException if the point is not monitored
     */
    public List<Signal> traceOf(MonitorPoint point) {
        return Collections.unmodifiableList(requireTrace(point).values);
    }

    /** Cycle index (0-based) of the first value in the trace. */
    public int startCycle(MonitorPoint point) {
        return requireTrace(point).startCycle;
    }

    public int cyclesSampled() {
        return cyclesSampled;
    }

    /** Clears every trace but keeps the points. */
    public void resetTraces() {
        List<MonitorPoint> keep = new ArrayList<>(traces.keySet());
        Map<MonitorPoint, Trace> fresh = new LinkedHashMap<>();
        for (MonitorPoint p : keep) fresh.put(p, new Trace(traces.get(p).pin, 0));
        traces.clear();
        traces.putAll(fresh);
        cyclesSampled = 0;
    }

    public SignalNames signalNames() {
        List<String> monitored = new ArrayList<>();
        for (MonitorPoint p : traces.keySet()) monitored.add(p.signalName());

        List<String> unmonitored = new ArrayList<>();
        for (OutputPin pin : network.outputPins()) {
            MonitorPoint p = MonitorPoint.of(pin);
            if (!traces.containsKey(p)) unmonitored.add(p.signalName());
        }
        return new SignalNames(List.copyOf(monitored), List.copyOf(unmonitored));
    }

    private Trace requireTrace(MonitorPoint point) {
        Trace t = traces.get(point);
        if (t == null) throw new IllegalArgumentException("Signal " + point + " is not monitored");
        return t;
    }
}
