package com.cburch.logsim.circuit;

import com.cburch.logsim.comp.auxiliary.InputPin;
import com.cburch.logsim.comp.impl.*;
import com.cburch.logsim.monitor.Monitors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Advances a complete network one logical cycle at a time.
 * <p>
 * Each cycle: flip-flops expose last cycle's bit, sources tick, gates are
 * re-evaluated until a whole pass changes nothing, flip-flops latch and
 * monitors sample. If the gates do not settle within {@code maxPasses} the
 * cycle is rolled back and reported as diverged.
 * <p>
 * Gates are evaluated in dependency order, worked out once from the wiring:
 * every gate comes after the gates that drive it, except on feedback loops,
 * which are broken at the earliest-declared gate. Logic without feedback
 * settles in a single pass, whatever order it was declared in.
 */
public final class Propagator {
    private static final Logger LOGGER = LogManager.getLogger();

    private final Network network;
    private final Monitors monitors;
    private final int maxPasses;

    // Listas por categoría, en orden de declaración
    private final List<SwitchDevice> switches = new ArrayList<>();
    private final List<ClockDevice> clocks = new ArrayList<>();
    private final List<SignalGenerator> generators = new ArrayList<>();
    private final List<DTypeDevice> flipFlops = new ArrayList<>();
    // Compuertas en orden de evaluación (ver evaluationOrder)
    private final List<GateDevice> gates;

    private int cycle;

    public Propagator(Network network, Monitors monitors, int maxPasses) {
        this.network = Objects.requireNonNull(network);
        this.monitors = Objects.requireNonNull(monitors);
        if (maxPasses < 1) throw new IllegalArgumentException("maxPasses must be >= 1: " + maxPasses);
        if (!network.isComplete()) {
            throw new IllegalStateException("Network has unconnected inputs: " + network.unboundInputs());
        }
        this.maxPasses = maxPasses;

        List<GateDevice> declared = new ArrayList<>();
        for (Device d : network.devices()) {
            switch (d.kind()) {
                case SWITCH -> switches.add((SwitchDevice) d);
                case CLOCK -> clocks.add((ClockDevice) d);
                case SIGGEN -> generators.add((SignalGenerator) d);
                case AND, OR, NAND, NOR, XOR, NOT -> declared.add((GateDevice) d);
                case DTYPE -> flipFlops.add((DTypeDevice) d);
            }
        }
        this.gates = evaluationOrder(declared);
    }

    public int maxPasses() {
        return maxPasses;
    }

    /** Cycles completed so far. */
    public int cycle() {
        return cycle;
    }

    /**
     * Runs one cycle.
     *
     * @return the outcome; on divergence every device is back to its
     *         pre-cycle state and no trace was sampled
     */
    public CycleResult executeCycle() {
        int attempt = cycle + 1;
        Map<Device, DeviceState> snapshot = network.saveState();

        // 1) fuentes y biestables
        for (DTypeDevice ff : flipFlops) ff.expose();
        for (SwitchDevice sw : switches) sw.drive();
        for (ClockDevice c : clocks) c.tick();
        for (SignalGenerator g : generators) g.tick();

        // 2) punto fijo de la lógica combinacional
        int passes = settle();
        if (passes < 0) {
            network.restoreState(snapshot);
            LOGGER.warn("Cycle {}: network did not settle within {} passes, rolled back", attempt, maxPasses);
            return CycleResult.diverged(attempt, maxPasses);
        }

        // 3) los biestables capturan; la salida se ve en el ciclo siguiente
        for (DTypeDevice ff : flipFlops) ff.commit();

        // 4) muestreo
        monitors.sampleAll(attempt);
        cycle = attempt;
        LOGGER.debug("Cycle {} settled after {} passes", attempt, passes);
        return CycleResult.settled(attempt, passes);
    }

    /**
     * Runs up to {@code count} cycles, stopping at the first divergence.
     *
     * @return the last result, or null when {@code count} is 0
     */
    public CycleResult execute(int count) {
        if (count < 0) throw new IllegalArgumentException("Cycle count cannot be negative: " + count);
        CycleResult last = null;
        for (int i = 0; i < count; i++) {
            last = executeCycle();
            if (!last.converged()) break;
        }
        return last;
    }

    /** Back to power-on state with empty traces; switches keep their level. */
    public void reset() {
        network.reset();
        monitors.resetTraces();
        cycle = 0;
    }

    /**
     * Orders gates so each one follows the gates driving its inputs. When
     * every remaining gate waits on another (a feedback loop), the
     * earliest-declared one is placed next and the ordering carries on from it.
     */
    static List<GateDevice> evaluationOrder(List<GateDevice> declared) {
        Map<Device, Integer> waiting = new HashMap<>();
        Map<Device, List<GateDevice>> driven = new HashMap<>();
        for (GateDevice g : declared) {
            int n = 0;
            for (InputPin in : g.inputs()) {
                Device driver = in.source().owner();
                if (!driver.kind().isGate()) continue;
                n++;
                driven.computeIfAbsent(driver, k -> new ArrayList<>()).add(g);
            }
            waiting.put(g, n);
        }

        List<GateDevice> order = new ArrayList<>(declared.size());
        Set<GateDevice> placed = new HashSet<>();
        Deque<GateDevice> ready = new ArrayDeque<>();
        for (GateDevice g : declared) if (waiting.get(g) == 0) ready.add(g);

        int next = 0; // siguiente candidato para romper un lazo
        while (order.size() < declared.size()) {
            GateDevice g = ready.poll();
            if (g == null) {
                while (placed.contains(declared.get(next))) next++;
                g = declared.get(next);
            }
            if (!placed.add(g)) continue;
            order.add(g);
            for (GateDevice d : driven.getOrDefault(g, List.of())) {
                int left = waiting.merge(d, -1, Integer::sum);
                if (left == 0 && !placed.contains(d)) ready.add(d);
            }
        }
        LOGGER.debug("Gate evaluation order: {}", order);
        return order;
    }

    /**
     * Evaluates gates in place until a pass changes nothing.
     *
     * @return passes used, or -1 if the limit was hit
     */
    private int settle() {
        for (int pass = 1; pass <= maxPasses; pass++) {
            boolean changed = false;
            for (GateDevice g : gates) {
                if (g.propagate()) changed = true;
            }
            if (!changed) return pass;
        }
        return -1;
    }
}
