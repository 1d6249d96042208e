package com.cburch.logsim.proj;

import com.cburch.logsim.comp.auxiliary.PinRef;
import com.cburch.logsim.data.Signal;
import com.cburch.logsim.file.DefinitionLoader;
import com.cburch.logsim.file.ErrorType;
import com.cburch.logsim.file.ParseResult;
import com.cburch.logsim.monitor.MonitorPoint;
import com.cburch.logsim.monitor.Monitors;
import com.cburch.logsim.prefs.SimulatorPrefs;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationTest {
    private final DefinitionLoader loader = new DefinitionLoader(SimulatorPrefs.defaults());

    private static String fixture(String name) throws IOException {
        try (InputStream in = SimulationTest.class.getResourceAsStream("/resources/circuits/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private Simulation open(String source) {
        ParseResult r = loader.parse(source);
        assertTrue(r.isSimulatable(), r.report());
        return new Simulation(r);
    }

    private static String bits(Simulation sim, String signal) {
        Monitors m = sim.monitors();
        for (MonitorPoint p : m.points()) {
            if (p.signalName().equals(signal)) {
                StringBuilder sb = new StringBuilder();
                for (Signal s : m.traceOf(p)) sb.append(s.toBit());
                return sb.toString();
            }
        }
        throw new AssertionError(signal + " not monitored");
    }

    @Test
    void definitionWithErrorsCannotBeSimulated() {
        ParseResult r = loader.parse("DEVICES G:AND 2; END");
        assertThrows(IllegalStateException.class, () -> new Simulation(r));
    }

    @Test
    void runThenContinue() throws IOException {
        Simulation sim = open(fixture("toggle.txt"));
        Simulation.RunOutcome first = sim.run(4);
        assertTrue(first.succeeded());
        assertEquals(4, first.completed());
        sim.continueRun(4);
        assertEquals(8, sim.cyclesCompleted());
        assertEquals("01100110", bits(sim, "D1.Q"));
    }

    @Test
    void runStartsOverEveryTime() throws IOException {
        Simulation sim = open(fixture("toggle.txt"));
        sim.run(5);
        String q = bits(sim, "D1.Q");
        String qbar = bits(sim, "D1.QBAR");
        sim.continueRun(3);
        sim.run(5);
        assertEquals(5, sim.cyclesCompleted());
        assertEquals(q, bits(sim, "D1.Q"));
        assertEquals(qbar, bits(sim, "D1.QBAR"));
    }

    @Test
    void fullAdderFollowsSwitches() throws IOException {
        Simulation sim = open(fixture("full_adder.txt"));
        sim.run(1);
        sim.setSwitch("B", false);
        sim.continueRun(1);
        sim.setSwitch("CIN", true);
        sim.continueRun(1);
        sim.setSwitch("A", false);
        sim.setSwitch("B", false);
        sim.continueRun(1);
        // 1+1+0, 1+0+0, 1+0+1, 0+0+1
        assertEquals("0101", bits(sim, "X2"));
        assertEquals("1010", bits(sim, "G3"));
    }

    @Test
    void switchesKeepTheirLevelAcrossReset() {
        Simulation sim = open("DEVICES S:SWITCH 0, N:NOT; CONNECT S > N; MONITOR N; END");
        sim.setSwitch("S", true);
        sim.run(2);
        assertEquals("00", bits(sim, "N"));
    }

    @Test
    void setSwitchRejectsOtherDevices() {
        Simulation sim = open("DEVICES S:SWITCH 0, N:NOT; CONNECT S > N; END");
        assertThrows(IllegalArgumentException.class, () -> sim.setSwitch("N", true));
        assertThrows(IllegalArgumentException.class, () -> sim.setSwitch("Q", true));
    }

    @Test
    void oscillationStopsTheRunAndKeepsEarlierTraces() {
        Simulation sim = open("""
                DEVICES S:SWITCH 0, G:NAND 2;
                CONNECT S > G.I1, G > G.I2;
                MONITOR G;
                END
                """);
        assertTrue(sim.run(3).succeeded());
        sim.setSwitch("S", true);
        Simulation.RunOutcome out = sim.continueRun(5);
        assertFalse(out.succeeded());
        assertEquals(0, out.completed());
        assertEquals(5, out.requested());
        assertEquals(4, out.failure().cycle());
        assertEquals(ErrorType.NO_CONVERGENCE, out.failure().error());
        assertEquals(3, sim.cyclesCompleted());
        assertEquals("111", bits(sim, "G"));
    }

    @Test
    void monitorAddedBetweenRuns() throws Exception {
        Simulation sim = open("DEVICES C:CLOCK 1, W:SIGGEN 01; MONITOR C; END");
        sim.run(2);
        MonitorPoint w = MonitorPoint.of(PinRef.of(sim.network().symbols().lookup("W")));
        sim.monitors().add(w);
        sim.continueRun(2);
        assertEquals(2, sim.monitors().startCycle(w));
        assertEquals("01", bits(sim, "W"));

        // un run nuevo reinicia todas las trazas desde el ciclo 0
        sim.run(2);
        assertEquals(0, sim.monitors().startCycle(w));
        assertEquals(List.of("C", "W"), sim.monitors().signalNames().monitored());
    }

    @Test
    void negativeCycleCount() {
        Simulation sim = open("DEVICES S:SWITCH 0; END");
        assertThrows(IllegalArgumentException.class, () -> sim.run(-1));
        assertTrue(sim.run(0).succeeded());
    }
}
