package com.cburch.logsim.monitor;

import com.cburch.logsim.circuit.Propagator;
import com.cburch.logsim.comp.auxiliary.PinRef;
import com.cburch.logsim.data.Signal;
import com.cburch.logsim.file.DefinitionLoader;
import com.cburch.logsim.file.ParseResult;
import com.cburch.logsim.prefs.SimulatorPrefs;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraceJsonTest {

    @Test
    void bitsCollapseEdges() {
        assertEquals("0110", TraceJson.bits(List.of(Signal.LOW, Signal.RISING, Signal.HIGH, Signal.FALLING)));
        assertEquals("", TraceJson.bits(List.of()));
    }

    @Test
    void documentListsEverySignal() throws Exception {
        ParseResult r = new DefinitionLoader(SimulatorPrefs.defaults())
                .parse("DEVICES W:SIGGEN 0110, C:CLOCK 1; MONITOR W; END");
        assertTrue(r.isSimulatable(), r.report());
        Propagator p = new Propagator(r.network(), r.monitors(), 20);
        p.execute(2);
        r.monitors().add(MonitorPoint.of(PinRef.of(r.symbols().lookup("C"))));
        p.execute(2);

        JsonNode tree = new ObjectMapper().readTree(TraceJson.write(r.monitors()));
        assertEquals(4, tree.path("cycles").asInt());
        JsonNode signals = tree.path("signals");
        assertEquals(2, signals.size());
        assertEquals("W", signals.get(0).path("name").asText());
        assertEquals("0110", signals.get(0).path("trace").asText());
        assertEquals(0, signals.get(0).path("start").asInt());
        assertEquals("C", signals.get(1).path("name").asText());
        assertEquals(2, signals.get(1).path("start").asInt());
        assertEquals("10", signals.get(1).path("trace").asText());
    }
}
