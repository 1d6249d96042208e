package com.cburch.logsim.monitor;

import com.cburch.logsim.data.Signal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * JSON view of the recorded traces, for the shell to save or hand on:
 * <pre>
 * { "cycles": 4,
 *   "signals": [ { "name": "N1", "start": 0, "trace": "0110" } ] }
 * </pre>
 */
public final class TraceJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TraceJson() { }

    public static JsonNode toTree(Monitors monitors) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("cycles", monitors.cyclesSampled());
        ArrayNode signals = root.putArray("signals");
        for (MonitorPoint p : monitors.points()) {
            ObjectNode s = signals.addObject();
            s.put("name", p.signalName());
            s.put("start", monitors.startCycle(p));
            s.put("trace", bits(monitors.traceOf(p)));
        }
        return root;
    }

    public static String write(Monitors monitors) {
        try {
            return MAPPER.writeValueAsString(toTree(monitors));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise traces", e);
        }
    }

    static String bits(List<Signal> trace) {
        StringBuilder sb = new StringBuilder(trace.size());
        for (Signal s : trace) sb.append(s.toBit());
        return sb.toString();
    }
}
