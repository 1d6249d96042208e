package com.cburch.logsim.prefs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine limits read from {@code resources/logsim/simulator.json}.
 * Missing or non-positive entries keep their defaults.
 */
public record SimulatorPrefs(int maxPasses, int monitorCapacity, int maxGateInputs) {
    private static final Logger LOGGER = LogManager.getLogger();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String RESOURCE = "/resources/logsim/simulator.json";

    public static final int DEFAULT_MAX_PASSES = 20;
    public static final int DEFAULT_MONITOR_CAPACITY = 16;
    public static final int DEFAULT_MAX_GATE_INPUTS = 16;

    public SimulatorPrefs {
        if (maxPasses < 1) throw new IllegalArgumentException("maxPasses must be >= 1: " + maxPasses);
        if (monitorCapacity < 1) throw new IllegalArgumentException("monitorCapacity must be >= 1: " + monitorCapacity);
        if (maxGateInputs < 1) throw new IllegalArgumentException("maxGateInputs must be >= 1: " + maxGateInputs);
    }

    public static SimulatorPrefs defaults() {
        return new SimulatorPrefs(DEFAULT_MAX_PASSES, DEFAULT_MONITOR_CAPACITY, DEFAULT_MAX_GATE_INPUTS);
    }

    /** Loads the bundled preferences; falls back to {@link #defaults()} if the resource is absent. */
    public static SimulatorPrefs load() {
        try (InputStream in = SimulatorPrefs.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                LOGGER.debug("No {} on the classpath, using defaults", RESOURCE);
                return defaults();
            }
            return from(MAPPER.readTree(in), defaults());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    /** Overlays a user JSON file on top of the bundled preferences. */
    public static SimulatorPrefs load(Path userFile) throws IOException {
        SimulatorPrefs base = load();
        if (userFile == null || !Files.isRegularFile(userFile)) return base;
        try (InputStream in = Files.newInputStream(userFile)) {
            return from(MAPPER.readTree(in), base);
        }
    }

    public static SimulatorPrefs fromJson(String json) throws IOException {
        return from(MAPPER.readTree(json), defaults());
    }

    /* ---------- parse helpers ---------- */

    private static SimulatorPrefs from(JsonNode root, SimulatorPrefs base) {
        if (root == null || !root.isObject()) return base;
        return new SimulatorPrefs(
                positive(root, "maxPasses", base.maxPasses()),
                positive(root, "monitorCapacity", base.monitorCapacity()),
                positive(root, "maxGateInputs", base.maxGateInputs()));
    }

    private static int positive(JsonNode root, String field, int def) {
        JsonNode n = root.path(field);
        if (!n.isIntegralNumber()) return def;
        int v = n.asInt(def);
        if (v < 1) {
            LOGGER.warn("Ignoring {}={} (must be >= 1), keeping {}", field, v, def);
            return def;
        }
        return v;
    }
}
