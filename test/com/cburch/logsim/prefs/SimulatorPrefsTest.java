package com.cburch.logsim.prefs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SimulatorPrefsTest {

    @Test
    void bundledResourceMatchesDefaults() {
        assertEquals(SimulatorPrefs.defaults(), SimulatorPrefs.load());
    }

    @Test
    void jsonOverridesSomeKeys() throws IOException {
        SimulatorPrefs p = SimulatorPrefs.fromJson("{\"maxPasses\": 50, \"monitorCapacity\": 4}");
        assertEquals(50, p.maxPasses());
        assertEquals(4, p.monitorCapacity());
        assertEquals(SimulatorPrefs.DEFAULT_MAX_GATE_INPUTS, p.maxGateInputs());
    }

    @Test
    void nonPositiveAndNonNumericValuesKeepDefaults() throws IOException {
        SimulatorPrefs p = SimulatorPrefs.fromJson("{\"maxPasses\": 0, \"monitorCapacity\": \"lots\", \"maxGateInputs\": -3}");
        assertEquals(SimulatorPrefs.defaults(), p);
    }

    @Test
    void nonObjectDocumentGivesDefaults() throws IOException {
        assertEquals(SimulatorPrefs.defaults(), SimulatorPrefs.fromJson("[1, 2]"));
    }

    @Test
    void malformedJsonIsAnError() {
        assertThrows(IOException.class, () -> SimulatorPrefs.fromJson("{maxPasses"));
    }

    @Test
    void userFileOverlaysBundledPrefs(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("prefs.json");
        Files.writeString(file, "{\"maxGateInputs\": 8}");
        SimulatorPrefs p = SimulatorPrefs.load(file);
        assertEquals(8, p.maxGateInputs());
        assertEquals(SimulatorPrefs.DEFAULT_MAX_PASSES, p.maxPasses());
    }

    @Test
    void missingUserFileFallsBack(@TempDir Path dir) throws IOException {
        assertEquals(SimulatorPrefs.load(), SimulatorPrefs.load(dir.resolve("absent.json")));
    }

    @Test
    void constructorRejectsNonPositive() {
        assertThrows(IllegalArgumentException.class, () -> new SimulatorPrefs(0, 16, 16));
        assertThrows(IllegalArgumentException.class, () -> new SimulatorPrefs(20, 0, 16));
        assertThrows(IllegalArgumentException.class, () -> new SimulatorPrefs(20, 16, -1));
    }
}
