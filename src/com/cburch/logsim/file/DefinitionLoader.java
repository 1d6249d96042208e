package com.cburch.logsim.file;

import com.cburch.logsim.circuit.Network;
import com.cburch.logsim.comp.DeviceFactoryRegistry;
import com.cburch.logsim.data.SymbolTable;
import com.cburch.logsim.monitor.Monitors;
import com.cburch.logsim.prefs.SimulatorPrefs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Entry point of the front end: turns definition text into a
 * {@link ParseResult}. Each call works on fresh tables, so results never
 * share names or devices.
 */
public final class DefinitionLoader {
    private static final Logger LOGGER = LogManager.getLogger();

    private final SimulatorPrefs prefs;
    private final Consumer<DeviceFactoryRegistry> customizer;

    public DefinitionLoader() {
        this(SimulatorPrefs.load());
    }

    public DefinitionLoader(SimulatorPrefs prefs) {
        this(prefs, r -> { });
    }

    /**
     * @param customizer runs on each new registry before parsing, e.g. to
     *                   {@link DeviceFactoryRegistry#register override} a factory
     */
    public DefinitionLoader(SimulatorPrefs prefs, Consumer<DeviceFactoryRegistry> customizer) {
        this.prefs = Objects.requireNonNull(prefs);
        this.customizer = Objects.requireNonNull(customizer);
    }

    public SimulatorPrefs prefs() {
        return prefs;
    }

    public ParseResult parse(String source) {
        Objects.requireNonNull(source, "source");
        SymbolTable symbols = new SymbolTable();
        Scanner scanner = new Scanner(source, symbols);
        Network network = new Network(symbols);
        Monitors monitors = new Monitors(network, prefs.monitorCapacity());
        DeviceFactoryRegistry registry = new DeviceFactoryRegistry(symbols, prefs);
        customizer.accept(registry);

        DiagnosticCollector diagnostics = new DiagnosticCollector();
        new Parser(scanner, network, monitors, registry, diagnostics).parse();

        if (diagnostics.hasErrors()) {
            LOGGER.warn("Definition rejected: {}", diagnostics.summary());
        }
        return new ParseResult(symbols, network, monitors, diagnostics.all(), scanner.sourceText(), prefs);
    }

    public ParseResult parse(Path file) throws IOException {
        LOGGER.info("Loading definition {}", file);
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }
}
