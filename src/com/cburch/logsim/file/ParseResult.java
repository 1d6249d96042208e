package com.cburch.logsim.file;

import com.cburch.logsim.circuit.Network;
import com.cburch.logsim.data.SymbolTable;
import com.cburch.logsim.monitor.Monitors;
import com.cburch.logsim.prefs.SimulatorPrefs;

import java.util.List;

/**
 * Everything produced by reading one definition. The network and monitors
 * hold whatever was accepted even when there are errors; only a result with
 * no errors may be simulated.
 */
public record ParseResult(SymbolTable symbols,
                          Network network,
                          Monitors monitors,
                          List<Diagnostic> diagnostics,
                          SourceText source,
                          SimulatorPrefs prefs) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSimulatable() {
        return errorCount() == 0 && network.isComplete();
    }

    public int errorCount() {
        return diagnostics.size();
    }

    /** Errores de una categoría concreta (útil en pruebas). */
    public List<Diagnostic> diagnosticsOf(ErrorType.Category category) {
        return diagnostics.stream().filter(d -> d.type().category() == category).toList();
    }

    /** Diagnostics with source excerpts and carets, then a summary line. */
    public String report() {
        DiagnosticCollector c = new DiagnosticCollector();
        diagnostics.forEach(c::add);
        return c.details(source);
    }
}
