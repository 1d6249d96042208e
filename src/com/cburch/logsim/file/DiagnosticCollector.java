package com.cburch.logsim.file;

import java.util.*;

/**
 * Accumulates diagnostics in the order they are found.
 */
public final class DiagnosticCollector {
    private final List<Diagnostic> items = new ArrayList<>();
    private final Set<String> keys = new HashSet<>();

    /** Agrega un diagnóstico, evitando duplicados exactos en la misma posición. */
    public void add(Diagnostic d) {
        String key = d.type() + "|" + d.line() + "|" + d.column() + "|" + d.message();
        if (!keys.add(key)) return;
        items.add(d);
    }

    public void error(ErrorType type, Token at, Object... args) {
        add(Diagnostic.error(type, at, args));
    }

    public boolean hasErrors() {
        return !items.isEmpty();
    }

    public int errorCount() {
        return items.size();
    }

    public List<Diagnostic> all() {
        return List.copyOf(items);
    }

    public String summary() {
        int n = errorCount();
        if (n == 0) return Strings.get("diag.summary.none");
        if (n == 1) return Strings.get("diag.summary.one");
        return Strings.get("diag.summary.many", n);
    }

    /**
     * Every diagnostic with its source line and a caret under the column,
     * followed by the summary.
     */
    public String details(SourceText source) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : items) {
            sb.append(d.message()).append('\n');
            sb.append(Strings.get("diag.line", d.line())).append('\n');
            sb.append(source.pointAt(d.line(), d.column())).append("\n\n");
        }
        sb.append(summary());
        return sb.toString();
    }
}
