package com.cburch.logsim.file;

import com.cburch.logsim.comp.specs.DeviceKind;
import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.SymbolTable;

import java.util.*;

/**
 * Reserved words of the definition language, interned before any user name
 * so that their handles are the lowest ones.
 */
public final class Keywords {
    public static final String DEVICES = "DEVICES";
    public static final String CONNECT = "CONNECT";
    public static final String MONITOR = "MONITOR";
    public static final String END = "END";

    private final Name devices, connect, monitor, end;
    private final Set<Name> sections;
    private final Map<Name, DeviceKind> kinds = new HashMap<>();

    public Keywords(SymbolTable symbols) {
        this.devices = symbols.lookup(DEVICES);
        this.connect = symbols.lookup(CONNECT);
        this.monitor = symbols.lookup(MONITOR);
        this.end     = symbols.lookup(END);
        this.sections = Set.of(devices, connect, monitor, end);
        for (DeviceKind k : DeviceKind.values()) kinds.put(symbols.lookup(k.keyword()), k);
    }

    public Name devices() { return devices; }
    public Name connect() { return connect; }
    public Name monitor() { return monitor; }
    public Name end()     { return end; }

    public boolean isReserved(Name n) {
        return sections.contains(n) || kinds.containsKey(n);
    }

    public boolean isSection(Name n) {
        return n != null && sections.contains(n);
    }

    public Optional<DeviceKind> kindOf(Name n) {
        return Optional.ofNullable(n == null ? null : kinds.get(n));
    }
}
