package com.cburch.logsim.comp.auxiliary;

import com.cburch.logsim.data.Name;
import com.cburch.logsim.data.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Well-known pin names, interned once per symbol table.
 */
public final class PinNames {
    public static final String DATA_TEXT  = "DATA";
    public static final String CLK_TEXT   = "CLK";
    public static final String SET_TEXT   = "SET";
    public static final String CLEAR_TEXT = "CLEAR";
    public static final String Q_TEXT     = "Q";
    public static final String QBAR_TEXT  = "QBAR";
    public static final String GATE_INPUT_PREFIX = "I";

    private final SymbolTable symbols;
    private final Name data, clk, set, clear, q, qbar;

    public PinNames(SymbolTable symbols) {
        this.symbols = symbols;
        this.data  = symbols.lookup(DATA_TEXT);
        this.clk   = symbols.lookup(CLK_TEXT);
        this.set   = symbols.lookup(SET_TEXT);
        this.clear = symbols.lookup(CLEAR_TEXT);
        this.q     = symbols.lookup(Q_TEXT);
        this.qbar  = symbols.lookup(QBAR_TEXT);
    }

    public Name data()  { return data; }
    public Name clk()   { return clk; }
    public Name set()   { return set; }
    public Name clear() { return clear; }
    public Name q()     { return q; }
    public Name qbar()  { return qbar; }

    /** {@code I1}..{@code In}, 1-based. */
    public Name gateInput(int index) {
        if (index < 1) throw new IllegalArgumentException("Gate inputs are numbered from 1: " + index);
        return symbols.lookup(GATE_INPUT_PREFIX + index);
    }

    public List<Name> gateInputs(int count) {
        List<Name> out = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) out.add(gateInput(i));
        return out;
    }
}
