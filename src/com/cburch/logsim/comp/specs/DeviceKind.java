package com.cburch.logsim.comp.specs;

public enum DeviceKind {
    // Fuentes (sin entradas)
    SWITCH ("SWITCH", Category.SOURCE,     Qualifier.BIT),
    CLOCK  ("CLOCK",  Category.SOURCE,     Qualifier.HALF_PERIOD),
    SIGGEN ("SIGGEN", Category.SOURCE,     Qualifier.WAVEFORM),

    // Combinacionales
    AND    ("AND",    Category.GATE,       Qualifier.ARITY),
    OR     ("OR",     Category.GATE,       Qualifier.ARITY),
    NAND   ("NAND",   Category.GATE,       Qualifier.ARITY),
    NOR    ("NOR",    Category.GATE,       Qualifier.ARITY),
    XOR    ("XOR",    Category.GATE,       Qualifier.NONE),
    NOT    ("NOT",    Category.GATE,       Qualifier.NONE),

    // Secuenciales
    DTYPE  ("DTYPE",  Category.SEQUENTIAL, Qualifier.NONE);

    public enum Category { SOURCE, GATE, SEQUENTIAL }

    /** What may follow the kind keyword in a declaration. */
    public enum Qualifier { NONE, ARITY, BIT, HALF_PERIOD, WAVEFORM }

    private final String keyword;
    private final Category category;
    private final Qualifier qualifier;

    DeviceKind(String keyword, Category category, Qualifier qualifier) {
        this.keyword = keyword;
        this.category = category;
        this.qualifier = qualifier;
    }

    public String keyword() { return keyword; }
    public Category category() { return category; }
    public Qualifier qualifier() { return qualifier; }

    public boolean isSource()     { return category == Category.SOURCE; }
    public boolean isGate()       { return category == Category.GATE; }

    /** Fixed input count, or -1 when the declaration chooses it. */
    public int fixedInputs() {
        return switch (this) {
            case SWITCH, CLOCK, SIGGEN -> 0;
            case XOR -> 2;
            case NOT -> 1;
            case DTYPE -> 4;
            case AND, OR, NAND, NOR -> -1;
        };
    }
}
