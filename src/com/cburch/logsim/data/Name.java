package com.cburch.logsim.data;

/**
 * Interned identifier. Two names are equal iff they share the same handle,
 * so only {@link SymbolTable} may create them.
 */
public final class Name {
    private final int id;
    private final String text;

    Name(int id, String text) {
        this.id = id;
        this.text = text;
    }

    public int id() { return id; }
    public String text() { return text; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Name that)) return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return text;
    }
}
