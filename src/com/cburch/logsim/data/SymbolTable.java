package com.cburch.logsim.data;

import java.util.*;

/**
 * Append-only mapping between identifier text and {@link Name} handles.
 * Handles are dense integers assigned in interning order.
 */
public final class SymbolTable {
    private final Map<String, Name> byText = new HashMap<>();
    private final List<Name> byId = new ArrayList<>();

    /** Returns the handle for {@code text}, interning it on first use. */
    public Name lookup(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) throw new IllegalArgumentException("Name text cannot be empty");
        Name n = byText.get(text);
        if (n == null) {
            n = new Name(byId.size(), text);
            byText.put(text, n);
            byId.add(n);
        }
        return n;
    }

    /** Same as {@link #lookup} but never interns. */
    public Optional<Name> query(String text) {
        return Optional.ofNullable(text == null ? null : byText.get(text));
    }

    public Optional<Name> byId(int id) {
        if (id < 0 || id >= byId.size()) return Optional.empty();
        return Optional.of(byId.get(id));
    }

    public String text(Name name) {
        return name == null ? null : byId.get(name.id()).text();
    }

    public int size() { return byId.size(); }
}
