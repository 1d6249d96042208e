package com.cburch.logsim.data;

/**
 * Two-state logic value plus the transitional markers produced by clocks.
 * RISING and FALLING only matter to edge-sensitive consumers; every other
 * consumer sees them as HIGH and LOW.
 */
public enum Signal {
    LOW,
    HIGH,
    RISING,
    FALLING;

    public boolean isHigh() {
        return this == HIGH || this == RISING;
    }

    public boolean isEdge() {
        return this == RISING || this == FALLING;
    }

    /** Collapses transitional markers to their settled level. */
    public Signal steady() {
        return of(isHigh());
    }

    public Signal invert() {
        return of(!isHigh());
    }

    public static Signal of(boolean high) {
        return high ? HIGH : LOW;
    }

    /** Marker for a level that was {@code wasHigh} last cycle and is {@code high} now. */
    public static Signal edge(boolean wasHigh, boolean high) {
        if (wasHigh == high) return of(high);
        return high ? RISING : FALLING;
    }

    /** @return '1' o '0' según el nivel, para volcados compactos */
    public char toBit() {
        return isHigh() ? '1' : '0';
    }
}
