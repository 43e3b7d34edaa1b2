package com.apex.resilience.circuit;

import java.util.Locale;

/**
 * Discrete breaker states. The integer code is what dashboards and alerts read from the
 * state gauge, so existing codes must never be renumbered.
 */
public enum CircuitState {

    OPEN(0),
    TRIPPED(1),
    HALF_OPEN(2);

    private final int code;

    CircuitState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean allowsTraffic() {
        return this != TRIPPED;
    }

    /**
     * Resolves a state by name, ignoring case and surrounding whitespace. Unknown or null names
     * resolve to {@link #OPEN}.
     */
    public static CircuitState fromName(String name) {
        if (name == null) {
            return OPEN;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (CircuitState state : values()) {
            if (state.name().equals(normalized)) {
                return state;
            }
        }
        return OPEN;
    }

    public static CircuitState fromCode(int code) {
        for (CircuitState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        return OPEN;
    }
}
