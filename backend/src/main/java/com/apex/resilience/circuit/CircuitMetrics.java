package com.apex.resilience.circuit;

/**
 * Per-metric sink for breaker gauges and the transition counter. Every method defaults to a
 * no-op so callers can implement only what they export.
 */
public interface CircuitMetrics {

    default void setState(int stateCode) {
    }

    default void setErrorRate(double errRate) {
    }

    default void incTransition(CircuitState from, CircuitState to) {
    }
}
