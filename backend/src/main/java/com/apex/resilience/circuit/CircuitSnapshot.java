package com.apex.resilience.circuit;

public record CircuitSnapshot(
        CircuitState state,
        double errRate,
        int windowLen,
        long lastTransitionTs
) {}
