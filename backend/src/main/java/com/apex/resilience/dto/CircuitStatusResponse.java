package com.apex.resilience.dto;

import com.apex.resilience.circuit.CircuitSnapshot;

public record CircuitStatusResponse(
        String resource,
        String state,
        int stateCode,
        boolean allowsTraffic,
        double errRate,
        int windowLen,
        long lastTransitionTs
) {
    public static CircuitStatusResponse of(String resource, CircuitSnapshot snapshot) {
        return new CircuitStatusResponse(
                resource,
                snapshot.state().name(),
                snapshot.state().code(),
                snapshot.state().allowsTraffic(),
                snapshot.errRate(),
                snapshot.windowLen(),
                snapshot.lastTransitionTs()
        );
    }
}
