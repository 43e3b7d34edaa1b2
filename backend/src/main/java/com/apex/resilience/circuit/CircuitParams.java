package com.apex.resilience.circuit;

/**
 * Trip and recovery thresholds for one breaker. Out-of-range values are clamped to the nearest
 * valid value instead of being rejected.
 *
 * @param maxErrRate    error fraction above which an OPEN breaker trips, in [0, 1]
 * @param windowSec     trailing window used for the error rate, at least 1
 * @param minClosedSec  minimum time spent TRIPPED before probing starts, at least 0
 * @param halfOpenProbe consecutive successes needed in HALF_OPEN to return to OPEN, at least 1
 */
public record CircuitParams(double maxErrRate, int windowSec, int minClosedSec, int halfOpenProbe) {

    public static final double DEFAULT_MAX_ERR_RATE = 0.15;
    public static final int DEFAULT_WINDOW_SEC = 300;
    public static final int DEFAULT_MIN_CLOSED_SEC = 180;
    public static final int DEFAULT_HALF_OPEN_PROBE = 5;

    public CircuitParams {
        if (Double.isNaN(maxErrRate)) {
            maxErrRate = DEFAULT_MAX_ERR_RATE;
        }
        maxErrRate = Math.min(1.0, Math.max(0.0, maxErrRate));
        windowSec = Math.max(1, windowSec);
        minClosedSec = Math.max(0, minClosedSec);
        halfOpenProbe = Math.max(1, halfOpenProbe);
    }

    public static CircuitParams defaults() {
        return new CircuitParams(DEFAULT_MAX_ERR_RATE, DEFAULT_WINDOW_SEC, DEFAULT_MIN_CLOSED_SEC, DEFAULT_HALF_OPEN_PROBE);
    }
}
