package com.apex.resilience.circuit;

import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.util.function.Consumer;

/**
 * Construction-time collaborators and knobs for a {@link CircuitBreaker}.
 */
@Value
@Builder(toBuilder = true)
public class CircuitBreakerOptions {

    @Builder.Default
    Clock clock = Clock.systemUTC();

    @Builder.Default
    boolean threadSafe = false;

    /**
     * Explicit bin capacity. When null the capacity is derived from the window and
     * {@link #eventsPerSecHint}.
     */
    Integer eventsMaxlen;

    @Builder.Default
    int eventsPerSecHint = 1;

    @Builder.Default
    int maxLogLinesPerSec = 10;

    CircuitMetrics metrics;

    MetricsCallback metricsCallback;

    /**
     * Receives formatted transition lines. When null, lines go to the breaker's SLF4J logger.
     */
    Consumer<String> logSink;

    public static CircuitBreakerOptions defaults() {
        return CircuitBreakerOptions.builder().build();
    }
}
