package com.apex.resilience.metrics;

import com.apex.resilience.circuit.MetricsCallback;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exports one breaker's {@link MetricsCallback} events to Micrometer, tagged by resource.
 */
@Slf4j
public class MicrometerCircuitMetrics implements MetricsCallback {

    private final MeterRegistry meterRegistry;
    private final String resource;
    private final AtomicLong state = new AtomicLong();
    private final AtomicReference<Double> errRate = new AtomicReference<>(0.0);
    private final AtomicLong perSecEvents = new AtomicLong();
    private final Counter floodCoalesced;

    public MicrometerCircuitMetrics(MeterRegistry meterRegistry, String resource) {
        this.meterRegistry = meterRegistry;
        this.resource = resource;
        Gauge.builder("circuit_state", state, AtomicLong::get)
                .description("Circuit state (0=OPEN,1=TRIPPED,2=HALF_OPEN)")
                .tag("resource", resource)
                .strongReference(true)
                .register(meterRegistry);
        Gauge.builder("circuit_err_rate_window", errRate, value -> value.get())
                .tag("resource", resource)
                .strongReference(true)
                .register(meterRegistry);
        Gauge.builder("circuit_per_sec_event_rate", perSecEvents, AtomicLong::get)
                .tag("resource", resource)
                .strongReference(true)
                .register(meterRegistry);
        floodCoalesced = Counter.builder("circuit_flood_coalesced_total")
                .tag("resource", resource)
                .register(meterRegistry);
    }

    @Override
    public void emit(String name, Map<String, Object> fields) {
        switch (name) {
            case CIRCUIT_STATE -> state.set(asNumber(fields.get("value")).longValue());
            case ERR_RATE_WINDOW -> errRate.set(asNumber(fields.get("value")).doubleValue());
            case PER_SEC_EVENT_RATE -> perSecEvents.set(asNumber(fields.get("value")).longValue());
            case FLOOD_COALESCED_TOTAL -> floodCoalesced.increment(asNumber(fields.get("add")).doubleValue());
            case TRANSITIONS_TOTAL -> Counter.builder("circuit_transitions_total")
                    .tag("resource", resource)
                    .tag("from", String.valueOf(fields.get("from")))
                    .tag("to", String.valueOf(fields.get("to")))
                    .register(meterRegistry)
                    .increment();
            default -> log.debug("Ignoring circuit metric name={} resource={}", name, resource);
        }
    }

    private static Number asNumber(Object value) {
        return value instanceof Number number ? number : 0;
    }
}
