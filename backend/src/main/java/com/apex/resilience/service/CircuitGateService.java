package com.apex.resilience.service;

import com.apex.resilience.circuit.CircuitBreaker;
import com.apex.resilience.circuit.CircuitBreakerOptions;
import com.apex.resilience.circuit.CircuitParams;
import com.apex.resilience.circuit.CircuitSnapshot;
import com.apex.resilience.circuit.CircuitState;
import com.apex.resilience.circuit.FailureClassifier;
import com.apex.resilience.config.ResilienceProperties;
import com.apex.resilience.metrics.MicrometerCircuitMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One breaker per guarded resource, created on first use from {@code apex.resilience.circuit}
 * with any per-resource override applied. The map is the source of truth: later calls with the
 * same name return the same breaker.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CircuitGateService {

    private final ResilienceProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock resilienceClock;

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreaker forResource(String resource) {
        return breakers.computeIfAbsent(resource, this::create);
    }

    public Optional<CircuitBreaker> find(String resource) {
        return Optional.ofNullable(breakers.get(resource));
    }

    public boolean allowRequest(String resource) {
        return forResource(resource).allowsTraffic();
    }

    public CircuitState recordOutcome(String resource, boolean isError) {
        return forResource(resource).record(isError);
    }

    /**
     * Records a failed call. Only failures that indicate an unhealthy dependency count as errors;
     * anything else means the dependency answered and is recorded as a success.
     */
    public CircuitState recordOutcome(String resource, Throwable error) {
        boolean circuitFailure = FailureClassifier.isCircuitFailure(error);
        if (circuitFailure) {
            log.debug("Circuit failure resource={} code={}", resource, FailureClassifier.errorCode(error));
        }
        return forResource(resource).record(circuitFailure);
    }

    public Map<String, CircuitSnapshot> snapshots() {
        Map<String, CircuitSnapshot> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, breaker.snapshot()));
        return result;
    }

    private CircuitBreaker create(String resource) {
        ResilienceProperties.Circuit cfg = properties.getCircuit();
        CircuitParams params = paramsFor(resource, cfg);
        CircuitBreakerOptions options = CircuitBreakerOptions.builder()
                .clock(resilienceClock)
                .threadSafe(cfg.isThreadSafe())
                .eventsMaxlen(cfg.getEventsMaxlen())
                .eventsPerSecHint(cfg.getEventsPerSecHint())
                .maxLogLinesPerSec(cfg.getMaxLogLinesPerSec())
                .metricsCallback(new MicrometerCircuitMetrics(meterRegistry, resource))
                .build();
        log.info("Circuit breaker created resource={} params={}", resource, params);
        return new CircuitBreaker(resource, params, options);
    }

    static CircuitParams paramsFor(String resource, ResilienceProperties.Circuit cfg) {
        ResilienceProperties.ResourceOverride override = cfg.getResources().get(resource);
        if (override == null) {
            return new CircuitParams(cfg.getMaxErrRate(), cfg.getWindowSec(), cfg.getMinClosedSec(), cfg.getHalfOpenProbe());
        }
        return new CircuitParams(
                override.getMaxErrRate() != null ? override.getMaxErrRate() : cfg.getMaxErrRate(),
                override.getWindowSec() != null ? override.getWindowSec() : cfg.getWindowSec(),
                override.getMinClosedSec() != null ? override.getMinClosedSec() : cfg.getMinClosedSec(),
                override.getHalfOpenProbe() != null ? override.getHalfOpenProbe() : cfg.getHalfOpenProbe());
    }
}
