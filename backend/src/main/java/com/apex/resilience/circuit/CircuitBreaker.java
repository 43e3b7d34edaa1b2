package com.apex.resilience.circuit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Error-rate circuit breaker over a trailing window of per-second bins.
 *
 * <pre>
 * OPEN      --[error rate &gt; maxErrRate]--------------&gt; TRIPPED
 * TRIPPED   --[minClosedSec elapsed, on next record]--&gt; HALF_OPEN
 * HALF_OPEN --[any error]-----------------------------&gt; TRIPPED
 * HALF_OPEN --[halfOpenProbe successes]---------------&gt; OPEN
 * </pre>
 *
 * There is no timer: every transition happens inside {@link #record(boolean)}, so a breaker that
 * receives no outcomes stays TRIPPED. Metrics and log sinks are best effort and never surface
 * their failures to the caller.
 */
@Slf4j
public class CircuitBreaker {

    static final int MAX_BINS = 10_000;

    private static final String LOG_FORMAT =
            "event=circuit_transition state_from=%s state_to=%s err_rate=%.6f window_len=%d now=%d reason=%s";

    private final String name;
    private final CircuitParams params;
    private final Clock clock;
    private final CriticalSection guard;
    private final int capacity;
    private final Deque<EventBin> bins;
    private final TransitionLogLimiter logLimiter;
    private final CircuitMetrics metrics;
    private final MetricsCallback metricsCallback;
    private final Consumer<String> logSink;

    private CircuitState state = CircuitState.OPEN;
    private double trippedAt;
    private int halfOpenRemaining;
    private double lastTransitionTs;
    private long floodCoalesced;

    public CircuitBreaker(CircuitParams params) {
        this("default", params, CircuitBreakerOptions.defaults());
    }

    public CircuitBreaker(String name, CircuitParams params, CircuitBreakerOptions options) {
        this.name = Objects.requireNonNull(name, "name");
        this.params = Objects.requireNonNull(params, "params");
        Objects.requireNonNull(options, "options");
        this.clock = Objects.requireNonNull(options.getClock(), "clock");
        this.guard = options.isThreadSafe() ? CriticalSection.locking() : CriticalSection.none();
        this.capacity = binCapacity(params, options.getEventsMaxlen(), options.getEventsPerSecHint());
        this.bins = new ArrayDeque<>(Math.min(capacity, 1024));
        this.logLimiter = new TransitionLogLimiter(options.getMaxLogLinesPerSec());
        this.metrics = options.getMetrics();
        this.metricsCallback = options.getMetricsCallback();
        this.logSink = options.getLogSink() != null ? options.getLogSink() : line -> log.info(line);
        applyMetrics(now());
    }

    static int binCapacity(CircuitParams params, Integer eventsMaxlen, int eventsPerSecHint) {
        if (eventsMaxlen != null) {
            return Math.max(1, eventsMaxlen);
        }
        long hint = Math.max(1, eventsPerSecHint);
        long derived = (long) params.windowSec() * hint;
        return (int) Math.min(MAX_BINS, Math.max(1, derived));
    }

    public String getName() {
        return name;
    }

    public CircuitParams getParams() {
        return params;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Folds one outcome into the current second, re-evaluates the transition table and returns the
     * resulting state.
     */
    public CircuitState record(boolean isError) {
        return guard.call(() -> recordLocked(isError));
    }

    public CircuitState recordSuccess() {
        return record(false);
    }

    public CircuitState recordFailure() {
        return record(true);
    }

    public CircuitState state() {
        return guard.call(() -> state);
    }

    public String stateName() {
        return state().name();
    }

    public boolean allowsTraffic() {
        return state().allowsTraffic();
    }

    public long floodCoalesced() {
        return guard.call(() -> floodCoalesced);
    }

    public CircuitSnapshot snapshot() {
        return guard.call(() -> {
            double rate = errorRate(epochSecond(now()));
            return new CircuitSnapshot(state, rate, bins.size(), (long) lastTransitionTs);
        });
    }

    private CircuitState recordLocked(boolean isError) {
        double now = now();
        long second = epochSecond(now);

        EventBin newest = bins.peekLast();
        // a clock that steps backwards folds into the newest bin to keep bins ordered
        if (newest != null && newest.epochSecond() >= second) {
            newest.add(isError);
            floodCoalesced++;
            emit(MetricsCallback.FLOOD_COALESCED_TOTAL, Map.of("add", 1));
        } else {
            if (bins.size() >= capacity) {
                bins.pollFirst();
            }
            EventBin bin = new EventBin(second);
            bin.add(isError);
            bins.addLast(bin);
        }
        prune(second);

        applyMetrics(now);
        EventBin current = bins.peekLast();
        if (current != null) {
            emit(MetricsCallback.PER_SEC_EVENT_RATE, Map.of("value", current.total()));
        }

        double rate = errorRate(second);
        switch (state) {
            case OPEN -> {
                if (rate > params.maxErrRate()) {
                    trippedAt = now;
                    halfOpenRemaining = 0;
                    transition(CircuitState.TRIPPED, "trip", rate, now);
                }
            }
            case TRIPPED -> {
                if (now - trippedAt >= params.minClosedSec()) {
                    halfOpenRemaining = params.halfOpenProbe();
                    transition(CircuitState.HALF_OPEN, "probe_start", rate, now);
                }
            }
            case HALF_OPEN -> {
                if (isError) {
                    trippedAt = now;
                    halfOpenRemaining = 0;
                    transition(CircuitState.TRIPPED, "probe_fail", rate, now);
                } else {
                    if (halfOpenRemaining > 0) {
                        halfOpenRemaining--;
                    }
                    if (halfOpenRemaining <= 0) {
                        transition(CircuitState.OPEN, "probe_success", rate, now);
                    }
                }
            }
        }
        return state;
    }

    private void prune(long nowSecond) {
        long cutoff = nowSecond - params.windowSec();
        while (!bins.isEmpty() && bins.peekFirst().epochSecond() < cutoff) {
            bins.pollFirst();
        }
    }

    private double errorRate(long nowSecond) {
        prune(nowSecond);
        long ok = 0;
        long err = 0;
        for (EventBin bin : bins) {
            ok += bin.okCount();
            err += bin.errCount();
        }
        long total = ok + err;
        return total <= 0 ? 0.0 : (double) err / total;
    }

    private void transition(CircuitState next, String reason, double errRate, double now) {
        if (next == state) {
            return;
        }
        CircuitState from = state;
        state = next;
        lastTransitionTs = now;
        emitTransition(from, next, errRate, now, reason);
        applyMetrics(now);
    }

    private void emitTransition(CircuitState from, CircuitState to, double errRate, double now, String reason) {
        long nowSecond = epochSecond(now);
        if (logLimiter.tryAcquire(nowSecond)) {
            String line = formatTransition(from, to, errRate, bins.size(), nowSecond, reason);
            try {
                logSink.accept(line);
            } catch (RuntimeException e) {
                log.debug("Transition log sink failed breaker={}", name, e);
            }
        }
        if (metrics != null) {
            try {
                metrics.incTransition(from, to);
            } catch (RuntimeException e) {
                log.debug("Transition metric failed breaker={}", name, e);
            }
        }
        emit(MetricsCallback.TRANSITIONS_TOTAL, Map.of("from", from.name(), "to", to.name()));
    }

    static String formatTransition(CircuitState from, CircuitState to, double errRate, int windowLen, long now, String reason) {
        return String.format(Locale.ROOT, LOG_FORMAT, from.name(), to.name(), errRate, windowLen, now, reason);
    }

    private void applyMetrics(double now) {
        double rate = errorRate(epochSecond(now));
        if (metrics != null) {
            try {
                metrics.setState(state.code());
            } catch (RuntimeException e) {
                log.debug("State gauge failed breaker={}", name, e);
            }
            try {
                metrics.setErrorRate(rate);
            } catch (RuntimeException e) {
                log.debug("Error rate gauge failed breaker={}", name, e);
            }
        }
        emit(MetricsCallback.CIRCUIT_STATE, Map.of("value", state.code()));
        emit(MetricsCallback.ERR_RATE_WINDOW, Map.of("value", rate));
    }

    private void emit(String metric, Map<String, Object> fields) {
        if (metricsCallback == null) {
            return;
        }
        try {
            metricsCallback.emit(metric, fields);
        } catch (RuntimeException e) {
            log.debug("Metrics callback failed breaker={} metric={}", name, metric, e);
        }
    }

    private double now() {
        return clock.millis() / 1000.0;
    }

    private static long epochSecond(double now) {
        return (long) Math.floor(now);
    }
}
