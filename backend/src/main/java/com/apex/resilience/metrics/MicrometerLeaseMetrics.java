package com.apex.resilience.metrics;

import com.apex.resilience.lease.LeaseMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@RequiredArgsConstructor
public class MicrometerLeaseMetrics implements LeaseMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<String, AtomicInteger> leaderStates = new ConcurrentHashMap<>();

    @Override
    public void setLeaderState(String env, String service, String instance, boolean leader) {
        String id = env + "|" + service + "|" + instance;
        AtomicInteger value = leaderStates.computeIfAbsent(id, ignored -> {
            AtomicInteger holder = new AtomicInteger();
            Gauge.builder("leader_state", holder, AtomicInteger::get)
                    .description("Leader state (1=leader,0=follower)")
                    .tag("env", env)
                    .tag("service", service)
                    .tag("instance", instance)
                    .register(meterRegistry);
            return holder;
        });
        value.set(leader ? 1 : 0);
    }

    @Override
    public void incLeaderElections(String env, String service) {
        Counter.builder("leader_elections_total")
                .tag("env", env)
                .tag("service", service)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incRenewFailures(String env, String service) {
        Counter.builder("leader_renew_fail_total")
                .tag("env", env)
                .tag("service", service)
                .register(meterRegistry)
                .increment();
    }
}
