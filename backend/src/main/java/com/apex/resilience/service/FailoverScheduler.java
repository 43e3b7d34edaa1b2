package com.apex.resilience.service;

import com.apex.resilience.failover.FailoverCoordinator;
import com.apex.resilience.lease.LeaseStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Drives the failover coordinator on Spring's scheduling thread. Tick time comes from the lease
 * store so renew pacing runs on the same clock as the lease expiry.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "apex.resilience.failover.scheduler-enabled", havingValue = "true")
public class FailoverScheduler {

    private final FailoverCoordinator failoverCoordinator;
    private final LeaseStore leaseStore;
    private final Clock resilienceClock;

    @Scheduled(fixedDelayString = "${apex.resilience.failover.tick-interval-ms:500}")
    public void runTick() {
        try {
            failoverCoordinator.tick(currentTimeMillis());
        } catch (RuntimeException e) {
            log.error("Failover tick failed", e);
        }
    }

    @PreDestroy
    public void releaseOnShutdown() {
        failoverCoordinator.lock().release();
    }

    long currentTimeMillis() {
        try {
            return leaseStore.currentTimeMillis();
        } catch (RuntimeException e) {
            log.warn("event=lease_store_error op=time error={} fallback=local_clock", e.getMessage());
            return resilienceClock.millis();
        }
    }
}
