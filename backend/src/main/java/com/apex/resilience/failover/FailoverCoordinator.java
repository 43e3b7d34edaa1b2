package com.apex.resilience.failover;

import com.apex.resilience.lease.LeaseLock;
import com.apex.resilience.lease.LeaseMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Drives one {@link LeaseLock} per external tick: followers try to acquire, the leader renews.
 * A failed renewal is not an error here; the authoritative check that ends every tick reports
 * what the store says.
 */
@Slf4j
public class FailoverCoordinator {

    private final LeaseLock lock;
    private final LeaseMetrics metrics;

    private volatile FailoverRole lastRole = FailoverRole.FOLLOWER;
    private volatile long lastTickMs = -1;

    public FailoverCoordinator(LeaseLock lock) {
        this(lock, LeaseMetrics.NOOP);
    }

    public FailoverCoordinator(LeaseLock lock, LeaseMetrics metrics) {
        this.lock = Objects.requireNonNull(lock, "lock");
        this.metrics = metrics != null ? metrics : LeaseMetrics.NOOP;
    }

    public FailoverRole tick(long nowMs) {
        if (!lock.isLeader()) {
            lock.tryAcquire(nowMs);
        } else {
            lock.renew(nowMs);
        }
        FailoverRole role = FailoverRole.of(lock.isLeader());
        if (role != lastRole) {
            log.info("event=failover_role key={} holder={} role_from={} role_to={} now={}",
                    lock.getKey(), lock.getHolderId(), lastRole.label(), role.label(), nowMs);
        }
        lastRole = role;
        lastTickMs = nowMs;
        publish(role);
        return role;
    }

    public FailoverRole lastRole() {
        return lastRole;
    }

    public long lastTickMs() {
        return lastTickMs;
    }

    public LeaseLock lock() {
        return lock;
    }

    private void publish(FailoverRole role) {
        try {
            metrics.setLeaderState(lock.getEnv(), lock.getService(), lock.getHolderId(), role == FailoverRole.LEADER);
        } catch (RuntimeException e) {
            log.debug("Leader state gauge failed key={}", lock.getKey(), e);
        }
    }
}
