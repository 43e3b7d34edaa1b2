package com.apex.resilience.lease;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Leadership claim on one key of a {@link LeaseStore}.
 *
 * The store is the only source of truth. The local flag returned by {@link #believesLeader()}
 * is advisory: a lease can expire without any call on this instance observing it, so callers
 * that need an answer use {@link #isLeader()}. Every store call is isolated; a failing store makes
 * this instance a follower, it never throws to the caller.
 *
 * Not thread-safe. One coordinator per process drives it.
 */
@Slf4j
public class LeaseLock {

    private final LeaseStore store;
    private final String key;
    private final String holderId;
    private final long ttlMs;
    private final long renewMs;
    private final String env;
    private final String service;
    private final LeaseMetrics metrics;

    private boolean leader;
    private long lastRenewMs;

    public LeaseLock(LeaseStore store, String key, String holderId) {
        this(store, key, holderId, LeaseLockOptions.defaults());
    }

    public LeaseLock(LeaseStore store, String key, String holderId, LeaseLockOptions options) {
        this.store = Objects.requireNonNull(store, "store");
        this.key = Objects.requireNonNull(key, "key");
        this.holderId = Objects.requireNonNull(holderId, "holderId");
        Objects.requireNonNull(options, "options");
        this.ttlMs = Math.max(1, options.getTtlMs());
        this.renewMs = Math.max(1, options.getRenewMs());
        this.env = options.getEnv();
        this.service = options.getService();
        this.metrics = options.getMetrics() != null ? options.getMetrics() : LeaseMetrics.NOOP;
    }

    public boolean tryAcquire(long nowMs) {
        boolean created;
        try {
            created = store.setIfAbsent(key, holderId, ttlMs);
        } catch (RuntimeException e) {
            log.warn("event=lease_store_error op=set_if_absent key={} holder={} error={}", key, holderId, e.getMessage());
            leader = false;
            return false;
        }
        if (created) {
            leader = true;
            lastRenewMs = nowMs;
            log.info("event=lease_acquire key={} holder={} ttl_ms={} now={}", key, holderId, ttlMs, nowMs);
            safeIncElections();
            return true;
        }
        // a stale re-entrant acquire still finds our own id in the store
        leader = holderId.equals(readHolder().orElse(null));
        return leader;
    }

    /**
     * Extends the lease by {@code renewMs} once at least {@code renewMs} has passed since the last
     * successful renewal. Calls inside that interval return true without touching the store.
     */
    public boolean renew(long nowMs) {
        if (!leader) {
            return false;
        }
        if (nowMs - lastRenewMs < renewMs) {
            return true;
        }
        boolean extended;
        try {
            extended = store.expire(key, renewMs);
        } catch (RuntimeException e) {
            log.warn("event=lease_store_error op=expire key={} holder={} error={}", key, holderId, e.getMessage());
            extended = false;
        }
        if (extended) {
            lastRenewMs = nowMs;
            log.debug("event=lease_renew key={} holder={} renew_ms={} now={}", key, holderId, renewMs, nowMs);
            return true;
        }
        leader = holderId.equals(readHolder().orElse(null));
        log.warn("event=lease_renew_fail key={} holder={} still_leader={} now={}", key, holderId, leader, nowMs);
        safeIncRenewFailures();
        return false;
    }

    /**
     * Gives up the lease. The key is removed only while it still holds this instance's id, so a
     * lease that expired and was taken by another holder is left alone.
     */
    public void release() {
        if (!leader) {
            return;
        }
        try {
            if (store.deleteIfValue(key, holderId)) {
                log.info("event=lease_release key={} holder={}", key, holderId);
            } else {
                log.info("event=lease_release_skipped key={} holder={} current={}", key, holderId,
                        readHolder().orElse(null));
            }
        } catch (RuntimeException e) {
            log.warn("event=lease_store_error op=delete key={} holder={} error={}", key, holderId, e.getMessage());
        } finally {
            leader = false;
        }
    }

    /**
     * Reads the store and reconciles the local flag with it.
     */
    public boolean isLeader() {
        Optional<String> current = readHolder();
        leader = holderId.equals(current.orElse(null));
        return leader;
    }

    public Optional<String> holder() {
        return readHolder();
    }

    public boolean believesLeader() {
        return leader;
    }

    public String getKey() {
        return key;
    }

    public String getHolderId() {
        return holderId;
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public long getRenewMs() {
        return renewMs;
    }

    public String getEnv() {
        return env;
    }

    public String getService() {
        return service;
    }

    private Optional<String> readHolder() {
        try {
            return store.get(key);
        } catch (RuntimeException e) {
            log.warn("event=lease_store_error op=get key={} holder={} error={}", key, holderId, e.getMessage());
            return Optional.empty();
        }
    }

    private void safeIncElections() {
        try {
            metrics.incLeaderElections(env, service);
        } catch (RuntimeException e) {
            log.debug("Leader election metric failed key={}", key, e);
        }
    }

    private void safeIncRenewFailures() {
        try {
            metrics.incRenewFailures(env, service);
        } catch (RuntimeException e) {
            log.debug("Renew failure metric failed key={}", key, e);
        }
    }
}
