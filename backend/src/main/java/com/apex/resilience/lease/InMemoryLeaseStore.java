package com.apex.resilience.lease;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local {@link LeaseStore} with exact TTL semantics: an entry is live while its expiry is
 * strictly after the clock's current time. Expired entries are dropped lazily on access.
 */
@Slf4j
public class InMemoryLeaseStore implements LeaseStore {

    private record Entry(String value, long expiresAtMs) {
        boolean isLive(long nowMs) {
            return expiresAtMs > nowMs;
        }
    }

    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();

    public InMemoryLeaseStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, long ttlMs) {
        long now = currentTimeMillis();
        if (liveEntry(key, now) != null) {
            return false;
        }
        entries.put(key, new Entry(value, now + Math.max(0, ttlMs)));
        return true;
    }

    @Override
    public synchronized boolean expire(String key, long ttlMs) {
        long now = currentTimeMillis();
        Entry entry = liveEntry(key, now);
        if (entry == null) {
            return false;
        }
        entries.put(key, new Entry(entry.value(), now + Math.max(0, ttlMs)));
        return true;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Entry entry = liveEntry(key, currentTimeMillis());
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public synchronized void delete(String key) {
        entries.remove(key);
    }

    @Override
    public synchronized boolean deleteIfValue(String key, String expectedValue) {
        Entry entry = liveEntry(key, currentTimeMillis());
        if (entry == null || !entry.value().equals(expectedValue)) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    /**
     * Remaining lifetime of {@code key}, or -1 when it is missing or expired.
     */
    public synchronized long remainingTtlMs(String key) {
        long now = currentTimeMillis();
        Entry entry = liveEntry(key, now);
        return entry == null ? -1 : entry.expiresAtMs() - now;
    }

    private Entry liveEntry(String key, long nowMs) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (!entry.isLive(nowMs)) {
            entries.remove(key);
            log.debug("Lease expired key={} holder={}", key, entry.value());
            return null;
        }
        return entry;
    }
}
