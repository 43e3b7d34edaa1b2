package com.apex.resilience.lease;

import java.util.Optional;

/**
 * Key-value capability a {@link LeaseLock} is built on. Implementations must make
 * {@link #setIfAbsent} atomic across every process sharing the store; that atomicity is the only
 * basis for mutual exclusion. Any method may throw a {@link RuntimeException} when the store is
 * unreachable.
 */
public interface LeaseStore {

    /**
     * Creates {@code key} with {@code value} and a {@code ttlMs} expiry unless a live entry exists.
     *
     * @return true when this call created the entry
     */
    boolean setIfAbsent(String key, String value, long ttlMs);

    /**
     * Resets the expiry of a live entry to {@code ttlMs} from now.
     *
     * @return false when the key is missing or already expired
     */
    boolean expire(String key, long ttlMs);

    Optional<String> get(String key);

    void delete(String key);

    /**
     * Deletes {@code key} only while its live value equals {@code expectedValue}, as one atomic step.
     *
     * @return true when this call removed the entry
     */
    boolean deleteIfValue(String key, String expectedValue);

    long currentTimeMillis();
}
