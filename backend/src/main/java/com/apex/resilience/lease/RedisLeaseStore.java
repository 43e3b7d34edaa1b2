package com.apex.resilience.lease;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * {@link LeaseStore} over Redis. {@code SET key value NX PX ttl} provides the atomic conditional
 * create; the clock is the Redis server's {@code TIME} so every process compares against the same
 * time source as the expiry.
 *
 * Key format:  lease:{key}
 */
public class RedisLeaseStore implements LeaseStore {

    private static final String KEY_PREFIX = "lease:";
    private static final RedisScript<Long> DELETE_IF_VALUE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisLeaseStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean setIfAbsent(String key, String value, long ttlMs) {
        try {
            Boolean created = redisTemplate.opsForValue()
                    .setIfAbsent(redisKey(key), value, Duration.ofMillis(Math.max(1, ttlMs)));
            return Boolean.TRUE.equals(created);
        } catch (DataAccessException e) {
            throw new LeaseStoreException("SET NX failed for " + key, e);
        }
    }

    @Override
    public boolean expire(String key, long ttlMs) {
        try {
            Boolean extended = redisTemplate.expire(redisKey(key), Duration.ofMillis(Math.max(1, ttlMs)));
            return Boolean.TRUE.equals(extended);
        } catch (DataAccessException e) {
            throw new LeaseStoreException("PEXPIRE failed for " + key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey(key)));
        } catch (DataAccessException e) {
            throw new LeaseStoreException("GET failed for " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            redisTemplate.delete(redisKey(key));
        } catch (DataAccessException e) {
            throw new LeaseStoreException("DEL failed for " + key, e);
        }
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        try {
            Long removed = redisTemplate.execute(DELETE_IF_VALUE, List.of(redisKey(key)), expectedValue);
            return removed != null && removed > 0;
        } catch (DataAccessException e) {
            throw new LeaseStoreException("compare-and-delete failed for " + key, e);
        }
    }

    @Override
    public long currentTimeMillis() {
        try {
            Long serverTime = redisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().time());
            if (serverTime == null) {
                throw new LeaseStoreException("TIME returned no value");
            }
            return serverTime;
        } catch (DataAccessException e) {
            throw new LeaseStoreException("TIME failed", e);
        }
    }

    private static String redisKey(String key) {
        return KEY_PREFIX + key;
    }
}
