package com.apex.resilience.lease;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Testcontainers(disabledWithoutDocker = true)
class RedisLeaseStoreIntegrationTest {

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisLeaseStore store;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }

    @BeforeEach
    void setUp() {
        store = new RedisLeaseStore(redisTemplate);
        store.delete("it:leader");
    }

    @Test
    void conditionalCreateIsExclusive() {
        assertThat(store.setIfAbsent("it:leader", "A", 5000)).isTrue();
        assertThat(store.setIfAbsent("it:leader", "B", 5000)).isFalse();
        assertThat(store.get("it:leader")).contains("A");
        assertThat(redisTemplate.opsForValue().get("lease:it:leader")).isEqualTo("A");
    }

    @Test
    void expireOnlyExtendsExistingKeys() {
        assertThat(store.expire("it:leader", 1000)).isFalse();

        store.setIfAbsent("it:leader", "A", 5000);
        assertThat(store.expire("it:leader", 20_000)).isTrue();
        assertThat(redisTemplate.getExpire("lease:it:leader")).isGreaterThan(5);
    }

    @Test
    void deleteFreesTheKey() {
        store.setIfAbsent("it:leader", "A", 5000);

        store.delete("it:leader");

        assertThat(store.get("it:leader")).isEmpty();
    }

    @Test
    void deleteIfValueLeavesOtherHoldersAlone() {
        store.setIfAbsent("it:leader", "B", 5000);

        assertThat(store.deleteIfValue("it:leader", "A")).isFalse();
        assertThat(store.get("it:leader")).contains("B");
        assertThat(store.deleteIfValue("it:leader", "B")).isTrue();
        assertThat(store.get("it:leader")).isEmpty();
    }

    @Test
    void clockComesFromTheServer() {
        long serverTime = store.currentTimeMillis();

        assertThat(serverTime).isCloseTo(System.currentTimeMillis(), within(60_000L));
    }

    @Test
    void twoLocksShareOneLease() {
        LeaseLock a = new LeaseLock(store, "it:leader", "A");
        LeaseLock b = new LeaseLock(store, "it:leader", "B");

        assertThat(a.tryAcquire(0)).isTrue();
        assertThat(b.tryAcquire(0)).isFalse();
        assertThat(b.holder()).contains("A");

        a.release();
        assertThat(b.tryAcquire(10)).isTrue();
        assertThat(a.isLeader()).isFalse();
    }
}
