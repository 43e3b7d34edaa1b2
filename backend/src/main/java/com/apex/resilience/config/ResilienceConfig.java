package com.apex.resilience.config;

import com.apex.resilience.failover.FailoverCoordinator;
import com.apex.resilience.lease.InMemoryLeaseStore;
import com.apex.resilience.lease.LeaseLock;
import com.apex.resilience.lease.LeaseLockOptions;
import com.apex.resilience.lease.LeaseMetrics;
import com.apex.resilience.lease.LeaseStore;
import com.apex.resilience.lease.RedisLeaseStore;
import com.apex.resilience.metrics.MicrometerLeaseMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.UUID;

@Configuration
@Slf4j
public class ResilienceConfig {

    @Bean
    public Clock resilienceClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "apex.resilience.lease.store", havingValue = "memory", matchIfMissing = true)
    public LeaseStore inMemoryLeaseStore(Clock resilienceClock) {
        log.info("Lease store: in-memory (single process only)");
        return new InMemoryLeaseStore(resilienceClock);
    }

    @Bean
    @ConditionalOnProperty(name = "apex.resilience.lease.store", havingValue = "redis")
    public LeaseStore redisLeaseStore(StringRedisTemplate stringRedisTemplate) {
        log.info("Lease store: redis");
        return new RedisLeaseStore(stringRedisTemplate);
    }

    @Bean
    public LeaseMetrics leaseMetrics(MeterRegistry meterRegistry) {
        return new MicrometerLeaseMetrics(meterRegistry);
    }

    @Bean
    public LeaseLock leaseLock(LeaseStore leaseStore, ResilienceProperties properties, LeaseMetrics leaseMetrics) {
        ResilienceProperties.Lease cfg = properties.getLease();
        String holderId = resolveHolderId(cfg.getHolderId());
        LeaseLockOptions options = LeaseLockOptions.builder()
                .ttlMs(cfg.getTtlMs())
                .renewMs(cfg.getRenewMs())
                .env(cfg.getEnv())
                .service(cfg.getService())
                .metrics(leaseMetrics)
                .build();
        log.info("Lease lock key={} holder={} ttlMs={} renewMs={}", cfg.getKey(), holderId, cfg.getTtlMs(), cfg.getRenewMs());
        return new LeaseLock(leaseStore, cfg.getKey(), holderId, options);
    }

    @Bean
    public FailoverCoordinator failoverCoordinator(LeaseLock leaseLock, LeaseMetrics leaseMetrics) {
        return new FailoverCoordinator(leaseLock, leaseMetrics);
    }

    static String resolveHolderId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Hostname unavailable for holder id: {}", e.getMessage());
            host = "instance";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
