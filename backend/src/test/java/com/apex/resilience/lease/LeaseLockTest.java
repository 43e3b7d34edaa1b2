package com.apex.resilience.lease;

import com.apex.resilience.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LeaseLockTest {

    private static final String KEY = "apex:leader";
    private static final LeaseLockOptions OPTIONS = LeaseLockOptions.builder().ttlMs(3000).renewMs(1500).build();

    private MutableClock clock;
    private InMemoryLeaseStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(0);
        store = spy(new InMemoryLeaseStore(clock));
    }

    private LeaseLock lock(String holderId) {
        return new LeaseLock(store, KEY, holderId, OPTIONS);
    }

    @Test
    void acquiresFreeKey() {
        LeaseLock a = lock("A");

        assertThat(a.tryAcquire(0)).isTrue();
        assertThat(a.isLeader()).isTrue();
        assertThat(a.holder()).contains("A");
        verify(store).setIfAbsent(KEY, "A", 3000);
    }

    @Test
    void competitorObservesCurrentHolder() {
        LeaseLock a = lock("A");
        LeaseLock b = lock("B");
        a.tryAcquire(0);

        clock.setMillis(500);
        assertThat(b.tryAcquire(500)).isFalse();
        assertThat(b.isLeader()).isFalse();
        assertThat(b.holder()).contains("A");
        assertThat(a.isLeader()).isTrue();
    }

    @Test
    void reentrantAcquireKeepsLeadership() {
        LeaseLock a = lock("A");
        a.tryAcquire(0);

        clock.setMillis(100);
        assertThat(a.tryAcquire(100)).isTrue();
        assertThat(a.believesLeader()).isTrue();
    }

    @Test
    void competitorTakesOverOnceTtlElapses() {
        LeaseLock a = lock("A");
        LeaseLock b = lock("B");
        a.tryAcquire(0);

        clock.setMillis(2999);
        assertThat(b.tryAcquire(2999)).isFalse();

        clock.setMillis(3000);
        assertThat(b.tryAcquire(3000)).isTrue();
        assertThat(b.isLeader()).isTrue();
        assertThat(a.isLeader()).isFalse();
        assertThat(a.believesLeader()).isFalse();
    }

    @Test
    void renewalIsPacedByRenewInterval() {
        LeaseLock a = lock("A");
        a.tryAcquire(0);

        clock.setMillis(500);
        assertThat(a.renew(500)).isTrue();
        clock.setMillis(1499);
        assertThat(a.renew(1499)).isTrue();
        verify(store, never()).expire(anyString(), anyLong());

        clock.setMillis(1500);
        assertThat(a.renew(1500)).isTrue();
        verify(store).expire(KEY, 1500);
    }

    @Test
    void renewalExtendsByRenewIntervalFromThatInstant() {
        LeaseLock a = lock("A");
        a.tryAcquire(0);

        clock.setMillis(2000);
        assertThat(a.renew(2000)).isTrue();

        assertThat(store.remainingTtlMs(KEY)).isEqualTo(1500);
        clock.setMillis(3499);
        assertThat(a.isLeader()).isTrue();
        clock.setMillis(3500);
        assertThat(a.isLeader()).isFalse();
    }

    @Test
    void renewAfterExpiryFailsAndDropsLeadership() {
        LeaseMetrics metrics = mock(LeaseMetrics.class);
        LeaseLock a = new LeaseLock(store, KEY, "A", OPTIONS.toBuilder().metrics(metrics).build());
        a.tryAcquire(0);

        clock.setMillis(3000);
        assertThat(a.renew(3000)).isFalse();

        assertThat(a.believesLeader()).isFalse();
        assertThat(a.renew(3100)).isFalse();
        verify(metrics).incRenewFailures("dev", "apex");
    }

    @Test
    void renewWithoutLeadershipFailsWithoutContactingStore() {
        LeaseLock b = lock("B");

        assertThat(b.renew(10_000)).isFalse();
        verify(store, never()).expire(anyString(), anyLong());
    }

    @Test
    void releaseFreesTheKeyForCompetitors() {
        LeaseLock a = lock("A");
        LeaseLock b = lock("B");
        a.tryAcquire(0);

        a.release();

        assertThat(a.isLeader()).isFalse();
        assertThat(b.tryAcquire(10)).isTrue();
    }

    @Test
    void releaseWithoutLeadershipLeavesStoreAlone() {
        LeaseLock a = lock("A");
        LeaseLock b = lock("B");
        a.tryAcquire(0);

        b.release();

        verify(store, never()).deleteIfValue(anyString(), anyString());
        assertThat(a.isLeader()).isTrue();
    }

    @Test
    void staleReleaseKeepsTheNewHoldersLease() {
        LeaseLock a = lock("A");
        LeaseLock b = lock("B");
        a.tryAcquire(0);

        clock.setMillis(3000);
        assertThat(b.tryAcquire(3000)).isTrue();

        clock.setMillis(3100);
        a.release();

        assertThat(store.get(KEY)).contains("B");
        assertThat(b.isLeader()).isTrue();
        assertThat(a.believesLeader()).isFalse();
        verify(store, never()).delete(anyString());
    }

    @Test
    void releaseClearsLeadershipEvenWhenDeleteFails() {
        LeaseStore failing = mock(LeaseStore.class);
        when(failing.setIfAbsent(KEY, "A", 3000)).thenReturn(true);
        when(failing.deleteIfValue(KEY, "A")).thenThrow(new LeaseStoreException("store down"));
        when(failing.get(KEY)).thenThrow(new LeaseStoreException("store down"));
        LeaseLock a = new LeaseLock(failing, KEY, "A", OPTIONS);
        a.tryAcquire(0);

        a.release();

        assertThat(a.believesLeader()).isFalse();
        assertThat(a.isLeader()).isFalse();
    }

    @Test
    void storeOutageDegradesToFollower() {
        LeaseStore failing = mock(LeaseStore.class);
        when(failing.setIfAbsent(anyString(), anyString(), anyLong())).thenThrow(new LeaseStoreException("store down"));
        when(failing.get(KEY)).thenThrow(new LeaseStoreException("store down"));
        LeaseLock a = new LeaseLock(failing, KEY, "A", OPTIONS);

        assertThat(a.tryAcquire(0)).isFalse();
        assertThat(a.isLeader()).isFalse();
        assertThat(a.holder()).isEmpty();
    }

    @Test
    void renewFailureRereadsHolderToDecide() {
        LeaseStore flaky = mock(LeaseStore.class);
        when(flaky.setIfAbsent(KEY, "A", 3000)).thenReturn(true);
        when(flaky.expire(KEY, 1500)).thenThrow(new LeaseStoreException("timeout"));
        when(flaky.get(KEY)).thenReturn(Optional.of("A"));
        LeaseLock a = new LeaseLock(flaky, KEY, "A", OPTIONS);
        a.tryAcquire(0);

        assertThat(a.renew(1500)).isFalse();
        assertThat(a.believesLeader()).isTrue();

        when(flaky.get(KEY)).thenReturn(Optional.of("B"));
        assertThat(a.renew(1600)).isFalse();
        assertThat(a.believesLeader()).isFalse();
    }

    @Test
    void electionsAreCountedOnlyForSuccessfulAcquires() {
        LeaseMetrics metrics = mock(LeaseMetrics.class);
        LeaseLockOptions options = OPTIONS.toBuilder().env("prod").service("mm").metrics(metrics).build();
        LeaseLock a = new LeaseLock(store, KEY, "A", options);
        LeaseLock b = new LeaseLock(store, KEY, "B", options);

        a.tryAcquire(0);
        b.tryAcquire(0);

        verify(metrics).incLeaderElections("prod", "mm");
    }

    @Test
    void failingMetricsDoNotBreakAcquire() {
        LeaseMetrics metrics = mock(LeaseMetrics.class);
        doThrow(new IllegalStateException("registry down")).when(metrics).incLeaderElections(anyString(), anyString());
        LeaseLock a = new LeaseLock(store, KEY, "A", OPTIONS.toBuilder().metrics(metrics).build());

        assertThat(a.tryAcquire(0)).isTrue();
    }

    @Test
    void nonPositiveDurationsAreClamped() {
        LeaseLock a = new LeaseLock(store, KEY, "A", LeaseLockOptions.builder().ttlMs(0).renewMs(-5).build());

        assertThat(a.getTtlMs()).isEqualTo(1);
        assertThat(a.getRenewMs()).isEqualTo(1);
    }

    @Test
    void atMostOneHolderAtAnyInstant() {
        LeaseLock a = lock("A");
        LeaseLock b = lock("B");

        for (long now = 0; now <= 20_000; now += 250) {
            clock.setMillis(now);
            // A stalls between 6s and 10s, B never renews past 15s
            if (now < 6_000 || now > 10_000) {
                driveOnce(a, now);
            }
            if (now < 15_000) {
                driveOnce(b, now);
            }
            assertThat(a.isLeader() && b.isLeader()).as("both leaders at t=%d", now).isFalse();
        }
    }

    private static void driveOnce(LeaseLock lock, long now) {
        if (lock.isLeader()) {
            lock.renew(now);
        } else {
            lock.tryAcquire(now);
        }
    }
}
