package com.coordkit.lock.core;

import com.coordkit.exception.LockNotHeldException;
import com.coordkit.exception.LockValueMismatchException;
import com.coordkit.exception.LockValueTypeException;
import com.coordkit.exception.StoreProtocolException;
import com.coordkit.exception.StoreTransportException;
import com.coordkit.store.KeyValueStore;
import com.coordkit.testutil.InMemoryKeyValueStore;
import com.coordkit.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RedisLockerTest {

    private static final Duration LEASE = Duration.ofSeconds(15);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new InMemoryKeyValueStore(clock);
    }

    private RedisLocker newLocker() {
        return new RedisLocker(store, LEASE, TIMEOUT, "lock:");
    }

    @Test
    void lockTwiceOnSameInstance() {
        RedisLocker locker = newLocker();

        assertTrue(locker.lock("k"));
        assertFalse(locker.lock("k"), "锁被占用返回false而不是异常");
    }

    @Test
    void unlockThenLockAgain() {
        RedisLocker locker = newLocker();
        locker.lock("k");

        assertDoesNotThrow(() -> locker.unlock("k"));
        assertTrue(locker.lock("k"));
    }

    @Test
    void lockStoresTokenWithLeaseTime() {
        RedisLocker locker = newLocker();
        locker.lock("order");

        String stored = store.get("lock:order", TIMEOUT);
        assertEquals(locker.currentToken("order"), stored);
        assertEquals(LEASE.toMillis(), store.ttlMillis("lock:order", TIMEOUT));
    }

    @Test
    void tokenIsFreshHex128Bits() {
        String first = RedisLocker.newToken();
        String second = RedisLocker.newToken();

        assertEquals(32, first.length());
        assertTrue(RedisLocker.isWellFormed(first));
        assertNotEquals(first, second);
    }

    @Test
    void unlockWithoutLockIsNotHeld() {
        RedisLocker locker = newLocker();

        LockNotHeldException e = assertThrows(LockNotHeldException.class, () -> locker.unlock("k"));
        assertEquals("k", e.getLockKey());
    }

    @Test
    void otherInstanceCannotRelease() {
        RedisLocker owner = newLocker();
        RedisLocker intruder = newLocker();
        owner.lock("k");

        assertThrows(LockNotHeldException.class, () -> intruder.unlock("k"));
        assertTrue(store.exists("lock:k", TIMEOUT));
    }

    @Test
    void staleTokenGetsMismatchAndLeavesKeyUntouched() {
        RedisLocker first = newLocker();
        RedisLocker second = newLocker();
        first.lock("k");

        // 锁过期后被另一个实例重新获取
        clock.advance(LEASE.plusMillis(1));
        assertTrue(second.lock("k"));
        String secondToken = store.get("lock:k", TIMEOUT);

        assertThrows(LockValueMismatchException.class, () -> first.unlock("k"));
        assertEquals(secondToken, store.get("lock:k", TIMEOUT));
        assertFalse(first.isHeldByThisInstance("k"));

        assertDoesNotThrow(() -> second.unlock("k"));
        assertFalse(store.exists("lock:k", TIMEOUT));
    }

    @Test
    void expiredLockReleaseIsMismatch() {
        RedisLocker locker = newLocker();
        locker.lock("k");
        clock.advance(LEASE);

        assertThrows(LockValueMismatchException.class, () -> locker.unlock("k"));
    }

    @Test
    void malformedTokenIsTypeError() {
        RedisLocker locker = newLocker();
        locker.recordToken("k", "not-a-token");

        LockOutcome outcome = locker.tryRelease("k");

        assertEquals(LockOutcome.Status.SEMANTIC_ERROR, outcome.getStatus());
        assertTrue(outcome.getCause() instanceof LockValueTypeException);
        assertFalse(locker.isHeldByThisInstance("k"));
    }

    @Test
    void transportErrorOnLockPropagates() {
        KeyValueStore failing = mock(KeyValueStore.class);
        when(failing.setIfAbsent(anyString(), anyString(), any(), any()))
                .thenThrow(new StoreTransportException("connection refused"));
        RedisLocker locker = new RedisLocker(failing, LEASE, TIMEOUT, "lock:");

        assertThrows(StoreTransportException.class, () -> locker.lock("k"));
        assertEquals(LockOutcome.Status.STORE_ERROR, locker.tryAcquire("k").getStatus());
        assertFalse(locker.isHeldByThisInstance("k"));
    }

    @Test
    void protocolErrorOnLockPropagates() {
        KeyValueStore failing = mock(KeyValueStore.class);
        when(failing.setIfAbsent(anyString(), anyString(), any(), any()))
                .thenThrow(new StoreProtocolException("bad reply"));
        RedisLocker locker = new RedisLocker(failing, LEASE, TIMEOUT, "lock:");

        assertThrows(StoreProtocolException.class, () -> locker.lock("k"));
    }

    @Test
    void transportErrorOnUnlockKeepsTokenForRetry() {
        KeyValueStore flaky = mock(KeyValueStore.class);
        when(flaky.setIfAbsent(eq("lock:k"), anyString(), eq(LEASE), eq(TIMEOUT))).thenReturn(true);
        when(flaky.compareAndDelete(eq("lock:k"), anyString(), eq(TIMEOUT)))
                .thenThrow(new StoreTransportException("read timed out"))
                .thenReturn(true);
        RedisLocker locker = new RedisLocker(flaky, LEASE, TIMEOUT, "lock:");
        locker.lock("k");

        assertThrows(StoreTransportException.class, () -> locker.unlock("k"));
        assertTrue(locker.isHeldByThisInstance("k"), "结果未知时保留令牌");

        assertDoesNotThrow(() -> locker.unlock("k"));
        assertFalse(locker.isHeldByThisInstance("k"));
    }

    @Test
    void concurrentInstancesOnlyOneAcquires() throws InterruptedException {
        int numThreads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger successCount = new AtomicInteger();

        for (int i = 0; i < numThreads; i++) {
            RedisLocker locker = newLocker();
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (locker.lock("shared")) {
                        successCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, successCount.get());
    }

    @Test
    void forgetDropsTokenWithoutTouchingRedis() {
        RedisLocker locker = new RedisLocker(store, LEASE, TIMEOUT, "lock:");
        assertTrue(locker.lock("k"));

        locker.forget("k");

        assertFalse(locker.isHeldByThisInstance("k"));
        assertTrue(store.exists("lock:k", TIMEOUT));
        assertThrows(LockNotHeldException.class, () -> locker.unlock("k"));
    }
}
