package com.coordkit.lock.core;

import com.coordkit.exception.CoordinationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 混合锁：优先使用Redis锁，Redis不可用时降级为本地锁。
 * <p>
 * 加锁：Redis明确返回的结果（包括锁被占用）直接返回，只有Redis访问出错才降级。
 * 解锁：锁值不匹配/已过期属于语义错误，直接抛出，不降级；
 * 网络类错误或当前实例没有Redis令牌时尝试释放本地锁。
 * 降级后的本地锁只在当前进程内互斥。
 */
@Slf4j
public class HybridLocker implements Locker {

    public enum FallbackDecision {
        RETURN,
        PROPAGATE,
        FALL_BACK_TO_LOCAL
    }

    private final RedisLocker redisLocker;
    private final LocalLocker localLocker;
    private final Counter lockFallbackCounter;
    private final Counter unlockFallbackCounter;

    /**
     * 未配置Redis，只使用本地锁
     */
    public HybridLocker(LocalLocker localLocker) {
        this(null, localLocker, null);
    }

    public HybridLocker(RedisLocker redisLocker, LocalLocker localLocker, MeterRegistry meterRegistry) {
        if (localLocker == null) {
            throw new IllegalArgumentException("LocalLocker 不能为空！");
        }
        MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
        this.redisLocker = redisLocker;
        this.localLocker = localLocker;
        this.lockFallbackCounter = registry.counter("coordination.lock.fallback", "operation", "lock");
        this.unlockFallbackCounter = registry.counter("coordination.lock.fallback", "operation", "unlock");
    }

    static FallbackDecision decide(LockOutcome.Status status) {
        switch (status) {
            case ACQUIRED:
            case CONTENDED:
            case RELEASED:
                return FallbackDecision.RETURN;
            case SEMANTIC_ERROR:
                return FallbackDecision.PROPAGATE;
            case NOT_HELD:
            case STORE_ERROR:
                return FallbackDecision.FALL_BACK_TO_LOCAL;
            default:
                throw new IllegalStateException("未知的锁结果: " + status);
        }
    }

    @Override
    public boolean lock(String key) {
        if (redisLocker == null) {
            return localLocker.lock(key);
        }
        return handleLock(key, redisLocker.tryAcquire(key));
    }

    @Override
    public boolean lock(String key, Duration timeout) {
        if (redisLocker == null) {
            return localLocker.lock(key);
        }
        return handleLock(key, redisLocker.tryAcquire(key, timeout));
    }

    @Override
    public void unlock(String key) {
        if (redisLocker == null) {
            localLocker.unlock(key);
            return;
        }
        handleUnlock(key, redisLocker.tryRelease(key));
    }

    @Override
    public void unlock(String key, Duration timeout) {
        if (redisLocker == null) {
            localLocker.unlock(key);
            return;
        }
        handleUnlock(key, redisLocker.tryRelease(key, timeout));
    }

    public boolean isDistributed() {
        return redisLocker != null;
    }

    private boolean handleLock(String key, LockOutcome outcome) {
        switch (decide(outcome.getStatus())) {
            case RETURN:
                return outcome.getStatus() == LockOutcome.Status.ACQUIRED;
            case FALL_BACK_TO_LOCAL:
                lockFallbackCounter.increment();
                log.warn("Redis加锁失败，降级为本地锁，key={}，原因：{}", key, outcome.getCause().getMessage());
                // 该key之后按本地锁释放，旧的Redis令牌不再有效
                redisLocker.forget(key);
                return localLocker.lock(key);
            default:
                throw outcome.getCause();
        }
    }

    private void handleUnlock(String key, LockOutcome outcome) {
        switch (decide(outcome.getStatus())) {
            case RETURN:
                return;
            case FALL_BACK_TO_LOCAL:
                if (outcome.getStatus() == LockOutcome.Status.STORE_ERROR) {
                    unlockFallbackCounter.increment();
                    log.warn("Redis解锁失败，尝试释放本地锁，key={}，原因：{}", key, outcome.getCause().getMessage());
                }
                try {
                    localLocker.unlock(key);
                    if (outcome.getStatus() == LockOutcome.Status.STORE_ERROR) {
                        // 已向调用方报告释放成功，不能再留下旧令牌
                        redisLocker.forget(key);
                    }
                    return;
                } catch (RuntimeException localError) {
                    CoordinationException cause = outcome.getCause();
                    cause.addSuppressed(localError);
                    throw cause;
                }
            default:
                throw outcome.getCause();
        }
    }
}
