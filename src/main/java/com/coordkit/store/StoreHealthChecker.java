package com.coordkit.store;

import com.coordkit.exception.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Redis连通性检查（PING + 延迟统计）
 */
@Slf4j
public class StoreHealthChecker {

    private final KeyValueStore store;
    private final Duration timeout;
    private final Clock clock;

    public StoreHealthChecker(KeyValueStore store, Duration timeout) {
        this(store, timeout, Clock.systemUTC());
    }

    public StoreHealthChecker(KeyValueStore store, Duration timeout, Clock clock) {
        this.store = store;
        this.timeout = timeout;
        this.clock = clock;
    }

    public HealthStatus check() {
        Instant timestamp = clock.instant();
        long start = System.nanoTime();
        try {
            store.ping(timeout);
            return new HealthStatus(true, Duration.ofNanos(System.nanoTime() - start), null, timestamp);
        } catch (StoreException e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            log.warn("Redis健康检查失败，耗时：{}ms，原因：{}", latency.toMillis(), e.getMessage());
            return new HealthStatus(false, latency, e, timestamp);
        }
    }

    public boolean isHealthy() {
        return check().isHealthy();
    }
}
