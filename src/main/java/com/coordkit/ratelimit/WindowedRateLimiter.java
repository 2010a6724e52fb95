package com.coordkit.ratelimit;

import com.coordkit.store.KeyValueStore;
import com.coordkit.store.WindowReply;
import com.coordkit.utils.KeyUtils;
import com.coordkit.utils.RedisConstants;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 固定窗口限流：窗口从第一次请求开始计时，到期后整体重置。
 * 每次检查只执行一次Lua脚本，计数与过期时间在同一个原子操作中更新。
 * <p>
 * 窗口边界处可能出现突发（上个窗口末尾 + 下个窗口开头），这是固定窗口的已知特性。
 */
@Slf4j
public class WindowedRateLimiter {

    private final KeyValueStore store;
    private final String keyPrefix;
    private final Duration operationTimeout;
    private final Clock clock;

    public WindowedRateLimiter(KeyValueStore store) {
        this(store, RedisConstants.RATE_LIMIT_KEY, RedisConstants.OPERATION_TIMEOUT, Clock.systemUTC());
    }

    public WindowedRateLimiter(KeyValueStore store, String keyPrefix, Duration operationTimeout, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("KeyValueStore 不能为空！");
        }
        if (operationTimeout == null || operationTimeout.toMillis() < 1) {
            throw new IllegalArgumentException("操作超时时间至少为1毫秒");
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock 不能为空！");
        }
        this.store = store;
        this.keyPrefix = keyPrefix;
        this.operationTimeout = operationTimeout;
        this.clock = clock;
    }

    public RateLimitResult checkLimit(String key, int limit, Duration window) {
        return checkLimit(key, limit, window, operationTimeout);
    }

    /**
     * @param limit  窗口内允许的请求数
     * @param window 窗口长度，至少1毫秒
     */
    public RateLimitResult checkLimit(String key, int limit, Duration window, Duration timeout) {
        KeyUtils.requireKey(key);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit必须为正数: " + limit);
        }
        long windowMillis = window == null ? 0 : window.toMillis();
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("window必须为正数: " + window);
        }

        String redisKey = KeyUtils.buildKey(keyPrefix, key);
        WindowReply reply = store.incrementWindow(redisKey, limit, windowMillis, timeout);

        long ttlMillis = Math.max(0L, reply.getTtlMillis());
        Instant resetAt = clock.instant().plusMillis(ttlMillis);
        if (!reply.isAllowed()) {
            log.debug("请求被限流，key={}，limit={}，重置时间={}", redisKey, limit, resetAt);
        }
        return new RateLimitResult(reply.isAllowed(), (int) reply.getRemaining(), resetAt);
    }

    public RateLimitResult checkUserLimit(String userId, int limit, Duration window) {
        return checkLimit(RedisConstants.USER_LIMIT_KEY + userId, limit, window);
    }

    public RateLimitResult checkIpLimit(String ip, int limit, Duration window) {
        return checkLimit(RedisConstants.IP_LIMIT_KEY + ip, limit, window);
    }

    /**
     * 按目标（手机号/邮箱）限流
     */
    public RateLimitResult checkDestinationLimit(String destination, int limit, Duration window) {
        return checkLimit(RedisConstants.DEST_LIMIT_KEY + destination, limit, window);
    }
}
