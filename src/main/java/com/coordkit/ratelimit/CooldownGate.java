package com.coordkit.ratelimit;

import com.coordkit.store.CooldownReply;
import com.coordkit.store.KeyValueStore;
import com.coordkit.utils.KeyUtils;
import com.coordkit.utils.RedisConstants;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 冷却闸门（如验证码重发间隔）：放行一次后在冷却期内拒绝，冷却期内的请求不会延长冷却时间
 */
@Slf4j
public class CooldownGate {

    private final KeyValueStore store;
    private final String keyPrefix;
    private final Duration operationTimeout;
    private final Clock clock;

    public CooldownGate(KeyValueStore store) {
        this(store, RedisConstants.COOLDOWN_KEY, RedisConstants.OPERATION_TIMEOUT, Clock.systemUTC());
    }

    public CooldownGate(KeyValueStore store, String keyPrefix, Duration operationTimeout, Clock clock) {
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

    public CooldownResult checkCooldown(String key, Duration cooldown) {
        return checkCooldown(key, cooldown, operationTimeout);
    }

    public CooldownResult checkCooldown(String key, Duration cooldown, Duration timeout) {
        KeyUtils.requireKey(key);
        long cooldownMillis = cooldown == null ? 0 : cooldown.toMillis();
        if (cooldownMillis <= 0) {
            throw new IllegalArgumentException("cooldown必须为正数: " + cooldown);
        }

        String redisKey = KeyUtils.buildKey(keyPrefix, key);
        CooldownReply reply = store.armCooldown(redisKey, cooldownMillis, timeout);

        Instant resetAt = clock.instant().plusMillis(Math.max(0L, reply.getTtlMillis()));
        if (!reply.isAllowed()) {
            log.debug("冷却中，key={}，冷却结束时间={}", redisKey, resetAt);
        }
        return new CooldownResult(reply.isAllowed(), resetAt);
    }
}
