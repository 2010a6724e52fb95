package com.coordkit.utils;

import java.time.Duration;

public final class RedisConstants {

    private RedisConstants() {}

    public static final String LOCK_PREFIX = "lock:";
    public static final Duration LOCK_TTL = Duration.ofSeconds(15);

    public static final String RATE_LIMIT_KEY = "ratelimit:";
    public static final String COOLDOWN_KEY = "ratelimit:cooldown:";

    public static final String USER_LIMIT_KEY = "user:";
    public static final String IP_LIMIT_KEY = "ip:";
    public static final String DEST_LIMIT_KEY = "dest:";

    /**
     * 单次Redis操作的默认超时时间
     */
    public static final Duration OPERATION_TIMEOUT = Duration.ofSeconds(5);
    /**
     * 健康检查超时时间
     */
    public static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(2);

    /**
     * PTTL返回值：key存在但没有过期时间
     */
    public static final long TTL_NO_EXPIRY = -1L;
    /**
     * PTTL返回值：key不存在
     */
    public static final long TTL_NOT_FOUND = -2L;
}
