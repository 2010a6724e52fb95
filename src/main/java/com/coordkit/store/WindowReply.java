package com.coordkit.store;

import lombok.Value;

/**
 * 限流脚本返回值 {allowed, remaining, ttl}
 */
@Value
public class WindowReply {
    boolean allowed;
    long remaining;
    long ttlMillis;
}
