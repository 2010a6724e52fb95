package com.coordkit.store;

import lombok.Value;

/**
 * 冷却脚本返回值 {allowed, ttl}
 */
@Value
public class CooldownReply {
    boolean allowed;
    long ttlMillis;
}
