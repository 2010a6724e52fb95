package com.coordkit.ratelimit;

import lombok.Value;

import java.time.Instant;

@Value
public class CooldownResult {
    boolean allowed;
    // 冷却结束时间
    Instant resetAt;
}
