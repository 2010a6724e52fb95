package com.coordkit.ratelimit;

import lombok.Value;

import java.time.Instant;

@Value
public class RateLimitResult {
    boolean allowed;
    // 当前窗口内剩余可用次数
    int remaining;
    // 当前窗口结束时间
    Instant resetAt;
}
