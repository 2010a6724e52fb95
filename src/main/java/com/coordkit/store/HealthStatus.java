package com.coordkit.store;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
public class HealthStatus {
    boolean healthy;
    Duration latency;
    Throwable error; // 健康时为null
    Instant timestamp;
}
