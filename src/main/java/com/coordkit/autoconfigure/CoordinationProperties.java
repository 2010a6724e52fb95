package com.coordkit.autoconfigure;

import com.coordkit.utils.RedisConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "coordination")
@Validated // 启用配置校验
public class CoordinationProperties {

    private boolean enabled = true;

    // 单次Redis操作超时（调用方未指定时使用）
    @NotNull
    private Duration operationTimeout = RedisConstants.OPERATION_TIMEOUT;

    @Valid
    private Lock lock = new Lock();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    // Redis命令线程池配置
    @Valid
    private Executor executor = new Executor();

    @Valid
    private Health health = new Health();

    @Data
    public static class Lock {
        private String keyPrefix = RedisConstants.LOCK_PREFIX;

        @NotNull
        private Duration leaseTime = RedisConstants.LOCK_TTL; // 默认租期15秒
    }

    @Data
    public static class RateLimit {
        private String keyPrefix = RedisConstants.RATE_LIMIT_KEY;

        private String cooldownPrefix = RedisConstants.COOLDOWN_KEY;
    }

    @Data
    public static class Executor {
        @Min(value = 1, message = "核心线程数至少为1")
        private int corePoolSize = 4;

        @Min(value = 1, message = "最大线程数至少为1")
        private int maxPoolSize = 16;

        @Min(value = 1, message = "队列容量至少为1")
        private int queueCapacity = 1024;

        private String threadNamePrefix = "coord-store-"; // 线程名前缀
    }

    @Data
    public static class Health {
        @NotNull
        private Duration timeout = RedisConstants.HEALTH_TIMEOUT;
    }
}
