package com.coordkit.autoconfigure;

import com.coordkit.lock.core.HybridLocker;
import com.coordkit.lock.core.LocalLocker;
import com.coordkit.lock.core.RedisLocker;
import com.coordkit.ratelimit.CooldownGate;
import com.coordkit.ratelimit.WindowedRateLimiter;
import com.coordkit.store.KeyValueStore;
import com.coordkit.store.RedisKeyValueStore;
import com.coordkit.store.StoreCommandExecutor;
import com.coordkit.store.StoreHealthChecker;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(CoordinationProperties.class)
@ConditionalOnProperty(prefix = "coordination", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CoordinationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LocalLocker localLocker() {
        return new LocalLocker();
    }

    // 有Redis时使用混合锁，否则只使用本地锁
    @Bean
    @Primary
    @ConditionalOnMissingBean
    public HybridLocker hybridLocker(LocalLocker localLocker,
                                     ObjectProvider<RedisLocker> redisLocker,
                                     ObjectProvider<MeterRegistry> meterRegistry) {
        return new HybridLocker(redisLocker.getIfAvailable(), localLocker, meterRegistry.getIfAvailable());
    }

    /**
     * 依赖Redis的组件，容器中存在 StringRedisTemplate 时才注册
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(StringRedisTemplate.class)
    static class RedisBackedConfiguration {

        // 注册Redis命令线程池（从配置中获取参数）
        @Bean(destroyMethod = "shutdown")
        @ConditionalOnMissingBean
        public StoreCommandExecutor storeCommandExecutor(CoordinationProperties properties) {
            return new StoreCommandExecutor(properties.getExecutor());
        }

        @Bean
        @ConditionalOnMissingBean
        public KeyValueStore keyValueStore(StringRedisTemplate stringRedisTemplate,
                                           StoreCommandExecutor storeCommandExecutor) {
            return new RedisKeyValueStore(stringRedisTemplate, storeCommandExecutor);
        }

        @Bean
        @ConditionalOnMissingBean
        public RedisLocker redisLocker(KeyValueStore keyValueStore, CoordinationProperties properties) {
            CoordinationProperties.Lock lock = properties.getLock();
            return new RedisLocker(keyValueStore, lock.getLeaseTime(), properties.getOperationTimeout(), lock.getKeyPrefix());
        }

        @Bean
        @ConditionalOnMissingBean
        public WindowedRateLimiter windowedRateLimiter(KeyValueStore keyValueStore, CoordinationProperties properties) {
            return new WindowedRateLimiter(keyValueStore, properties.getRateLimit().getKeyPrefix(),
                    properties.getOperationTimeout(), Clock.systemUTC());
        }

        @Bean
        @ConditionalOnMissingBean
        public CooldownGate cooldownGate(KeyValueStore keyValueStore, CoordinationProperties properties) {
            return new CooldownGate(keyValueStore, properties.getRateLimit().getCooldownPrefix(),
                    properties.getOperationTimeout(), Clock.systemUTC());
        }

        @Bean
        @ConditionalOnMissingBean
        public StoreHealthChecker storeHealthChecker(KeyValueStore keyValueStore, CoordinationProperties properties) {
            return new StoreHealthChecker(keyValueStore, properties.getHealth().getTimeout());
        }
    }
}
