package com.coordkit.store;

import cn.hutool.core.util.BooleanUtil;
import com.coordkit.exception.StoreProtocolException;
import com.coordkit.exception.StoreTransportException;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 基于 StringRedisTemplate 的 {@link KeyValueStore} 实现，三个原子操作由Lua脚本完成
 */
public class RedisKeyValueStore implements KeyValueStore {

    static final DefaultRedisScript<Long> UNLOCK_SCRIPT;
    static final DefaultRedisScript<List> RATE_LIMIT_SCRIPT;
    static final DefaultRedisScript<List> COOLDOWN_SCRIPT;

    static {
        UNLOCK_SCRIPT = new DefaultRedisScript<>();
        UNLOCK_SCRIPT.setLocation(new ClassPathResource("/lua/unlock.lua"));
        UNLOCK_SCRIPT.setResultType(Long.class);

        RATE_LIMIT_SCRIPT = new DefaultRedisScript<>();
        RATE_LIMIT_SCRIPT.setLocation(new ClassPathResource("/lua/rate_limit.lua"));
        RATE_LIMIT_SCRIPT.setResultType(List.class);

        COOLDOWN_SCRIPT = new DefaultRedisScript<>();
        COOLDOWN_SCRIPT.setLocation(new ClassPathResource("/lua/cooldown.lua"));
        COOLDOWN_SCRIPT.setResultType(List.class);
    }

    private final StringRedisTemplate stringRedisTemplate;
    private final StoreCommandExecutor commandExecutor;

    public RedisKeyValueStore(StringRedisTemplate stringRedisTemplate, StoreCommandExecutor commandExecutor) {
        if (stringRedisTemplate == null) {
            throw new IllegalArgumentException("StringRedisTemplate 不能为空！");
        }
        if (commandExecutor == null) {
            throw new IllegalArgumentException("StoreCommandExecutor 不能为空！");
        }
        this.stringRedisTemplate = stringRedisTemplate;
        this.commandExecutor = commandExecutor;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl, Duration timeout) {
        Boolean isSet = run("SET NX " + key, timeout,
                () -> stringRedisTemplate.opsForValue().setIfAbsent(key, value, ttl));
        return requireReply(isSet, "SET NX " + key);
    }

    @Override
    public String get(String key, Duration timeout) {
        return run("GET " + key, timeout, () -> stringRedisTemplate.opsForValue().get(key));
    }

    @Override
    public long delete(String key, Duration timeout) {
        Long count = run("DEL " + key, timeout,
                () -> stringRedisTemplate.delete(Collections.singletonList(key)));
        return requireReply(count, "DEL " + key);
    }

    @Override
    public boolean exists(String key, Duration timeout) {
        Boolean exists = run("EXISTS " + key, timeout, () -> stringRedisTemplate.hasKey(key));
        return BooleanUtil.isTrue(exists);
    }

    @Override
    public long increment(String key, Duration timeout) {
        Long value = run("INCR " + key, timeout, () -> stringRedisTemplate.opsForValue().increment(key));
        return requireReply(value, "INCR " + key);
    }

    @Override
    public long ttlMillis(String key, Duration timeout) {
        Long ttl = run("PTTL " + key, timeout,
                () -> stringRedisTemplate.getExpire(key, TimeUnit.MILLISECONDS));
        return requireReply(ttl, "PTTL " + key);
    }

    @Override
    public boolean expire(String key, Duration ttl, Duration timeout) {
        Boolean existed = run("PEXPIRE " + key, timeout, () -> stringRedisTemplate.expire(key, ttl));
        return BooleanUtil.isTrue(existed);
    }

    @Override
    public boolean compareAndDelete(String key, String expected, Duration timeout) {
        Long deleted = run("unlock " + key, timeout, () -> stringRedisTemplate.execute(
                UNLOCK_SCRIPT,
                Collections.singletonList(key),
                expected
        ));
        return requireReply(deleted, "unlock " + key) == 1L;
    }

    @Override
    public WindowReply incrementWindow(String key, int limit, long windowMillis, Duration timeout) {
        Object reply = run("rate_limit " + key, timeout, () -> stringRedisTemplate.execute(
                RATE_LIMIT_SCRIPT,
                Collections.singletonList(key),
                String.valueOf(limit), String.valueOf(windowMillis)
        ));
        List<?> values = ScriptReplies.requireList(reply, 3, "rate_limit");
        return new WindowReply(
                ScriptReplies.toLong(values.get(0), "rate_limit", "allowed") == 1L,
                ScriptReplies.toLong(values.get(1), "rate_limit", "remaining"),
                ScriptReplies.toLong(values.get(2), "rate_limit", "ttl"));
    }

    @Override
    public CooldownReply armCooldown(String key, long cooldownMillis, Duration timeout) {
        Object reply = run("cooldown " + key, timeout, () -> stringRedisTemplate.execute(
                COOLDOWN_SCRIPT,
                Collections.singletonList(key),
                String.valueOf(cooldownMillis)
        ));
        List<?> values = ScriptReplies.requireList(reply, 2, "cooldown");
        return new CooldownReply(
                ScriptReplies.toLong(values.get(0), "cooldown", "allowed") == 1L,
                ScriptReplies.toLong(values.get(1), "cooldown", "ttl"));
    }

    @Override
    public String ping(Duration timeout) {
        return run("PING", timeout, () -> stringRedisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
    }

    private <T> T run(String operation, Duration timeout, Supplier<T> command) {
        return commandExecutor.call(operation, timeout, () -> {
            try {
                return command.get();
            } catch (RedisSystemException | InvalidDataAccessApiUsageException e) {
                // 服务端返回了错误应答（脚本错误、类型错误等），Lettuce/Jedis 转换为后者
                throw new StoreProtocolException("Redis返回错误: " + operation, e);
            } catch (DataAccessException e) {
                throw new StoreTransportException("Redis访问失败: " + operation, e);
            }
        });
    }

    private static <T> T requireReply(T reply, String operation) {
        if (reply == null) {
            throw new StoreProtocolException("Redis返回空应答: " + operation);
        }
        return reply;
    }
}
