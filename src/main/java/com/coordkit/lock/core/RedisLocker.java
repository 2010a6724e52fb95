package com.coordkit.lock.core;

import cn.hutool.core.util.HexUtil;
import com.coordkit.exception.LockNotHeldException;
import com.coordkit.exception.LockValueMismatchException;
import com.coordkit.exception.LockValueTypeException;
import com.coordkit.exception.StoreException;
import com.coordkit.store.KeyValueStore;
import com.coordkit.utils.KeyUtils;
import com.coordkit.utils.RedisConstants;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Redis分布式锁：SET NX PX 加锁，Lua脚本比较令牌后删除。
 * <p>
 * 每次加锁生成新的128位随机令牌，令牌只记录在当前实例中，
 * 所以只有加锁的实例才能释放锁，其他实例释放会得到 {@link LockValueMismatchException}。
 * <p>
 * 本地令牌只在Redis给出明确结果（已删除/不匹配）后才清除；
 * 网络异常或超时时保留令牌并抛出异常，调用方可以重试释放。
 */
@Slf4j
public class RedisLocker implements Locker {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 16;

    private final KeyValueStore store;
    private final Duration leaseTime;
    private final Duration operationTimeout;
    private final String keyPrefix;

    // 锁标识 -> 加锁时生成的令牌
    private final Map<String, String> tokens = new HashMap<>();
    private final ReentrantLock tokenLock = new ReentrantLock();

    public RedisLocker(KeyValueStore store) {
        this(store, RedisConstants.LOCK_TTL, RedisConstants.OPERATION_TIMEOUT, RedisConstants.LOCK_PREFIX);
    }

    public RedisLocker(KeyValueStore store, Duration leaseTime, Duration operationTimeout, String keyPrefix) {
        if (store == null) {
            throw new IllegalArgumentException("KeyValueStore 不能为空！");
        }
        if (leaseTime == null || leaseTime.toMillis() <= 0) {
            throw new IllegalArgumentException("锁租期必须为正数");
        }
        if (operationTimeout == null) {
            throw new IllegalArgumentException("操作超时时间不能为空");
        }
        this.store = store;
        this.leaseTime = leaseTime;
        this.operationTimeout = operationTimeout;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public boolean lock(String key) {
        return lock(key, operationTimeout);
    }

    @Override
    public boolean lock(String key, Duration timeout) {
        LockOutcome outcome = tryAcquire(key, timeout);
        if (outcome.getStatus() == LockOutcome.Status.STORE_ERROR) {
            throw outcome.getCause();
        }
        return outcome.getStatus() == LockOutcome.Status.ACQUIRED;
    }

    @Override
    public void unlock(String key) {
        unlock(key, operationTimeout);
    }

    @Override
    public void unlock(String key, Duration timeout) {
        LockOutcome outcome = tryRelease(key, timeout);
        if (!outcome.isSuccess()) {
            throw outcome.getCause();
        }
    }

    public LockOutcome tryAcquire(String key) {
        return tryAcquire(key, operationTimeout);
    }

    public LockOutcome tryAcquire(String key, Duration timeout) {
        KeyUtils.requireKey(key);
        String lockKey = KeyUtils.buildKey(keyPrefix, key);
        String token = newToken();

        boolean acquired;
        try {
            acquired = store.setIfAbsent(lockKey, token, leaseTime, timeout);
        } catch (StoreException e) {
            log.warn("获取Redis锁失败，lockKey={}，原因：{}", lockKey, e.getMessage());
            return LockOutcome.failed(e);
        }

        if (!acquired) {
            log.debug("Redis锁已被持有，lockKey={}", lockKey);
            return LockOutcome.contended();
        }
        recordToken(key, token);
        log.debug("获取Redis锁成功，lockKey={}，租期={}ms", lockKey, leaseTime.toMillis());
        return LockOutcome.acquired();
    }

    public LockOutcome tryRelease(String key) {
        return tryRelease(key, operationTimeout);
    }

    public LockOutcome tryRelease(String key, Duration timeout) {
        KeyUtils.requireKey(key);
        String lockKey = KeyUtils.buildKey(keyPrefix, key);

        String token = currentToken(key);
        if (token == null) {
            return LockOutcome.failed(new LockNotHeldException(key));
        }
        if (!isWellFormed(token)) {
            forgetToken(key, token);
            log.error("锁令牌格式错误，已丢弃，lockKey={}", lockKey);
            return LockOutcome.failed(new LockValueTypeException(key));
        }

        boolean released;
        try {
            released = store.compareAndDelete(lockKey, token, timeout);
        } catch (StoreException e) {
            // 删除是否生效未知，保留令牌
            log.warn("释放Redis锁结果未知，保留本地令牌，lockKey={}，原因：{}", lockKey, e.getMessage());
            return LockOutcome.failed(e);
        }

        forgetToken(key, token);
        if (!released) {
            log.warn("Redis锁值不匹配或已过期，lockKey={}", lockKey);
            return LockOutcome.failed(new LockValueMismatchException(key));
        }
        log.debug("释放Redis锁成功，lockKey={}", lockKey);
        return LockOutcome.released();
    }

    public boolean isHeldByThisInstance(String key) {
        return currentToken(key) != null;
    }

    void recordToken(String key, String token) {
        tokenLock.lock();
        try {
            tokens.put(key, token);
        } finally {
            tokenLock.unlock();
        }
    }

    String currentToken(String key) {
        tokenLock.lock();
        try {
            return tokens.get(key);
        } finally {
            tokenLock.unlock();
        }
    }

    /**
     * 丢弃本实例记录的令牌，不访问Redis。
     * 混合锁已按本地锁处理该key时调用，Redis中的锁等租期到期自动释放。
     */
    void forget(String key) {
        tokenLock.lock();
        try {
            tokens.remove(key);
        } finally {
            tokenLock.unlock();
        }
    }

    /**
     * 只有令牌未被并发的加锁替换时才删除
     */
    private void forgetToken(String key, String token) {
        tokenLock.lock();
        try {
            tokens.remove(key, token);
        } finally {
            tokenLock.unlock();
        }
    }

    static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return HexUtil.encodeHexStr(bytes);
    }

    static boolean isWellFormed(String token) {
        if (token.length() != TOKEN_BYTES * 2) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
