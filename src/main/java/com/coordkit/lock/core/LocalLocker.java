package com.coordkit.lock.core;

import com.coordkit.utils.KeyUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 进程内锁：只在当前JVM内互斥，没有过期时间，不支持分布式环境
 */
@Slf4j
public class LocalLocker implements Locker {
    // 当前持有的锁
    private final Set<String> heldKeys = new HashSet<>();
    private final ReentrantLock mutex = new ReentrantLock();

    @Override
    public boolean lock(String key) {
        KeyUtils.requireKey(key);
        mutex.lock();
        try {
            if (!heldKeys.add(key)) {
                log.debug("本地锁已被持有，key={}", key);
                return false;
            }
            log.debug("获取本地锁成功，key={}", key);
            return true;
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public boolean lock(String key, Duration timeout) {
        return lock(key);
    }

    /**
     * 释放未持有的锁不报错，方便在finally中无条件清理
     */
    @Override
    public void unlock(String key) {
        KeyUtils.requireKey(key);
        mutex.lock();
        try {
            if (heldKeys.remove(key)) {
                log.debug("释放本地锁，key={}", key);
            }
        } finally {
            mutex.unlock();
        }
    }

    @Override
    public void unlock(String key, Duration timeout) {
        unlock(key);
    }

    public boolean isLocked(String key) {
        mutex.lock();
        try {
            return heldKeys.contains(key);
        } finally {
            mutex.unlock();
        }
    }
}
