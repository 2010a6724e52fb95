package com.coordkit.lock.core;

import java.time.Duration;

/**
 * 互斥锁接口（非阻塞获取，统一本地锁、Redis锁与混合锁的操作）
 */
public interface Locker {

    /**
     * 尝试获取锁
     * @param key 锁标识
     * @return true 获取成功；false 锁已被持有（锁竞争不是错误）
     */
    boolean lock(String key);

    boolean lock(String key, Duration timeout);

    /**
     * 释放锁
     * @param key 锁标识
     */
    void unlock(String key);

    void unlock(String key, Duration timeout);
}
