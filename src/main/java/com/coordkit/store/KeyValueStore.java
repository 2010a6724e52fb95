package com.coordkit.store;

import java.time.Duration;

/**
 * 远程KV存储的命令集合（带过期时间 + 服务端原子脚本）
 * <p>
 * 所有方法最多阻塞调用方 {@code timeout} 时长：
 * 存储不可达、超时或线程被中断时抛出 {@link com.coordkit.exception.StoreTransportException}，
 * 应答结构不符合约定或服务端返回错误时抛出 {@link com.coordkit.exception.StoreProtocolException}。
 */
public interface KeyValueStore {

    /**
     * key不存在时写入value并设置过期时间
     * @return 是否写入成功
     */
    boolean setIfAbsent(String key, String value, Duration ttl, Duration timeout);

    /**
     * @return key对应的值，不存在返回null
     */
    String get(String key, Duration timeout);

    /**
     * @return 删除的key数量
     */
    long delete(String key, Duration timeout);

    boolean exists(String key, Duration timeout);

    /**
     * 整数自增，值不是整数时抛出协议异常
     */
    long increment(String key, Duration timeout);

    /**
     * @return 剩余毫秒数；没有过期时间返回 -1，key不存在返回 -2
     */
    long ttlMillis(String key, Duration timeout);

    /**
     * @return key是否存在
     */
    boolean expire(String key, Duration ttl, Duration timeout);

    /**
     * 解锁脚本：存储值等于 expected 时删除key
     * @return 是否删除
     */
    boolean compareAndDelete(String key, String expected, Duration timeout);

    /**
     * 固定窗口计数脚本，一次往返完成 读取-判断-自增-过期
     */
    WindowReply incrementWindow(String key, int limit, long windowMillis, Duration timeout);

    /**
     * 冷却脚本：key不存在时写入哨兵值并设置过期时间，存在时返回剩余时间且不续期
     */
    CooldownReply armCooldown(String key, long cooldownMillis, Duration timeout);

    /**
     * 连通性探测
     */
    String ping(Duration timeout);
}
