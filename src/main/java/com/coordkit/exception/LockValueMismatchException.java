package com.coordkit.exception;

/**
 * 存储中的锁值与本实例记录的令牌不一致，或锁已过期
 */
public class LockValueMismatchException extends LockException {

    public LockValueMismatchException(String lockKey) {
        super("锁值不匹配或锁已过期", lockKey);
    }
}
