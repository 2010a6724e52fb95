package com.coordkit.exception;

/**
 * 当前实例没有记录该锁的持有令牌
 */
public class LockNotHeldException extends LockException {

    public LockNotHeldException(String lockKey) {
        super("锁未被当前实例持有", lockKey);
    }
}
