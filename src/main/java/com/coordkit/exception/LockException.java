package com.coordkit.exception;

/**
 * 释放锁时的语义错误
 */
public abstract class LockException extends CoordinationException {

    private final String lockKey;

    protected LockException(String message, String lockKey) {
        super(message + "，lockKey=" + lockKey);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
