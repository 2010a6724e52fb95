package com.coordkit.exception;

/**
 * 本地记录的令牌格式异常（内部状态不一致）
 */
public class LockValueTypeException extends LockException {

    public LockValueTypeException(String lockKey) {
        super("锁令牌格式错误", lockKey);
    }
}
