package com.coordkit.exception;

/**
 * 远程存储访问失败
 */
public abstract class StoreException extends CoordinationException {

    protected StoreException(String message) {
        super(message);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
