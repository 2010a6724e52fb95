package com.coordkit.exception;

/**
 * 存储不可达、超时或调用线程被中断，结果未知
 */
public class StoreTransportException extends StoreException {

    public StoreTransportException(String message) {
        super(message);
    }

    public StoreTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
