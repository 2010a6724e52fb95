package com.coordkit.exception;

/**
 * 存储返回了错误应答或结构不符合约定的结果
 */
public class StoreProtocolException extends StoreException {

    public StoreProtocolException(String message) {
        super(message);
    }

    public StoreProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
