package com.coordkit.exception;

/**
 * 协调组件异常基类（锁、限流、冷却相关的所有运行时异常）
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
