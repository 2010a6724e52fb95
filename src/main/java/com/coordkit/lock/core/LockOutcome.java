package com.coordkit.lock.core;

import com.coordkit.exception.CoordinationException;
import com.coordkit.exception.LockNotHeldException;
import com.coordkit.exception.LockValueMismatchException;
import com.coordkit.exception.LockValueTypeException;
import com.coordkit.exception.StoreException;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次Redis加锁/解锁尝试的结果
 */
@Getter
@ToString
public final class LockOutcome {

    public enum Status {
        ACQUIRED,
        CONTENDED,
        RELEASED,
        // 当前实例没有该锁的令牌
        NOT_HELD,
        // 锁值不匹配/已过期/令牌格式错误
        SEMANTIC_ERROR,
        // 网络、超时、应答格式错误
        STORE_ERROR
    }

    private static final LockOutcome ACQUIRED = new LockOutcome(Status.ACQUIRED, null);
    private static final LockOutcome CONTENDED = new LockOutcome(Status.CONTENDED, null);
    private static final LockOutcome RELEASED = new LockOutcome(Status.RELEASED, null);

    private final Status status;
    private final CoordinationException cause;

    private LockOutcome(Status status, CoordinationException cause) {
        this.status = status;
        this.cause = cause;
    }

    public static LockOutcome acquired() {
        return ACQUIRED;
    }

    public static LockOutcome contended() {
        return CONTENDED;
    }

    public static LockOutcome released() {
        return RELEASED;
    }

    public static LockOutcome failed(CoordinationException cause) {
        return new LockOutcome(classify(cause), cause);
    }

    public boolean isSuccess() {
        return status == Status.ACQUIRED || status == Status.RELEASED;
    }

    static Status classify(CoordinationException cause) {
        if (cause instanceof LockNotHeldException) {
            return Status.NOT_HELD;
        }
        if (cause instanceof LockValueMismatchException || cause instanceof LockValueTypeException) {
            return Status.SEMANTIC_ERROR;
        }
        if (cause instanceof StoreException) {
            return Status.STORE_ERROR;
        }
        throw new IllegalArgumentException("无法归类的锁异常: " + cause);
    }
}
