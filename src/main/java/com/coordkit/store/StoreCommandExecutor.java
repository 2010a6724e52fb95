package com.coordkit.store;

import com.coordkit.autoconfigure.CoordinationProperties;
import com.coordkit.exception.StoreTransportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Redis命令执行器：命令在独立线程池中执行，调用方按自己的超时时间等待结果。
 * 超时或线程被中断时取消命令并立即返回错误，不会无限阻塞调用方。
 */
@Slf4j
public class StoreCommandExecutor {
    // 线程池
    private final ThreadPoolExecutor executor;

    // 构造器：接收配置参数
    public StoreCommandExecutor(CoordinationProperties.Executor executorConfig) {
        int corePoolSize = executorConfig.getCorePoolSize();
        int maxPoolSize = Math.max(corePoolSize, executorConfig.getMaxPoolSize());
        String threadNamePrefix = executorConfig.getThreadNamePrefix();

        this.executor = new ThreadPoolExecutor(
                corePoolSize,
                maxPoolSize,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(executorConfig.getQueueCapacity()),
                new ThreadFactory() {
                    private final AtomicInteger threadNumber = new AtomicInteger(1);

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread thread = new Thread(r, threadNamePrefix + threadNumber.getAndIncrement());
                        thread.setDaemon(true);
                        return thread;
                    }
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 执行一条命令并在 timeout 内等待结果。
     * 命令抛出的运行时异常原样抛给调用方。
     */
    public <T> T call(String operation, Duration timeout, Supplier<T> command) {
        if (timeout == null || timeout.toMillis() < 1) {
            throw new IllegalArgumentException("超时时间至少为1毫秒，operation=" + operation + "，timeout=" + timeout);
        }

        Future<T> future;
        try {
            future = executor.submit(command::get);
        } catch (RejectedExecutionException e) {
            throw new StoreTransportException("Redis命令被拒绝（线程池已满或已关闭）: " + operation, e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StoreTransportException("Redis命令超时(" + timeout.toMillis() + "ms): " + operation, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreTransportException("Redis命令等待被中断: " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new StoreTransportException("Redis命令执行失败: " + operation, cause);
        }
    }

    public void shutdown() {
        log.info("关闭Redis命令线程池...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("等待Redis命令线程池关闭被中断", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
