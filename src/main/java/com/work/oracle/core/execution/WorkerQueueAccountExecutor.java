package com.work.oracle.core.execution;

import com.work.oracle.core.exception.SubmissionException;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.oracle.core.support.ValidationUtils.requireNonEmpty;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;
import static com.work.oracle.core.support.ValidationUtils.requirePositive;

/**
 * worker-queue 模式：每个账户一条独立的单线程有界队列（lane），首次使用时创建。
 * <p>
 * 同一账户的工作按入队顺序逐个执行；队列满或等待超时以显式异常抛出，调用方不会无限阻塞。
 */
public class WorkerQueueAccountExecutor implements AccountExecutor, AutoCloseable {

    /**
     * 串行队列已满或执行器已关闭，工作未入队。
     */
    public static final class DispatchRejectedException extends SubmissionException {
        public DispatchRejectedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * 等待超时。工作可能已在执行并会继续执行完，调用方不能据此认定交易未发出。
     */
    public static final class DispatchTimeoutException extends SubmissionException {
        public DispatchTimeoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final Map<String, ThreadPoolExecutor> lanes = new ConcurrentHashMap<>();
    private final AtomicInteger laneSeq = new AtomicInteger();
    private final int queueCapacity;
    private final Duration dispatchTimeout;
    private final String threadNamePrefix;
    private volatile boolean closed;

    public WorkerQueueAccountExecutor(int queueCapacity, Duration dispatchTimeout, String threadNamePrefix) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity 必须大于0");
        }
        this.queueCapacity = queueCapacity;
        this.dispatchTimeout = requirePositive(dispatchTimeout, "dispatchTimeout");
        this.threadNamePrefix = threadNamePrefix == null || threadNamePrefix.trim().isEmpty()
                ? "account-lane-"
                : threadNamePrefix.trim();
    }

    @Override
    public <T> T execute(String account, Callable<T> work) {
        requireNonEmpty(account, "account");
        requireNonNull(work, "work");
        if (closed) {
            throw new DispatchRejectedException("executor closed, account=" + account, null);
        }

        Future<T> future;
        try {
            future = laneFor(account).submit(work);
        } catch (RejectedExecutionException e) {
            throw new DispatchRejectedException("account queue full or closed, account=" + account, e);
        }
        return await(account, future);
    }

    private <T> T await(String account, Future<T> future) {
        try {
            return future.get(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 只撤销尚未开始的工作；已在执行的动作可能正在等待 receipt，不能中断
            future.cancel(false);
            throw new DispatchTimeoutException("account work timed out, account=" + account
                    + " timeout=" + dispatchTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new DispatchRejectedException("interrupted while waiting, account=" + account, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new SubmissionException("account work failed, account=" + account + ": " + cause, cause);
        }
    }

    private ThreadPoolExecutor laneFor(String account) {
        // 地址大小写不敏感
        return lanes.computeIfAbsent(account.toLowerCase(Locale.ROOT), key -> newLane());
    }

    private ThreadPoolExecutor newLane() {
        String name = threadNamePrefix + laneSeq.getAndIncrement();
        ThreadPoolExecutor lane = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, name);
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        lane.prestartCoreThread();
        return lane;
    }

    /**
     * 当前已创建的 lane 数，即出现过的账户数。
     */
    int laneCount() {
        return lanes.size();
    }

    @Override
    public void close() {
        closed = true;
        lanes.values().forEach(ThreadPoolExecutor::shutdown);
    }
}
