package com.txprocessor.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 固定大小的工作线程池
 * 所有 AccountActor 与分发任务在其上协作调度，Actor 空闲时不占用线程。
 */
@Slf4j
public class ActorScheduler implements Executor, AutoCloseable {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final ExecutorService executor;
    private final int workerThreads;

    public ActorScheduler(int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
        this.workerThreads = workerThreads;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger threadCount = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, "tx-worker-" + threadCount.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        };
        this.executor = Executors.newFixedThreadPool(workerThreads, threadFactory);
        log.debug(">>> 工作线程池启动, threads={}", workerThreads);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(task);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("工作线程池未能在 {}s 内退出, 强制关闭", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
