package com.txprocessor.engine;

import com.txprocessor.common.TxEnums.ApplyError;
import com.txprocessor.model.Account;
import com.txprocessor.model.AccountSnapshot;
import com.txprocessor.model.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 账户 Actor
 * 独占一个 Account 和一个 FIFO 邮箱，同一时刻最多只有一个线程在处理该邮箱，
 * 所以同一账户的交易严格按入队顺序串行执行。
 * <p>
 * 每次调度最多处理 throughput 条消息后让出线程；邮箱关闭且清空后以终态快照完成 termination。
 */
@Slf4j
public class AccountActor implements Runnable {

    private final Account account;
    private final Executor executor;
    private final RejectionListener rejectionListener;
    private final int throughput;
    private final Duration processingDelay;

    private final Queue<Transaction> mailbox;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final CompletableFuture<AccountSnapshot> termination = new CompletableFuture<>();
    private volatile boolean closed;

    // 只在持有调度权的线程上读写
    private long appliedCount;
    private long rejectedCount;

    public AccountActor(Account account, Executor executor, RejectionListener rejectionListener,
                        int throughput, Duration processingDelay) {
        this(account, executor, rejectionListener, throughput, processingDelay, new ConcurrentLinkedQueue<>());
    }

    AccountActor(Account account, Executor executor, RejectionListener rejectionListener,
                 int throughput, Duration processingDelay, Queue<Transaction> mailbox) {
        if (throughput < 1) {
            throw new IllegalArgumentException("throughput must be >= 1, got " + throughput);
        }
        this.account = account;
        this.executor = executor;
        this.rejectionListener = rejectionListener;
        this.throughput = throughput;
        this.processingDelay = processingDelay;
        this.mailbox = mailbox;
    }

    public int getClientId() {
        return account.getClientId();
    }

    /**
     * 投递一笔交易，不阻塞调用方
     */
    public void tell(Transaction tx) {
        if (closed) {
            throw new IllegalStateException("Mailbox of client " + account.getClientId() + " is closed");
        }
        mailbox.offer(tx);
        trySchedule();
    }

    /**
     * 关闭邮箱，已投递的交易仍会全部处理
     */
    public void close() {
        closed = true;
        trySchedule();
    }

    public CompletableFuture<AccountSnapshot> termination() {
        return termination;
    }

    @Override
    public void run() {
        try {
            int processed = 0;
            Transaction tx;
            while (processed < throughput && (tx = mailbox.poll()) != null) {
                handle(tx);
                processed++;
            }
        } catch (RuntimeException e) {
            log.error("XX [Actor] 账户处理异常, Client=" + account.getClientId(), e);
            termination.completeExceptionally(e);
            return;
        }

        // 仍持有调度权: 先读 closed 再看邮箱, close 之前的投递此时都已可见
        if (closed && mailbox.isEmpty()) {
            if (termination.complete(account.snapshot())) {
                log.debug("<< [Actor] Client={} 结束, applied={}, rejected={}",
                        account.getClientId(), appliedCount, rejectedCount);
            }
            return;
        }

        scheduled.set(false);
        // 释放后再检查一次, 防止与并发的 tell/close 互相错过
        if (!mailbox.isEmpty() || closed) {
            trySchedule();
        }
    }

    private void handle(Transaction tx) {
        if (!processingDelay.isZero()) {
            pause();
        }
        Optional<ApplyError> error = account.apply(tx);
        if (error.isPresent()) {
            rejectedCount++;
            rejectionListener.onRejected(tx, error.get());
        } else {
            appliedCount++;
        }
    }

    private void pause() {
        try {
            Thread.sleep(processingDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void trySchedule() {
        if (!termination.isDone() && scheduled.compareAndSet(false, true)) {
            executor.execute(this);
        }
    }
}
