package com.txprocessor.engine;

import com.txprocessor.config.EngineConfig;
import com.txprocessor.model.Account;
import com.txprocessor.model.AccountSnapshot;
import com.txprocessor.model.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 交易引擎
 * 分发任务与所有 AccountActor 共用同一个线程池；分发结束后由汇总方等待所有 Actor 完成。
 */
@Slf4j
public class TransactionEngine {

    private final EngineConfig config;
    private final ActorScheduler scheduler;
    private final RejectionListener rejectionListener;
    private final AccountCollector collector = new AccountCollector();

    public TransactionEngine(EngineConfig config, ActorScheduler scheduler) {
        this(config, scheduler, new LoggingRejectionListener());
    }

    public TransactionEngine(EngineConfig config, ActorScheduler scheduler, RejectionListener rejectionListener) {
        this.config = config;
        this.scheduler = scheduler;
        this.rejectionListener = rejectionListener;
    }

    /**
     * 异步处理整条交易流
     *
     * @return 按客户首次出现顺序排列的账户终态; 输入读取失败时异常完成
     */
    public CompletableFuture<Map<Integer, AccountSnapshot>> process(Iterable<Transaction> transactions) {
        log.info(">>> 交易引擎启动, threads={}, throughput={}, policy={}",
                scheduler.getWorkerThreads(), config.getActorThroughput(), config.getDisputePolicy());

        Dispatcher dispatcher = new Dispatcher(this::newActor);
        return CompletableFuture
                .supplyAsync(() -> dispatcher.dispatch(transactions), scheduler)
                .thenCompose(collector::collect);
    }

    /**
     * 同步版本，阻塞到全部账户结束
     */
    public Map<Integer, AccountSnapshot> run(Iterable<Transaction> transactions) {
        try {
            return process(transactions).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new EngineException("交易处理失败", e.getCause());
        }
    }

    private AccountActor newActor(int clientId) {
        return new AccountActor(
                new Account(clientId, config.getDisputePolicy()),
                scheduler,
                rejectionListener,
                config.getActorThroughput(),
                config.getProcessingDelay());
    }
}
