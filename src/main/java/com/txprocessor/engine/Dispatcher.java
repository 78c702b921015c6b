package com.txprocessor.engine;

import com.txprocessor.model.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * 交易分发器
 * 单线程顺序消费交易流，按 clientId 路由到各自的 AccountActor (首次出现时创建)。
 * 投递是同步入队，所以同一账户的顺序与输入顺序一致。
 * <p>
 * 路由表只由分发线程写入，分发结束后才交给汇总方读取。
 */
@Slf4j
public class Dispatcher {

    private final IntFunction<AccountActor> actorFactory;

    // Key = clientId, 保持首次出现顺序
    private final Map<Integer, AccountActor> routingTable = new LinkedHashMap<>();
    private long dispatchedCount;

    public Dispatcher(IntFunction<AccountActor> actorFactory) {
        this.actorFactory = actorFactory;
    }

    /**
     * 分发全部交易并关闭所有邮箱
     *
     * @return 只读路由表
     */
    public Map<Integer, AccountActor> dispatch(Iterable<Transaction> transactions) {
        log.info(">>> [分发] 开始分发交易...");
        for (Transaction tx : transactions) {
            route(tx);
        }
        routingTable.values().forEach(AccountActor::close);
        log.info("<<< [分发] 完成, 交易数: {}, 账户数: {}", dispatchedCount, routingTable.size());
        return Collections.unmodifiableMap(routingTable);
    }

    private void route(Transaction tx) {
        AccountActor actor = routingTable.get(tx.getClientId());
        if (actor == null) {
            actor = actorFactory.apply(tx.getClientId());
            routingTable.put(tx.getClientId(), actor);
            log.debug("   -> [分发] 新建账户 Actor: Client={}", tx.getClientId());
        }
        actor.tell(tx);
        dispatchedCount++;
    }
}
