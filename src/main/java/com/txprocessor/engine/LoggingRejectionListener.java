package com.txprocessor.engine;

import com.txprocessor.common.TxEnums.ApplyError;
import com.txprocessor.model.Transaction;
import lombok.extern.slf4j.Slf4j;

/**
 * 默认实现: 拒单写 WARN 日志 (logback 异步输出)
 */
@Slf4j
public class LoggingRejectionListener implements RejectionListener {

    @Override
    public void onRejected(Transaction tx, ApplyError reason) {
        log.warn("      [拒单] Client={}, Tx={}, Type={}, 原因={}",
                tx.getClientId(), tx.getTxId(), tx.getKind(), reason);
    }
}
