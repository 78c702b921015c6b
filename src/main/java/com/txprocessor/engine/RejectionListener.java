package com.txprocessor.engine;

import com.txprocessor.common.TxEnums.ApplyError;
import com.txprocessor.model.Transaction;

/**
 * 交易被拒绝时的通知回调
 * 在 Actor 的工作线程上同步调用，实现方不能阻塞。
 */
@FunctionalInterface
public interface RejectionListener {

    void onRejected(Transaction tx, ApplyError reason);
}
