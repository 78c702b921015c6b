package com.txprocessor.model;

import com.txprocessor.common.TxEnums.ApplyError;
import com.txprocessor.common.TxEnums.DisputeStatus;
import lombok.AccessLevel;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 客户资金账户 (状态机)
 * 只能由所属的 AccountActor 修改，非线程安全。
 * 不变量: available >= 0, held >= 0, total = available + held, 冻结后不可解冻
 */
@Getter
public class Account {

    private final int clientId;
    private final DisputePolicy disputePolicy;

    private BigDecimal available = BigDecimal.ZERO; // 可用资金
    private BigDecimal held = BigDecimal.ZERO;      // 争议冻结资金
    private boolean locked;                         // 拒付后永久冻结

    // 流水登记表: Key = txId, 只增不删
    @Getter(AccessLevel.NONE)
    private final Map<Long, LedgerEntry> ledger = new HashMap<>();

    public Account(int clientId) {
        this(clientId, DisputePolicy.DEPOSITS_ONLY);
    }

    public Account(int clientId, DisputePolicy disputePolicy) {
        this.clientId = clientId;
        this.disputePolicy = disputePolicy;
    }

    public BigDecimal getTotal() {
        return available.add(held);
    }

    public Optional<LedgerEntry> findEntry(long txId) {
        return Optional.ofNullable(ledger.get(txId));
    }

    /**
     * 执行一笔交易
     *
     * @return 空表示已入账; 否则为拒绝原因，账户状态不变
     */
    public Optional<ApplyError> apply(Transaction tx) {
        if (locked) {
            return Optional.of(ApplyError.ACCOUNT_LOCKED);
        }
        return Optional.ofNullable(switch (tx.getKind()) {
            case DEPOSIT -> deposit(tx);
            case WITHDRAWAL -> withdraw(tx);
            case DISPUTE -> dispute(tx.getTxId());
            case RESOLVE -> resolve(tx.getTxId());
            case CHARGEBACK -> chargeback(tx.getTxId());
        });
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, getTotal(), locked);
    }

    private ApplyError deposit(Transaction tx) {
        if (ledger.containsKey(tx.getTxId())) {
            return ApplyError.DUPLICATE_TX_ID;
        }
        available = available.add(tx.getAmount());
        ledger.put(tx.getTxId(), LedgerEntry.of(tx));
        return null;
    }

    private ApplyError withdraw(Transaction tx) {
        if (ledger.containsKey(tx.getTxId())) {
            return ApplyError.DUPLICATE_TX_ID;
        }
        if (available.compareTo(tx.getAmount()) < 0) {
            return ApplyError.INSUFFICIENT_FUNDS;
        }
        available = available.subtract(tx.getAmount());
        ledger.put(tx.getTxId(), LedgerEntry.of(tx));
        return null;
    }

    private ApplyError dispute(long txId) {
        LedgerEntry entry = ledger.get(txId);
        if (entry == null) {
            return ApplyError.UNKNOWN_TX;
        }
        if (entry.getStatus() != DisputeStatus.NORMAL || !disputePolicy.isDisputable(entry.getOrigin())) {
            return ApplyError.INVALID_DISPUTE_STATE;
        }
        // 已被取走的资金无法冻结
        if (available.compareTo(entry.getAmount()) < 0) {
            return ApplyError.INSUFFICIENT_FUNDS;
        }
        available = available.subtract(entry.getAmount());
        held = held.add(entry.getAmount());
        entry.transitionTo(DisputeStatus.DISPUTED);
        return null;
    }

    private ApplyError resolve(long txId) {
        LedgerEntry entry = ledger.get(txId);
        if (entry == null) {
            return ApplyError.UNKNOWN_TX;
        }
        if (entry.getStatus() != DisputeStatus.DISPUTED) {
            return ApplyError.INVALID_DISPUTE_STATE;
        }
        held = held.subtract(entry.getAmount());
        available = available.add(entry.getAmount());
        entry.transitionTo(DisputeStatus.RESOLVED);
        return null;
    }

    private ApplyError chargeback(long txId) {
        LedgerEntry entry = ledger.get(txId);
        if (entry == null) {
            return ApplyError.UNKNOWN_TX;
        }
        if (entry.getStatus() != DisputeStatus.DISPUTED) {
            return ApplyError.INVALID_DISPUTE_STATE;
        }
        held = held.subtract(entry.getAmount());
        entry.transitionTo(DisputeStatus.CHARGED_BACK);
        locked = true;
        return null;
    }
}
