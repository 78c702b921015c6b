package com.txprocessor.model;

import com.txprocessor.common.TxEnums.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 交易指令实体 (只读)
 * 对应输入文件中的一行记录。存款/取款必须带非负金额，争议类交易不带金额。
 */
@Value
public class Transaction {
    TransactionKind kind;   // 交易类型
    int clientId;           // 客户号 (0 ~ 65535)
    long txId;              // 流水号; 争议类交易为被引用的流水号
    BigDecimal amount;      // 金额, 仅存款/取款有值

    @Builder
    public Transaction(TransactionKind kind, int clientId, long txId, BigDecimal amount) {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required, tx=" + txId);
        }
        if (kind.requiresAmount()) {
            if (amount == null) {
                throw new IllegalArgumentException("amount is required for " + kind.getCode() + ", tx=" + txId);
            }
            if (amount.signum() < 0) {
                throw new IllegalArgumentException("amount must not be negative, tx=" + txId + ", amount=" + amount);
            }
        } else if (amount != null) {
            throw new IllegalArgumentException(kind.getCode() + " must not carry an amount, tx=" + txId);
        }
        this.kind = kind;
        this.clientId = clientId;
        this.txId = txId;
        this.amount = amount;
    }

    public static Transaction deposit(int clientId, long txId, BigDecimal amount) {
        return new Transaction(TransactionKind.DEPOSIT, clientId, txId, amount);
    }

    public static Transaction withdrawal(int clientId, long txId, BigDecimal amount) {
        return new Transaction(TransactionKind.WITHDRAWAL, clientId, txId, amount);
    }

    public static Transaction dispute(int clientId, long txId) {
        return new Transaction(TransactionKind.DISPUTE, clientId, txId, null);
    }

    public static Transaction resolve(int clientId, long txId) {
        return new Transaction(TransactionKind.RESOLVE, clientId, txId, null);
    }

    public static Transaction chargeback(int clientId, long txId) {
        return new Transaction(TransactionKind.CHARGEBACK, clientId, txId, null);
    }
}
