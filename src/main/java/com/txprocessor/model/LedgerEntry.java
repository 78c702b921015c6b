package com.txprocessor.model;

import com.txprocessor.common.TxEnums.DisputeStatus;
import com.txprocessor.common.TxEnums.TransactionKind;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * 账户流水登记 (仅存款/取款)
 * 争议、解除、拒付都要回查这里
 */
@Getter
@ToString
@AllArgsConstructor
public class LedgerEntry {
    private final BigDecimal amount;
    private final TransactionKind origin; // DEPOSIT 或 WITHDRAWAL
    private DisputeStatus status;

    public static LedgerEntry of(Transaction tx) {
        return new LedgerEntry(tx.getAmount(), tx.getKind(), DisputeStatus.NORMAL);
    }

    public void transitionTo(DisputeStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal dispute transition " + status + " -> " + next);
        }
        this.status = next;
    }
}
