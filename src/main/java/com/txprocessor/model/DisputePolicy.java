package com.txprocessor.model;

import com.txprocessor.common.TxEnums.TransactionKind;

/**
 * 哪些流水允许发起争议
 */
public enum DisputePolicy {
    DEPOSITS_ONLY,
    DEPOSITS_AND_WITHDRAWALS;

    public boolean isDisputable(TransactionKind origin) {
        return switch (this) {
            case DEPOSITS_ONLY -> origin == TransactionKind.DEPOSIT;
            case DEPOSITS_AND_WITHDRAWALS -> origin.requiresAmount();
        };
    }
}
