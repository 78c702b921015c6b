package com.txprocessor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 账户终态快照，Actor 结束后交给汇总方
 */
@Value
@Builder
@AllArgsConstructor
public class AccountSnapshot {
    int clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;
}
