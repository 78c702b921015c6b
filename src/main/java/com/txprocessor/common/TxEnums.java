package com.txprocessor.common;

import java.util.Locale;

/**
 * 全局枚举定义
 */
public class TxEnums {

    /**
     * 交易类型
     * 只有存款、取款会生成新的流水号，争议类交易引用已有流水号
     */
    public enum TransactionKind {
        DEPOSIT("deposit"),         // 存款
        WITHDRAWAL("withdrawal"),   // 取款
        DISPUTE("dispute"),         // 发起争议
        RESOLVE("resolve"),         // 争议解除
        CHARGEBACK("chargeback");   // 拒付 (冻结账户)

        private final String code;

        TransactionKind(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }

        /**
         * 是否必须携带金额
         */
        public boolean requiresAmount() {
            return this == DEPOSIT || this == WITHDRAWAL;
        }

        /**
         * 按输入文件中的小写编码查找，未知编码返回 null
         */
        public static TransactionKind fromCode(String code) {
            for (TransactionKind kind : values()) {
                if (kind.code.equals(code)) {
                    return kind;
                }
            }
            return null;
        }
    }

    /**
     * 流水争议状态
     * 只允许 NORMAL -> DISPUTED -> RESOLVED / CHARGED_BACK
     */
    public enum DisputeStatus {
        NORMAL,         // 正常
        DISPUTED,       // 争议中 (资金冻结)
        RESOLVED,       // 争议已解除
        CHARGED_BACK;   // 已拒付

        public boolean canTransitionTo(DisputeStatus next) {
            return switch (this) {
                case NORMAL -> next == DISPUTED;
                case DISPUTED -> next == RESOLVED || next == CHARGED_BACK;
                case RESOLVED, CHARGED_BACK -> false;
            };
        }
    }

    /**
     * 单笔交易被拒绝的原因 (可预期、不致命)
     */
    public enum ApplyError {
        DUPLICATE_TX_ID,
        INSUFFICIENT_FUNDS,
        UNKNOWN_TX,
        INVALID_DISPUTE_STATE,
        ACCOUNT_LOCKED
    }

    /**
     * 对账结果输出格式
     */
    public enum ReportFormat {
        CSV,
        JSON;

        public static ReportFormat fromValue(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
