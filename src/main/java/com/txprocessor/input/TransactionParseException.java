package com.txprocessor.input;

/**
 * 单行记录无法解析为交易
 */
public class TransactionParseException extends Exception {
    public TransactionParseException(String message) {
        super(message);
    }

    public TransactionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
