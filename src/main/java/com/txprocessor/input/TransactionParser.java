package com.txprocessor.input;

import com.txprocessor.common.TxEnums.TransactionKind;
import com.txprocessor.model.Transaction;
import org.apache.commons.csv.CSVRecord;

import java.math.BigDecimal;

/**
 * CSV 记录 -> 交易
 * 列: type,client,tx,amount；争议类交易可省略 amount 或留空，且忽略其取值。
 */
public class TransactionParser {

    public static final String COL_TYPE = "type";
    public static final String COL_CLIENT = "client";
    public static final String COL_TX = "tx";
    public static final String COL_AMOUNT = "amount";

    static final long MAX_CLIENT_ID = 0xFFFFL;
    static final long MAX_TX_ID = 0xFFFF_FFFFL;

    public Transaction parse(CSVRecord r) throws TransactionParseException {
        TransactionKind kind = TransactionKind.fromCode(required(r, COL_TYPE));
        if (kind == null) {
            throw new TransactionParseException("Unknown transaction type: " + r.get(COL_TYPE));
        }
        int clientId = (int) unsigned(required(r, COL_CLIENT), COL_CLIENT, MAX_CLIENT_ID);
        long txId = unsigned(required(r, COL_TX), COL_TX, MAX_TX_ID);

        BigDecimal amount = null;
        if (kind.requiresAmount()) {
            String raw = r.isSet(COL_AMOUNT) ? r.get(COL_AMOUNT) : "";
            if (raw.isEmpty()) {
                throw new TransactionParseException("Missing amount for " + kind.getCode());
            }
            amount = amount(raw);
        }

        return Transaction.builder()
                .kind(kind)
                .clientId(clientId)
                .txId(txId)
                .amount(amount)
                .build();
    }

    private String required(CSVRecord r, String column) throws TransactionParseException {
        if (!r.isSet(column) || r.get(column).isEmpty()) {
            throw new TransactionParseException("Missing column: " + column);
        }
        return r.get(column);
    }

    private long unsigned(String raw, String column, long max) throws TransactionParseException {
        try {
            long value = Long.parseLong(raw);
            if (value < 0 || value > max) {
                throw new TransactionParseException(column + " out of range: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new TransactionParseException(column + " is not an unsigned integer: " + raw, e);
        }
    }

    private BigDecimal amount(String raw) throws TransactionParseException {
        BigDecimal value;
        try {
            value = new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new TransactionParseException("amount is not a decimal: " + raw, e);
        }
        if (value.signum() < 0) {
            throw new TransactionParseException("amount must not be negative: " + raw);
        }
        return value;
    }
}
