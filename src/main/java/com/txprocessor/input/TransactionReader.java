package com.txprocessor.input;

import com.txprocessor.model.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 交易输入文件读取器
 * 首行必须是 type,client,tx,amount；按文件顺序产出交易，只能遍历一次。
 * 解析失败的行记 WARN 日志后跳过，不进入引擎。
 */
@Slf4j
public class TransactionReader implements Iterable<Transaction>, Closeable {

    public static final List<String> EXPECTED_HEADER = List.of(
            TransactionParser.COL_TYPE,
            TransactionParser.COL_CLIENT,
            TransactionParser.COL_TX,
            TransactionParser.COL_AMOUNT);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .build();

    private final CSVParser parser;
    private final TransactionParser transactionParser = new TransactionParser();
    private boolean consumed;
    private long skippedCount;

    public TransactionReader(Reader reader) throws IOException {
        try {
            this.parser = new CSVParser(reader, FORMAT);
        } catch (IllegalArgumentException e) {
            reader.close();
            throw new InputFormatException("Invalid header line, expected " + String.join(",", EXPECTED_HEADER), e);
        }
        if (!EXPECTED_HEADER.equals(parser.getHeaderNames())) {
            parser.close();
            throw new InputFormatException("Invalid header line " + parser.getHeaderNames()
                    + ", expected " + String.join(",", EXPECTED_HEADER));
        }
    }

    public static TransactionReader open(Path path) throws IOException {
        log.info(">>> 打开交易文件: {}", path.toAbsolutePath());
        return new TransactionReader(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public long getSkippedCount() {
        return skippedCount;
    }

    /**
     * 读取过程中的 I/O 错误以 UncheckedIOException 抛出
     */
    @Override
    public synchronized Iterator<Transaction> iterator() {
        if (consumed) {
            throw new IllegalStateException("TransactionReader can only be iterated once");
        }
        consumed = true;
        Iterator<CSVRecord> records = parser.iterator();

        return new Iterator<>() {
            private Transaction next;

            @Override
            public boolean hasNext() {
                while (next == null && records.hasNext()) {
                    next = parseOrSkip(records.next());
                }
                return next != null;
            }

            @Override
            public Transaction next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Transaction tx = next;
                next = null;
                return tx;
            }
        };
    }

    private Transaction parseOrSkip(CSVRecord r) {
        try {
            return transactionParser.parse(r);
        } catch (TransactionParseException e) {
            skippedCount++;
            log.warn("      [跳过] 第 {} 条记录无法解析: {}, 原因={}", r.getRecordNumber(), r.toList(), e.getMessage());
            return null;
        }
    }

    @Override
    public void close() throws IOException {
        if (skippedCount > 0) {
            log.warn("<<< 共跳过 {} 条无法解析的记录", skippedCount);
        }
        parser.close();
    }
}
