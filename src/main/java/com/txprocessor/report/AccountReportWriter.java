package com.txprocessor.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.txprocessor.common.TxEnums.ReportFormat;
import com.txprocessor.model.AccountSnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 账户终态输出
 * CSV: client,available,held,total,locked，金额保留 4 位小数
 * 不关闭传入的 Writer (通常是标准输出)。
 */
@Slf4j
public class AccountReportWriter {

    public static final int AMOUNT_SCALE = 4;

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader("client", "available", "held", "total", "locked")
            .setRecordSeparator('\n')
            .build();

    @Data @AllArgsConstructor
    static class AccountRow {
        int client;
        BigDecimal available;
        BigDecimal held;
        BigDecimal total;
        boolean locked;
    }

    @Data @AllArgsConstructor
    static class AccountReport {
        Instant generatedAt;
        List<AccountRow> accounts;
    }

    private final ReportFormat format;
    private final ObjectMapper mapper;

    public AccountReportWriter(ReportFormat format) {
        this.format = format;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        this.mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void write(Collection<AccountSnapshot> accounts, Writer out) throws IOException {
        List<AccountRow> rows = accounts.stream()
                .map(this::toRow)
                .collect(Collectors.toList());

        switch (format) {
            case CSV -> writeCsv(rows, out);
            case JSON -> mapper.writeValue(out, new AccountReport(Instant.now(), rows));
        }
        out.flush();
        log.info("   -> [输出] 账户报表已生成, 格式={}, 账户数={}", format, rows.size());
    }

    private void writeCsv(List<AccountRow> rows, Writer out) throws IOException {
        CSVPrinter printer = new CSVPrinter(out, CSV_FORMAT);
        for (AccountRow row : rows) {
            printer.printRecord(
                    row.getClient(),
                    row.getAvailable().toPlainString(),
                    row.getHeld().toPlainString(),
                    row.getTotal().toPlainString(),
                    row.isLocked());
        }
        printer.flush();
    }

    private AccountRow toRow(AccountSnapshot s) {
        return new AccountRow(
                s.getClientId(),
                scale(s.getAvailable()),
                scale(s.getHeld()),
                scale(s.getTotal()),
                s.isLocked());
    }

    private static BigDecimal scale(BigDecimal amount) {
        return amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }
}
