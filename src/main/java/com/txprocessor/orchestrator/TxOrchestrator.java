package com.txprocessor.orchestrator;

import com.txprocessor.config.EngineConfig;
import com.txprocessor.engine.ActorScheduler;
import com.txprocessor.engine.TransactionEngine;
import com.txprocessor.input.TransactionReader;
import com.txprocessor.model.AccountSnapshot;
import com.txprocessor.report.AccountReportWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * 编排器: 读文件 -> 引擎处理 -> 输出报表
 * 返回进程退出码，所有致命错误在这里收口。
 */
@Slf4j
public class TxOrchestrator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    static final String USAGE = "Usage: tx-processor <transactions.csv>\n"
            + "Example of csv file:\n"
            + "type,client,tx,amount\n"
            + "deposit,1,1,1.0\n"
            + "withdrawal,1,2,0.5\n"
            + "deposit,2,3,1.0\n"
            + "dispute,2,3,\n"
            + "resolve,2,3,\n"
            + "dispute,2,3,\n"
            + "chargeback,2,3,";

    private final EngineConfig config;
    private final Writer out;

    public TxOrchestrator(EngineConfig config, Writer out) {
        this.config = config;
        this.out = out;
    }

    public int run(String[] args) {
        if (args.length != 1) {
            log.error("参数错误, 需要且只需要一个文件路径.\n{}", USAGE);
            return EXIT_FAILURE;
        }
        Path path = Paths.get(args[0]);

        try (ActorScheduler scheduler = new ActorScheduler(config.getWorkerThreads());
             TransactionReader reader = TransactionReader.open(path)) {

            long start = System.nanoTime();
            Map<Integer, AccountSnapshot> accounts = new TransactionEngine(config, scheduler).run(reader);
            log.info("<<< 处理完成, 账户数: {}, 跳过记录: {}, 耗时: {} ms",
                    accounts.size(), reader.getSkippedCount(), (System.nanoTime() - start) / 1_000_000);

            if (config.isReportEnabled()) {
                new AccountReportWriter(config.getReportFormat()).write(accounts.values(), out);
            }
            return EXIT_OK;

        } catch (IOException e) {
            log.error("XX 无法读取交易文件: " + path + "\n" + USAGE, e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("XX 交易处理失败: " + path, e);
            return EXIT_FAILURE;
        }
    }
}
