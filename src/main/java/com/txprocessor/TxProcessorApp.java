package com.txprocessor;

import com.txprocessor.config.EngineConfig;
import com.txprocessor.orchestrator.TxOrchestrator;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * 应用程序启动入口
 * 报表写标准输出，日志写标准错误。
 */
@Slf4j
public class TxProcessorApp {
    public static void main(String[] args) {
        EngineConfig config;
        try {
            config = EngineConfig.fromEnvironment();
        } catch (IllegalArgumentException e) {
            log.error("XX 配置错误: {}", e.getMessage());
            System.exit(TxOrchestrator.EXIT_FAILURE);
            return;
        }

        Writer out = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        int exitCode = new TxOrchestrator(config, out).run(args);
        System.exit(exitCode);
    }
}
