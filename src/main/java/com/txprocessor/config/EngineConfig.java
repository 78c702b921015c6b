package com.txprocessor.config;

import com.txprocessor.common.TxEnums.ReportFormat;
import com.txprocessor.model.DisputePolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 运行参数
 * 启动时从环境变量读取一次，未设置时取默认值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineConfig {

    public static final String WORKER_THREADS = "TX_WORKER_THREADS";
    public static final String ACTOR_THROUGHPUT = "TX_ACTOR_THROUGHPUT";
    public static final String PROCESSING_DELAY_MS = "TX_PROCESSING_DELAY_MS";
    public static final String DISPUTE_POLICY = "TX_DISPUTE_POLICY";
    public static final String REPORT_FORMAT = "TX_REPORT_FORMAT";
    public static final String REPORT_ENABLED = "TX_REPORT_ENABLED";

    @Builder.Default
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    @Builder.Default
    private int actorThroughput = 64;           // 单次调度最多处理的消息数

    @Builder.Default
    private Duration processingDelay = Duration.ZERO; // 压测用, 每笔交易人为延迟

    @Builder.Default
    private DisputePolicy disputePolicy = DisputePolicy.DEPOSITS_ONLY;

    @Builder.Default
    private ReportFormat reportFormat = ReportFormat.CSV;

    @Builder.Default
    private boolean reportEnabled = true;

    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * 非法取值直接抛 IllegalArgumentException
     */
    public static EngineConfig fromEnvironment(Map<String, String> env) {
        EngineConfig defaults = EngineConfig.builder().build();
        return EngineConfig.builder()
                .workerThreads(positiveInt(env, WORKER_THREADS, defaults.getWorkerThreads()))
                .actorThroughput(positiveInt(env, ACTOR_THROUGHPUT, defaults.getActorThroughput()))
                .processingDelay(Duration.ofMillis(nonNegativeLong(env, PROCESSING_DELAY_MS, 0)))
                .disputePolicy(env.containsKey(DISPUTE_POLICY)
                        ? DisputePolicy.valueOf(env.get(DISPUTE_POLICY).trim().toUpperCase(Locale.ROOT))
                        : defaults.getDisputePolicy())
                .reportFormat(env.containsKey(REPORT_FORMAT)
                        ? ReportFormat.fromValue(env.get(REPORT_FORMAT))
                        : defaults.getReportFormat())
                .reportEnabled(bool(env, REPORT_ENABLED, defaults.isReportEnabled()))
                .build();
    }

    private static int positiveInt(Map<String, String> env, String key, int defaultValue) {
        String raw = env.get(key);
        if (raw == null) {
            return defaultValue;
        }
        int value = parse(key, raw, Integer::parseInt);
        if (value < 1) {
            throw new IllegalArgumentException(key + " must be >= 1, got " + raw);
        }
        return value;
    }

    private static long nonNegativeLong(Map<String, String> env, String key, long defaultValue) {
        String raw = env.get(key);
        if (raw == null) {
            return defaultValue;
        }
        long value = parse(key, raw, Long::parseLong);
        if (value < 0) {
            throw new IllegalArgumentException(key + " must be >= 0, got " + raw);
        }
        return value;
    }

    private static boolean bool(Map<String, String> env, String key, boolean defaultValue) {
        String raw = env.get(key);
        if (raw == null) {
            return defaultValue;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (!value.equals("true") && !value.equals("false")) {
            throw new IllegalArgumentException(key + " must be true or false, got " + raw);
        }
        return Boolean.parseBoolean(value);
    }

    private static <T> T parse(String key, String raw, Function<String, T> parser) {
        try {
            return parser.apply(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + raw, e);
        }
    }
}
