package xyz.firestige.redis.gateway.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * 基于 Micrometer 的命令指标记录器
 * <p>
 * 记录以下指标：
 * - redis_gateway_command_duration{command, outcome}: 每个命令的执行耗时分布与次数
 *
 * @since 1.0
 */
public class MicrometerCommandMetricsRecorder implements CommandMetricsRecorder {

    static final String METRIC_NAME = "redis_gateway_command_duration";

    private final MeterRegistry registry;

    public MicrometerCommandMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void record(String command, String outcome, Duration elapsed) {
        // Timer 按 name + tags 在 registry 中缓存，重复 register 返回同一实例
        Timer.builder(METRIC_NAME)
                .description("Redis gateway command duration")
                .tag("command", command)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }
}
