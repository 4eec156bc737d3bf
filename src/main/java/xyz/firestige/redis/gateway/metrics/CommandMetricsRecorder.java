package xyz.firestige.redis.gateway.metrics;

import java.time.Duration;

/**
 * 命令指标记录器接口
 * <p>
 * 允许实现自定义的指标收集逻辑，例如集成 Micrometer、Prometheus 或其他监控系统
 *
 * @since 1.0
 */
@FunctionalInterface
public interface CommandMetricsRecorder {

    /**
     * 记录一次 Redis 命令执行
     *
     * @param command 命令名（如 HSET、BLPOP）
     * @param outcome 结果分类：success 或 ErrorType 名称
     * @param elapsed 执行耗时
     */
    void record(String command, String outcome, Duration elapsed);

    /**
     * 空操作实现（默认）
     *
     * @return 不执行任何操作的记录器
     */
    static CommandMetricsRecorder noop() {
        return (command, outcome, elapsed) -> {};
    }
}
