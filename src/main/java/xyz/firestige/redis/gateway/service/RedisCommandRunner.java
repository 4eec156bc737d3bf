package xyz.firestige.redis.gateway.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import xyz.firestige.redis.gateway.exception.RedisCommandException;
import xyz.firestige.redis.gateway.exception.RedisErrorTranslator;
import xyz.firestige.redis.gateway.metrics.CommandMetricsRecorder;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Redis 命令执行模板
 * <p>
 * 所有命令服务都经由这里调用 Redis：
 * 1. 计时并记录指标
 * 2. 将 DataAccessException 转换为 {@link RedisCommandException}
 * 3. 失败日志
 * <p>
 * 不做任何重试：INCR 等命令不是幂等的。
 *
 * @since 1.0
 */
public class RedisCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandRunner.class);

    static final String OUTCOME_SUCCESS = "success";

    private final CommandMetricsRecorder metricsRecorder;

    public RedisCommandRunner(CommandMetricsRecorder metricsRecorder) {
        this.metricsRecorder = Objects.requireNonNull(metricsRecorder, "metricsRecorder cannot be null");
    }

    public <T> T execute(String command, Object key, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            T result = action.get();
            metricsRecorder.record(command, OUTCOME_SUCCESS, elapsedSince(start));
            return result;
        } catch (DataAccessException ex) {
            RedisCommandException translated = RedisErrorTranslator.translate(command, ex);
            translated.addContext("key", key);
            metricsRecorder.record(command, translated.getErrorType().name(), elapsedSince(start));
            log.warn("[RedisCommand] {} 执行失败: key={}, type={}, error={}",
                    command, key, translated.getErrorType(), translated.getMessage());
            throw translated;
        }
    }

    public void run(String command, Object key, Runnable action) {
        execute(command, key, () -> {
            action.run();
            return null;
        });
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
