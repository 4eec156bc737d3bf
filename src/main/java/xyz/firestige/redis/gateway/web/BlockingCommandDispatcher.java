package xyz.firestige.redis.gateway.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.web.context.request.async.DeferredResult;
import xyz.firestige.redis.gateway.exception.ErrorType;
import xyz.firestige.redis.gateway.exception.GatewayException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 阻塞命令异步派发
 * <p>
 * 职责：
 * 1. 将阻塞命令提交到独立线程池，Servlet 线程立即返回 {@link DeferredResult}
 * 2. 请求异常结束（客户端断开、异步超时、容器错误）时以中断方式取消工作线程，释放 Redis 连接
 * 3. 线程池已满时返回 SERVICE_UNAVAILABLE
 *
 * @since 1.0
 */
public class BlockingCommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BlockingCommandDispatcher.class);

    /**
     * Servlet 规范：异步超时 ≤ 0 表示永不超时
     */
    static final long NO_TIMEOUT = -1L;

    private final AsyncTaskExecutor executor;
    private final Duration gracePeriod;

    public BlockingCommandDispatcher(AsyncTaskExecutor executor, Duration gracePeriod) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod cannot be null");
    }

    /**
     * @param command        命令名（日志用）
     * @param timeoutSeconds 命令超时秒数，0 表示无限等待
     * @param action         在工作线程上执行的阻塞调用
     */
    public <T> DeferredResult<T> dispatch(String command, long timeoutSeconds, Supplier<T> action) {
        DeferredResult<T> result = new DeferredResult<>(requestTimeoutMillis(timeoutSeconds));

        Future<?> future;
        try {
            future = executor.submit(() -> run(command, action, result));
        } catch (TaskRejectedException e) {
            log.warn("[BlockingDispatcher] {} 被拒绝，阻塞命令线程池已满", command);
            result.setErrorResult(new GatewayException("BLOCKING_POOL_EXHAUSTED",
                    "阻塞命令线程池已满，请稍后重试", ErrorType.SERVICE_UNAVAILABLE, e)
                    .addContext("command", command));
            return result;
        }

        result.onTimeout(() -> {
            log.warn("[BlockingDispatcher] {} 异步请求超时，取消等待", command);
            future.cancel(true);
            result.setErrorResult(new GatewayException("REQUEST_TIMEOUT",
                    command + " 未在请求超时内完成", ErrorType.TIMEOUT_ERROR)
                    .addContext("command", command));
        });
        result.onError(t -> {
            log.debug("[BlockingDispatcher] {} 请求异常结束，取消等待: {}", command, t.toString());
            future.cancel(true);
        });
        // 正常完成时 future 已结束，cancel 为空操作
        result.onCompletion(() -> future.cancel(true));
        return result;
    }

    private <T> void run(String command, Supplier<T> action, DeferredResult<T> result) {
        try {
            result.setResult(action.get());
        } catch (CancellationException e) {
            log.debug("[BlockingDispatcher] {} 已取消", command);
        } catch (RuntimeException e) {
            if (!result.setErrorResult(e)) {
                log.debug("[BlockingDispatcher] {} 请求已结束，忽略错误: {}", command, e.getMessage());
            }
        }
    }

    long requestTimeoutMillis(long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            return NO_TIMEOUT;
        }
        return TimeUnit.SECONDS.toMillis(timeoutSeconds) + gracePeriod.toMillis();
    }
}
