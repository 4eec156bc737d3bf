package xyz.firestige.redis.gateway.exception;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.Locale;

/**
 * 将 Spring Data Redis 抛出的 {@link DataAccessException} 转换为网关异常
 * <p>
 * 分类依据：
 * <ul>
 *   <li>异常类型：连接失败 → NETWORK_ERROR，命令超时 → TIMEOUT_ERROR</li>
 *   <li>Redis 错误前缀（取最内层 cause 的 message）：WRONGTYPE / not an integer → TYPE_MISMATCH，
 *       index out of range → RANGE_ERROR，no such key → KEY_NOT_FOUND，
 *       由调用方参数引起的错误（非法游标、数值溢出、超出字符串上限）→ VALIDATION_ERROR</li>
 *   <li>其余 → UPSTREAM_ERROR</li>
 * </ul>
 */
public final class RedisErrorTranslator {

    private RedisErrorTranslator() {
    }

    public static RedisCommandException translate(String command, DataAccessException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String redisMessage = root.getMessage() != null ? root.getMessage() : ex.getMessage();

        if (ex instanceof RedisConnectionFailureException) {
            return new RedisCommandException(command, "REDIS_UNREACHABLE",
                    "Redis 连接失败: " + redisMessage, ErrorType.NETWORK_ERROR, ex);
        }
        if (ex instanceof QueryTimeoutException) {
            return new RedisCommandException(command, "REDIS_TIMEOUT",
                    "Redis 命令超时: " + redisMessage, ErrorType.TIMEOUT_ERROR, ex);
        }

        String normalized = redisMessage == null ? "" : redisMessage.toLowerCase(Locale.ROOT);
        if (normalized.contains("wrongtype")) {
            return new RedisCommandException(command, "WRONGTYPE", redisMessage, ErrorType.TYPE_MISMATCH, ex);
        }
        if (normalized.contains("not an integer") || normalized.contains("not a valid float")) {
            return new RedisCommandException(command, "NOT_AN_INTEGER", redisMessage, ErrorType.TYPE_MISMATCH, ex);
        }
        if (normalized.contains("index out of range")) {
            return new RedisCommandException(command, "INDEX_OUT_OF_RANGE", redisMessage, ErrorType.RANGE_ERROR, ex);
        }
        if (normalized.contains("no such key")) {
            return new RedisCommandException(command, "NO_SUCH_KEY", redisMessage, ErrorType.KEY_NOT_FOUND, ex);
        }
        if (normalized.contains("invalid cursor")) {
            return new RedisCommandException(command, "INVALID_CURSOR", redisMessage, ErrorType.VALIDATION_ERROR, ex);
        }
        if (normalized.contains("would overflow")) {
            return new RedisCommandException(command, "NUMERIC_OVERFLOW", redisMessage, ErrorType.VALIDATION_ERROR, ex);
        }
        if (normalized.contains("exceeds maximum allowed size")) {
            return new RedisCommandException(command, "VALUE_TOO_LARGE", redisMessage, ErrorType.VALIDATION_ERROR, ex);
        }
        return new RedisCommandException(command, "REDIS_ERROR", redisMessage, ErrorType.UPSTREAM_ERROR, ex);
    }
}
