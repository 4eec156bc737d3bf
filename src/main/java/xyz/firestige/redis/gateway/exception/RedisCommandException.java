package xyz.firestige.redis.gateway.exception;

/**
 * Redis 命令执行异常
 * 由 {@link RedisErrorTranslator} 从 Spring Data 的 DataAccessException 转换而来，
 * 网关不会对此类异常做任何重试
 */
public class RedisCommandException extends GatewayException {

    private final String command;

    public RedisCommandException(String command, String errorCode, String message,
                                 ErrorType errorType, Throwable cause) {
        super(errorCode, message, errorType, cause);
        this.command = command;
        addContext("command", command);
    }

    public String getCommand() {
        return command;
    }
}
