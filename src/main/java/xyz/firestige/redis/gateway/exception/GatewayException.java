package xyz.firestige.redis.gateway.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 网关基础异常类
 * 所有网关相关异常的基类，携带错误码、错误类型和上下文信息
 */
public class GatewayException extends RuntimeException {

    /**
     * 错误码
     */
    private final String errorCode;

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    /**
     * 上下文信息（命令名、Key、字段名等）
     */
    private final Map<String, Object> context = new LinkedHashMap<>();

    public GatewayException(String message) {
        this(ErrorType.SYSTEM_ERROR.name(), message, ErrorType.SYSTEM_ERROR);
    }

    public GatewayException(String message, Throwable cause) {
        this(ErrorType.SYSTEM_ERROR.name(), message, ErrorType.SYSTEM_ERROR, cause);
    }

    public GatewayException(String errorCode, String message, ErrorType errorType) {
        super(message);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    public GatewayException(String errorCode, String message, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息
     */
    public GatewayException addContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
