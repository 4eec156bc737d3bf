package xyz.firestige.redis.gateway.exception;

/**
 * 错误类型枚举
 * 用于对网关错误分类，并决定返回给调用方的 HTTP 状态码
 */
public enum ErrorType {

    /**
     * 参数校验错误（缺失字段、格式错误、互斥标志同时设置）
     */
    VALIDATION_ERROR("校验错误", 400),

    /**
     * 索引越界
     */
    RANGE_ERROR("索引越界", 400),

    /**
     * Key 不存在（仅用于要求 Key 必须存在的命令，如 LSET）
     */
    KEY_NOT_FOUND("Key 不存在", 404),

    /**
     * 类型不匹配：对不兼容类型的 Key 执行命令，或值无法解析为整数
     */
    TYPE_MISMATCH("类型不匹配", 409),

    /**
     * 网络错误：Redis 不可达
     */
    NETWORK_ERROR("网络错误", 502),

    /**
     * Redis 返回的其他错误
     */
    UPSTREAM_ERROR("上游错误", 502),

    /**
     * 服务不可用：阻塞命令线程池已满
     */
    SERVICE_UNAVAILABLE("服务不可用", 503),

    /**
     * 超时错误：Redis 命令超时
     */
    TIMEOUT_ERROR("超时错误", 504),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", 500);

    private final String description;
    private final int httpStatus;

    ErrorType(String description, int httpStatus) {
        this.description = description;
        this.httpStatus = httpStatus;
    }

    public String getDescription() {
        return description;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * 是否属于调用方错误（4xx）
     */
    public boolean isClientError() {
        return httpStatus >= 400 && httpStatus < 500;
    }
}
