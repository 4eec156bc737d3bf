package xyz.firestige.redis.gateway.web;

import java.util.Map;

/**
 * 错误响应体
 *
 * @param code    错误码，例如 WRONGTYPE、INVALID_ARGUMENT
 * @param type    {@link xyz.firestige.redis.gateway.exception.ErrorType} 名称
 * @param message 错误描述，参数错误时包含字段名
 * @param details 上下文（command、key、field 等）
 */
public record ErrorResponse(String code, String type, String message, Map<String, Object> details) {
}
