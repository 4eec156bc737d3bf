package xyz.firestige.redis.gateway.web;

import xyz.firestige.redis.gateway.exception.CommandValidationException;

/**
 * 查询参数校验
 */
final class Arguments {

    private Arguments() {
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new CommandValidationException(field, field + " 不能为空");
        }
        return value;
    }
}
