package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.Map;

/**
 * 批量写入请求
 */
public record StringSetMultipleRequest(
        @NotEmpty(message = "mapping 不能为空") Map<String, Object> mapping,
        @Positive(message = "expire 必须为正数") Long expire,
        Boolean nx) {

    public boolean onlyIfAbsent() {
        return Boolean.TRUE.equals(nx);
    }
}
