package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * LPOP / RPOP 请求，count 为空时弹出单个元素
 */
public record ListPopRequest(
        @NotBlank(message = "name 不能为空") String name,
        @Positive(message = "count 必须为正数") Long count) {
}
