package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * INCR / DECR 请求，expire 可选
 */
public record CounterRequest(
        @NotBlank(message = "key 不能为空") String key,
        @Positive(message = "expire 必须为正数") Long expire) {
}
