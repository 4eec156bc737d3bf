package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * INCRBY / DECRBY 请求
 */
public record CounterByRequest(
        @NotBlank(message = "key 不能为空") String key,
        @NotNull(message = "amount 不能为空") Long amount,
        @Positive(message = "expire 必须为正数") Long expire) {
}
