package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * BRPOPLPUSH 请求
 */
public record BlockingMoveRequest(
        @NotBlank(message = "source 不能为空") String source,
        @NotBlank(message = "destination 不能为空") String destination,
        @PositiveOrZero(message = "timeout 不能为负数") Long timeout) {

    public long timeoutOrDefault() {
        return timeout != null ? timeout : 0L;
    }
}
