package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * BLPOP / BRPOP 请求
 *
 * @param keys    候选列表，按顺序检查
 * @param timeout 超时秒数，缺省或 0 表示无限等待
 */
public record BlockingPopRequest(
        @NotEmpty(message = "keys 不能为空") List<@NotBlank String> keys,
        @PositiveOrZero(message = "timeout 不能为负数") Long timeout) {

    public long timeoutOrDefault() {
        return timeout != null ? timeout : 0L;
    }
}
