package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ExpireRequest(
        @NotBlank(message = "key 不能为空") String key,
        @NotNull(message = "seconds 不能为空") @Positive(message = "seconds 必须为正数") Long seconds) {
}
