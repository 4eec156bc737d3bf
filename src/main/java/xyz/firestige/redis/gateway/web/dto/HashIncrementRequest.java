package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record HashIncrementRequest(
        @NotBlank(message = "name 不能为空") String name,
        @NotBlank(message = "key 不能为空") String key,
        @NotNull(message = "increment 不能为空") Long increment) {
}
