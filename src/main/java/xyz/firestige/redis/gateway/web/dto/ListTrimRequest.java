package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ListTrimRequest(
        @NotBlank(message = "name 不能为空") String name,
        @NotNull(message = "start 不能为空") Long start,
        @NotNull(message = "end 不能为空") Long end) {
}
