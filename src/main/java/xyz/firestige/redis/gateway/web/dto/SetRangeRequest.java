package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record SetRangeRequest(
        @NotBlank(message = "key 不能为空") String key,
        @NotNull(message = "offset 不能为空") @PositiveOrZero(message = "offset 不能为负数") Long offset,
        @NotNull(message = "value 不能为空") String value) {
}
