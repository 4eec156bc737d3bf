package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record KeysRequest(@NotEmpty(message = "keys 不能为空") List<@NotBlank String> keys) {
}
