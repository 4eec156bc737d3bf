package xyz.firestige.redis.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ListSetRequest(
        @NotBlank(message = "name 不能为空") String name,
        @NotNull(message = "index 不能为空") Long index,
        @NotNull(message = "value 不能为空") JsonNode value) {
}
