package xyz.firestige.redis.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * HSETNX 请求
 */
public record HashFieldValueRequest(
        @NotBlank(message = "name 不能为空") String name,
        @NotBlank(message = "key 不能为空") String key,
        @NotNull(message = "value 不能为空") JsonNode value) {
}
