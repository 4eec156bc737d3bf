package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * HMGET / HDEL 请求
 */
public record HashFieldsRequest(
        @NotBlank(message = "name 不能为空") String name,
        @NotEmpty(message = "keys 不能为空") List<@NotBlank String> keys) {
}
