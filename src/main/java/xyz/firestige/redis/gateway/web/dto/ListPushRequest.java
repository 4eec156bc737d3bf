package xyz.firestige.redis.gateway.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * LPUSH / RPUSH / LPUSHX / RPUSHX 请求，values 按顺序逐个推入
 */
public record ListPushRequest(
        @NotBlank(message = "name 不能为空") String name,
        @NotEmpty(message = "values 不能为空") List<Object> values) {
}
