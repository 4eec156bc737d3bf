package xyz.firestige.redis.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * LREM 请求：count &gt; 0 从头部删除，&lt; 0 从尾部删除，0 删除全部
 */
public record ListRemoveRequest(
        @NotBlank(message = "name 不能为空") String name,
        Long count,
        @NotNull(message = "value 不能为空") JsonNode value) {

    public long countOrDefault() {
        return count != null ? count : 0L;
    }
}
