package xyz.firestige.redis.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * HSET 请求：单字段（key/value）与 mapping 至少提供一个，给出 key 时必须同时给出 value
 */
public record HashSetRequest(
        @NotBlank(message = "name 不能为空") String name,
        String key,
        JsonNode value,
        Map<String, Object> mapping) {

    @AssertTrue(message = "key/value 与 mapping 至少需要提供一个")
    public boolean isFieldOrMappingPresent() {
        return key != null || (mapping != null && !mapping.isEmpty());
    }

    @AssertTrue(message = "提供 key 时 value 不能为空")
    public boolean isValuePresentForKey() {
        return key == null || value != null;
    }
}
