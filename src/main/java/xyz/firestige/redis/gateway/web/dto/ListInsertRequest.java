package xyz.firestige.redis.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * LINSERT 请求，position 取值 before / after（不区分大小写）
 */
public record ListInsertRequest(
        @NotBlank(message = "name 不能为空") String name,
        @NotNull(message = "position 不能为空")
        @Pattern(regexp = "(?i)before|after", message = "position 只能是 before 或 after") String position,
        @NotNull(message = "pivot 不能为空") Object pivot,
        @NotNull(message = "value 不能为空") JsonNode value) {
}
