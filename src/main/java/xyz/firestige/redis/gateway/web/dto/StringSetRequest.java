package xyz.firestige.redis.gateway.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * SET 请求
 *
 * @param value   任意 JSON 值，显式 null 按空字符串写入
 * @param expire  过期秒数
 * @param nx      仅当 Key 不存在时写入
 * @param xx      仅当 Key 已存在时写入
 * @param keepTtl 保留原有过期时间
 */
public record StringSetRequest(
        @NotBlank(message = "key 不能为空") String key,
        @NotNull(message = "value 不能为空") JsonNode value,
        @Positive(message = "expire 必须为正数") Long expire,
        Boolean nx,
        Boolean xx,
        Boolean keepTtl) {

    @AssertTrue(message = "nx 与 xx 不能同时为 true")
    public boolean isConditionExclusive() {
        return !(onlyIfAbsent() && onlyIfPresent());
    }

    @AssertTrue(message = "keepTtl 与 expire 不能同时设置")
    public boolean isExpireCompatible() {
        return !(keepExistingTtl() && expire != null);
    }

    public boolean onlyIfAbsent() {
        return Boolean.TRUE.equals(nx);
    }

    public boolean onlyIfPresent() {
        return Boolean.TRUE.equals(xx);
    }

    public boolean keepExistingTtl() {
        return Boolean.TRUE.equals(keepTtl);
    }
}
