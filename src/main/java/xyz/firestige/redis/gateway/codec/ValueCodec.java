package xyz.firestige.redis.gateway.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.NullNode;
import xyz.firestige.redis.gateway.exception.CommandValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 值编解码器
 *
 * <p>HTTP 侧的值是任意 JSON，Redis 侧只能存字符串。写入规则：
 * <ul>
 *   <li>null → 空字符串</li>
 *   <li>字符串 → 原样</li>
 *   <li>数字 / 布尔 → 文本形式</li>
 *   <li>对象 / 数组 → 紧凑 JSON</li>
 * </ul>
 *
 * <p>读取规则：空值返回 null；能完整解析为一个 JSON 文档的文本返回对应 JSON 值；否则返回原始字符串。
 *
 * @since 1.0
 */
public class ValueCodec {

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        // "123abc" 之类的文本不能被当成数字 123
        this.strictReader = objectMapper.readerFor(Object.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public String encode(Object value) {
        if (value == null || value instanceof NullNode) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof JsonNode node && node.isValueNode()) {
            return node.asText();
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CommandValidationException("value", "值无法序列化为 JSON: " + e.getOriginalMessage());
        }
    }

    public List<String> encodeAll(Collection<?> values) {
        List<String> encoded = new ArrayList<>(values.size());
        for (Object value : values) {
            encoded.add(encode(value));
        }
        return encoded;
    }

    public Map<String, String> encodeMapping(Map<String, ?> mapping) {
        Map<String, String> encoded = new LinkedHashMap<>();
        mapping.forEach((k, v) -> encoded.put(k, encode(v)));
        return encoded;
    }

    public Object decode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return strictReader.readValue(raw);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }

    public List<Object> decodeAll(Collection<String> raws) {
        if (raws == null) {
            return new ArrayList<>();
        }
        List<Object> decoded = new ArrayList<>(raws.size());
        for (String raw : raws) {
            decoded.add(decode(raw));
        }
        return decoded;
    }
}
