package xyz.firestige.redis.gateway.web;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import xyz.firestige.redis.gateway.exception.ErrorType;
import xyz.firestige.redis.gateway.exception.RedisCommandException;
import xyz.firestige.redis.gateway.service.BatchSetResult;
import xyz.firestige.redis.gateway.service.StringCommandService;
import xyz.firestige.redis.gateway.util.TimingExtension;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * StringController 测试
 */
@Tag("unit")
@ExtendWith(TimingExtension.class)
@DisplayName("String 接口测试")
class StringControllerTest {

    private StringCommandService stringCommandService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        stringCommandService = mock(StringCommandService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new StringController(stringCommandService))
                .setControllerAdvice(new GatewayExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("场景: SET nx 返回是否写入")
    void setNx() throws Exception {
        when(stringCommandService.set("K", TextNode.valueOf("v"), null, true, false, false)).thenReturn(true, false);

        for (boolean expected : new boolean[]{true, false}) {
            mockMvc.perform(post("/redis/string/set")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"key\":\"K\",\"value\":\"v\",\"nx\":true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.key").value("K"))
                    .andExpect(jsonPath("$.success").value(expected));
        }
    }

    @Test
    @DisplayName("场景: SET 缺少 value 返回 400，不访问 Redis")
    void setWithoutValue() throws Exception {
        mockMvc.perform(post("/redis/string/set")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.field").value("value"));
        verifyNoInteractions(stringCommandService);
    }

    @Test
    @DisplayName("场景: nx 与 xx 同时为 true 返回 400，不访问 Redis")
    void setNxAndXx() throws Exception {
        mockMvc.perform(post("/redis/string/set")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\",\"value\":\"v\",\"nx\":true,\"xx\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message", containsString("nx 与 xx")))
                .andExpect(jsonPath("$.details.fields", hasItem("conditionExclusive")));
        verifyNoInteractions(stringCommandService);
    }

    @Test
    @DisplayName("场景: expire 非正数返回 400")
    void setNonPositiveExpire() throws Exception {
        mockMvc.perform(post("/redis/string/set")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\",\"value\":\"v\",\"expire\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("expire"));
    }

    @Test
    @DisplayName("场景: 请求体不是合法 JSON 返回 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/redis/string/set")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("场景: 批量写入返回逐个结果")
    void setMultiple() throws Exception {
        Map<String, Boolean> results = new LinkedHashMap<>();
        results.put("a", true);
        results.put("b", false);
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put("a", 1);
        mapping.put("b", 2);
        when(stringCommandService.setMultiple(mapping, 30L, true)).thenReturn(new BatchSetResult(false, results, false));

        mockMvc.perform(post("/redis/string/set-multiple")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mapping\":{\"a\":1,\"b\":2},\"expire\":30,\"nx\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.atomic").value(false))
                .andExpect(jsonPath("$.results.a").value(true))
                .andExpect(jsonPath("$.results.b").value(false));
    }

    @Test
    @DisplayName("场景: 批量读取支持逗号分隔，缺失 Key 为 null")
    void getMultiple() throws Exception {
        when(stringCommandService.getMultiple(List.of("a", "missing"))).thenReturn(Arrays.asList(1, null));

        mockMvc.perform(get("/redis/string/get-multiple").param("keys", "a,missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values[0]").value(1))
                .andExpect(jsonPath("$.values[1]").value(nullValue()));
    }

    @Test
    @DisplayName("场景: DELETE 返回删除数量")
    void deleteKeys() throws Exception {
        when(stringCommandService.delete(List.of("a", "b"))).thenReturn(1L);

        mockMvc.perform(delete("/redis/string/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keys\":[\"a\",\"b\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(1));
    }

    @Test
    @DisplayName("场景: INCR 等价于 INCRBY 1")
    void incr() throws Exception {
        when(stringCommandService.incrBy("K", 1L, 60L)).thenReturn(1L);

        mockMvc.perform(post("/redis/string/incr")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\",\"expire\":60}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(1));
        verify(stringCommandService).incrBy("K", 1L, 60L);
    }

    @Test
    @DisplayName("场景: INCRBY 100 返回 100")
    void incrby() throws Exception {
        when(stringCommandService.incrBy("K", 100L, null)).thenReturn(100L);

        mockMvc.perform(post("/redis/string/incrby")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\",\"amount\":100}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(100));
    }

    @Test
    @DisplayName("场景: DECRBY 缺少 amount 返回 400")
    void decrbyMissingAmount() throws Exception {
        mockMvc.perform(post("/redis/string/decrby")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("amount"));
    }

    @Test
    @DisplayName("场景: SETRANGE 负数 offset 返回 400")
    void setrangeNegativeOffset() throws Exception {
        mockMvc.perform(post("/redis/string/setrange")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\",\"offset\":-1,\"value\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("offset"));
    }

    @Test
    @DisplayName("场景: GETRANGE 返回原始子串")
    void getrange() throws Exception {
        when(stringCommandService.getrange("K", -3, -1)).thenReturn("123");

        mockMvc.perform(get("/redis/string/getrange").param("key", "K").param("start", "-3").param("end", "-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value("123"));
    }

    @Test
    @DisplayName("场景: Redis 不可达返回 502")
    void redisUnreachable() throws Exception {
        when(stringCommandService.get("K")).thenThrow(new RedisCommandException("GET", "REDIS_UNREACHABLE",
                "Redis 连接失败", ErrorType.NETWORK_ERROR, null));

        mockMvc.perform(get("/redis/string/get").param("key", "K"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.type").value("NETWORK_ERROR"));
    }

    @Test
    @DisplayName("场景: Redis 命令超时返回 504")
    void redisTimeout() throws Exception {
        when(stringCommandService.strlen("K")).thenThrow(new RedisCommandException("STRLEN", "REDIS_TIMEOUT",
                "Redis 命令超时", ErrorType.TIMEOUT_ERROR, null));

        mockMvc.perform(get("/redis/string/strlen").param("key", "K"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    @DisplayName("场景: EXPIRE 与 TTL")
    void expireAndTtl() throws Exception {
        when(stringCommandService.expire("K", 30L)).thenReturn(true);
        when(stringCommandService.ttl("K")).thenReturn(30L);

        mockMvc.perform(post("/redis/string/expire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"key\":\"K\",\"seconds\":30}"))
                .andExpect(jsonPath("$.success").value(true));
        mockMvc.perform(get("/redis/string/ttl").param("key", "K"))
                .andExpect(jsonPath("$.ttl").value(30));
    }

    @Test
    @DisplayName("场景: 未预期的异常返回 500")
    void unexpectedError() throws Exception {
        when(stringCommandService.exists("K")).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/redis/string/exists").param("key", "K"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("SYSTEM_ERROR"));
    }
}
