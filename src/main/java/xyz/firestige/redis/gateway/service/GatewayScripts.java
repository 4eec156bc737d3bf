package xyz.firestige.redis.gateway.service;

import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;

/**
 * 网关使用的 Lua 脚本
 * <p>
 * Spring Data Redis 的高层 API 对以下命令要么不返回原生结果（多字段 HSET 的新增数量、SETRANGE 的新长度），
 * 要么不支持多值（LPUSHX/RPUSHX），要么隐藏了游标（HSCAN），这里用单条脚本原样调用原生命令。
 * <p>
 * 多值脚本逐个处理 ARGV，不使用 unpack：Lua 5.1 的 unpack 结果数受 C 栈上限约束，大请求会直接报错。
 */
final class GatewayScripts {

    private GatewayScripts() {
    }

    /**
     * 逐字段 HSET，ARGV = f1, v1, f2, v2, ...，返回新建字段数
     */
    static final RedisScript<Long> HSET_FIELDS = RedisScript.of(
            "local added = 0\n"
                    + "for i = 1, #ARGV, 2 do\n"
                    + "  added = added + redis.call('HSET', KEYS[1], ARGV[i], ARGV[i + 1])\n"
                    + "end\n"
                    + "return added", Long.class);

    /**
     * 单步 HSCAN：ARGV = cursor, match(可为空串), count(可为空串)
     * 返回 [nextCursor, [f1, v1, f2, v2, ...]]
     */
    static final RedisScript<List<Object>> HSCAN_STEP = listScript(
            "local args = {KEYS[1], ARGV[1]}\n"
                    + "if ARGV[2] ~= '' then\n"
                    + "  table.insert(args, 'MATCH')\n"
                    + "  table.insert(args, ARGV[2])\n"
                    + "end\n"
                    + "if ARGV[3] ~= '' then\n"
                    + "  table.insert(args, 'COUNT')\n"
                    + "  table.insert(args, ARGV[3])\n"
                    + "end\n"
                    + "return redis.call('HSCAN', unpack(args))");

    static final RedisScript<Long> LPUSHX_VALUES = pushIfExists("LPUSHX");

    static final RedisScript<Long> RPUSHX_VALUES = pushIfExists("RPUSHX");

    /**
     * SETRANGE key offset value，返回修改后的长度
     */
    static final RedisScript<Long> SETRANGE = RedisScript.of(
            "return redis.call('SETRANGE', KEYS[1], ARGV[1], ARGV[2])", Long.class);

    /**
     * 计数器 + 过期时间，仅在本次自增创建了 Key 时设置过期
     * ARGV = INCRBY|DECRBY, amount, ttlSeconds
     */
    static final RedisScript<Long> COUNTER_EXPIRE_ON_CREATE = RedisScript.of(
            "local existed = redis.call('EXISTS', KEYS[1])\n"
                    + "local value = redis.call(ARGV[1], KEYS[1], ARGV[2])\n"
                    + "if existed == 0 then\n"
                    + "  redis.call('EXPIRE', KEYS[1], ARGV[3])\n"
                    + "end\n"
                    + "return value", Long.class);

    /**
     * 计数器 + 过期时间，每次都刷新过期
     * ARGV = INCRBY|DECRBY, amount, ttlSeconds
     */
    static final RedisScript<Long> COUNTER_EXPIRE_ALWAYS = RedisScript.of(
            "local value = redis.call(ARGV[1], KEYS[1], ARGV[2])\n"
                    + "redis.call('EXPIRE', KEYS[1], ARGV[3])\n"
                    + "return value", Long.class);

    /**
     * 逐个推入，列表不存在时第一条就返回 0，后续同样不会写入
     */
    private static RedisScript<Long> pushIfExists(String command) {
        return RedisScript.of(
                "local length = 0\n"
                        + "for i = 1, #ARGV do\n"
                        + "  length = redis.call('" + command + "', KEYS[1], ARGV[i])\n"
                        + "  if length == 0 then\n"
                        + "    return 0\n"
                        + "  end\n"
                        + "end\n"
                        + "return length", Long.class);
    }

    @SuppressWarnings("unchecked")
    private static RedisScript<List<Object>> listScript(String script) {
        return new DefaultRedisScript<>(script, (Class<List<Object>>) (Class<?>) List.class);
    }
}
