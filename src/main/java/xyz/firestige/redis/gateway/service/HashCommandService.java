package xyz.firestige.redis.gateway.service;

import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.redis.gateway.codec.ValueCodec;
import xyz.firestige.redis.gateway.exception.CommandValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Hash 命令服务
 *
 * <p>每个方法对应一条原生命令，Key 不存在时返回 Redis 的零值（空 Map、0、false、空列表），不抛异常。
 *
 * @since 1.0
 */
public class HashCommandService {

    private final StringRedisTemplate redisTemplate;
    private final ValueCodec codec;
    private final RedisCommandRunner runner;

    public HashCommandService(StringRedisTemplate redisTemplate, ValueCodec codec, RedisCommandRunner runner) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.runner = Objects.requireNonNull(runner, "runner cannot be null");
    }

    /**
     * HSET：单字段和 mapping 可以同时提供，一次写入
     *
     * @return 新建字段数量
     */
    public long hset(String name, String field, Object value, Map<String, Object> mapping) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (field != null) {
            fields.put(field, codec.encode(value));
        }
        if (mapping != null) {
            fields.putAll(codec.encodeMapping(mapping));
        }
        if (fields.isEmpty()) {
            throw new CommandValidationException("mapping", "key/value 与 mapping 至少需要提供一个");
        }

        List<String> args = new ArrayList<>(fields.size() * 2);
        fields.forEach((k, v) -> {
            args.add(k);
            args.add(v);
        });
        Long added = runner.execute("HSET", name,
                () -> redisTemplate.execute(GatewayScripts.HSET_FIELDS, List.of(name), args.toArray()));
        return added != null ? added : 0L;
    }

    public boolean hsetnx(String name, String field, Object value) {
        Boolean written = runner.execute("HSETNX", name,
                () -> hashOps().putIfAbsent(name, field, codec.encode(value)));
        return Boolean.TRUE.equals(written);
    }

    public Object hget(String name, String field) {
        return codec.decode(runner.execute("HGET", name, () -> hashOps().get(name, field)));
    }

    /**
     * HMGET：结果按请求字段顺序排列，缺失字段为 null
     */
    public Map<String, Object> hmget(String name, List<String> fields) {
        List<String> values = runner.execute("HMGET", name, () -> hashOps().multiGet(name, fields));
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            String raw = values != null && i < values.size() ? values.get(i) : null;
            result.put(fields.get(i), codec.decode(raw));
        }
        return result;
    }

    public Map<String, Object> hgetall(String name) {
        Map<String, String> entries = runner.execute("HGETALL", name, () -> hashOps().entries(name));
        return decodeEntries(entries);
    }

    public long hdel(String name, Collection<String> fields) {
        Long removed = runner.execute("HDEL", name, () -> hashOps().delete(name, fields.toArray()));
        return removed != null ? removed : 0L;
    }

    public boolean hexists(String name, String field) {
        return Boolean.TRUE.equals(runner.execute("HEXISTS", name, () -> hashOps().hasKey(name, field)));
    }

    public long hlen(String name) {
        Long size = runner.execute("HLEN", name, () -> hashOps().size(name));
        return size != null ? size : 0L;
    }

    public List<String> hkeys(String name) {
        Collection<String> keys = runner.execute("HKEYS", name, () -> hashOps().keys(name));
        return keys != null ? new ArrayList<>(keys) : new ArrayList<>();
    }

    public List<Object> hvals(String name) {
        return codec.decodeAll(runner.execute("HVALS", name, () -> hashOps().values(name)));
    }

    public long hincrby(String name, String field, long increment) {
        Long value = runner.execute("HINCRBY", name, () -> hashOps().increment(name, field, increment));
        return value != null ? value : 0L;
    }

    /**
     * 单步 HSCAN，不持有快照，批次之间可能出现重复字段
     *
     * @param cursor 上一次返回的游标，首次为 "0"
     * @param match  glob 过滤，可为 null
     * @param count  批大小提示，可为 null
     */
    public HashScanResult hscan(String name, String cursor, String match, Integer count) {
        String matchArg = match != null ? match : "";
        String countArg = count != null ? String.valueOf(count) : "";
        List<?> reply = runner.execute("HSCAN", name,
                () -> redisTemplate.execute(GatewayScripts.HSCAN_STEP, List.of(name), cursor, matchArg, countArg));

        if (reply == null || reply.isEmpty()) {
            return new HashScanResult("0", new LinkedHashMap<>());
        }
        String nextCursor = String.valueOf(reply.get(0));
        Map<String, Object> entries = new LinkedHashMap<>();
        if (reply.size() > 1 && reply.get(1) instanceof List<?> flat) {
            for (int i = 0; i + 1 < flat.size(); i += 2) {
                entries.put(String.valueOf(flat.get(i)), codec.decode((String) flat.get(i + 1)));
            }
        }
        return new HashScanResult(nextCursor, entries);
    }

    private Map<String, Object> decodeEntries(Map<String, String> entries) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (entries != null) {
            entries.forEach((k, v) -> result.put(k, codec.decode(v)));
        }
        return result;
    }

    private HashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }
}
