package xyz.firestige.redis.gateway.service;

import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.types.Expiration;
import xyz.firestige.redis.gateway.codec.ValueCodec;
import xyz.firestige.redis.gateway.exception.CommandValidationException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * String 命令服务
 *
 * <p>批量写入策略：
 * <ul>
 *   <li>无过期时间：MSET，或 nx 时 MSETNX（原子，全部写入或全部不写）</li>
 *   <li>有过期时间：每个 Key 一条 SET ... EX，在同一个 Pipeline 中顺序发送（非原子）</li>
 * </ul>
 *
 * @since 1.0
 */
public class StringCommandService {

    private final StringRedisTemplate redisTemplate;
    private final ValueCodec codec;
    private final RedisCommandRunner runner;
    private final CounterExpireMode counterExpireMode;

    public StringCommandService(StringRedisTemplate redisTemplate, ValueCodec codec,
                                RedisCommandRunner runner, CounterExpireMode counterExpireMode) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.runner = Objects.requireNonNull(runner, "runner cannot be null");
        this.counterExpireMode = Objects.requireNonNull(counterExpireMode, "counterExpireMode cannot be null");
    }

    /**
     * SET key value [EX seconds | KEEPTTL] [NX | XX]
     *
     * @return 是否写入（NX/XX 条件不满足时为 false）
     */
    public boolean set(String key, Object value, Long expireSeconds, boolean nx, boolean xx, boolean keepTtl) {
        if (nx && xx) {
            throw new CommandValidationException("nx", "nx 与 xx 不能同时为 true");
        }
        if (keepTtl && expireSeconds != null) {
            throw new CommandValidationException("keepTtl", "keepTtl 与 expire 不能同时设置");
        }
        Expiration expiration = expireSeconds != null
                ? Expiration.seconds(expireSeconds)
                : keepTtl ? Expiration.keepTtl() : Expiration.persistent();
        SetOption option = nx ? SetOption.ifAbsent() : xx ? SetOption.ifPresent() : SetOption.upsert();
        byte[] rawKey = raw(key);
        byte[] rawValue = raw(codec.encode(value));

        Boolean applied = runner.execute("SET", key, () -> redisTemplate.execute(
                (RedisCallback<Boolean>) connection -> connection.stringCommands().set(rawKey, rawValue, expiration, option)));
        return Boolean.TRUE.equals(applied);
    }

    public BatchSetResult setMultiple(Map<String, Object> mapping, Long expireSeconds, boolean nx) {
        Map<String, String> encoded = codec.encodeMapping(mapping);
        Map<String, Boolean> results = new LinkedHashMap<>();

        if (expireSeconds == null || expireSeconds <= 0) {
            boolean applied;
            if (nx) {
                applied = Boolean.TRUE.equals(runner.execute("MSETNX", encoded.keySet(),
                        () -> valueOps().multiSetIfAbsent(encoded)));
            } else {
                runner.run("MSET", encoded.keySet(), () -> valueOps().multiSet(encoded));
                applied = true;
            }
            encoded.keySet().forEach(k -> results.put(k, applied));
            return new BatchSetResult(applied, results, true);
        }

        Expiration expiration = Expiration.seconds(expireSeconds);
        SetOption option = nx ? SetOption.ifAbsent() : SetOption.upsert();
        List<Object> replies = runner.execute("SET", encoded.keySet(), () -> redisTemplate.executePipelined(
                (RedisCallback<Object>) connection -> {
                    encoded.forEach((k, v) -> connection.stringCommands().set(raw(k), raw(v), expiration, option));
                    return null;
                }));

        int index = 0;
        boolean allApplied = true;
        for (String key : encoded.keySet()) {
            boolean applied = replies != null && index < replies.size() && Boolean.TRUE.equals(replies.get(index));
            results.put(key, applied);
            allApplied &= applied;
            index++;
        }
        return new BatchSetResult(allApplied, results, false);
    }

    public Object get(String key) {
        return codec.decode(runner.execute("GET", key, () -> valueOps().get(key)));
    }

    /**
     * MGET：结果与请求 Key 一一对应，缺失为 null
     */
    public List<Object> getMultiple(List<String> keys) {
        List<String> raws = runner.execute("MGET", keys, () -> valueOps().multiGet(keys));
        List<Object> values = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            values.add(codec.decode(raws != null && i < raws.size() ? raws.get(i) : null));
        }
        return values;
    }

    public boolean exists(String key) {
        return Boolean.TRUE.equals(runner.execute("EXISTS", key, () -> redisTemplate.hasKey(key)));
    }

    /**
     * EXISTS k1 k2 ...，重复的 Key 会被重复计数
     */
    public long existsMultiple(Collection<String> keys) {
        Long count = runner.execute("EXISTS", keys, () -> redisTemplate.countExistingKeys(keys));
        return count != null ? count : 0L;
    }

    public long delete(Collection<String> keys) {
        Long deleted = runner.execute("DEL", keys, () -> redisTemplate.delete(keys));
        return deleted != null ? deleted : 0L;
    }

    /**
     * INCRBY，amount 为负时等价于 DECRBY
     *
     * @param expireSeconds 可选过期时间，生效时机见 {@link CounterExpireMode}
     */
    public long incrBy(String key, long amount, Long expireSeconds) {
        return counter("INCRBY", key, amount, expireSeconds);
    }

    public long decrBy(String key, long amount, Long expireSeconds) {
        return counter("DECRBY", key, amount, expireSeconds);
    }

    private long counter(String command, String key, long amount, Long expireSeconds) {
        Long value;
        if (expireSeconds == null) {
            value = runner.execute(command, key, () -> "INCRBY".equals(command)
                    ? valueOps().increment(key, amount)
                    : valueOps().decrement(key, amount));
        } else {
            value = runner.execute(command, key, () -> redisTemplate.execute(counterExpireMode.script(),
                    List.of(key), command, String.valueOf(amount), String.valueOf(expireSeconds)));
        }
        return value != null ? value : 0L;
    }

    public long strlen(String key) {
        Long length = runner.execute("STRLEN", key, () -> valueOps().size(key));
        return length != null ? length : 0L;
    }

    /**
     * GETRANGE 返回原始子串，不做 JSON 解码
     */
    public String getrange(String key, long start, long end) {
        String value = runner.execute("GETRANGE", key, () -> valueOps().get(key, start, end));
        return value != null ? value : "";
    }

    /**
     * SETRANGE，offset 超出当前长度时以 \0 填充
     *
     * @return 修改后的字符串长度
     */
    public long setrange(String key, long offset, String value) {
        Long length = runner.execute("SETRANGE", key, () -> redisTemplate.execute(GatewayScripts.SETRANGE,
                List.of(key), String.valueOf(offset), value));
        return length != null ? length : 0L;
    }

    /**
     * EXPIRE
     *
     * @return Key 存在且设置成功
     */
    public boolean expire(String key, long seconds) {
        return Boolean.TRUE.equals(runner.execute("EXPIRE", key,
                () -> redisTemplate.expire(key, Duration.ofSeconds(seconds))));
    }

    /**
     * TTL：-2 表示 Key 不存在，-1 表示未设置过期时间
     */
    public long ttl(String key) {
        Long ttl = runner.execute("TTL", key, () -> redisTemplate.getExpire(key));
        return ttl != null ? ttl : -2L;
    }

    private ValueOperations<String, String> valueOps() {
        return redisTemplate.opsForValue();
    }

    private static byte[] raw(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
