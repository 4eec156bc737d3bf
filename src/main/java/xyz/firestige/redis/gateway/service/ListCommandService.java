package xyz.firestige.redis.gateway.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.redis.gateway.codec.ValueCodec;
import xyz.firestige.redis.gateway.exception.ErrorType;
import xyz.firestige.redis.gateway.exception.GatewayException;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * List 命令服务
 *
 * <h3>阻塞命令</h3>
 * BLPOP / BRPOP / BRPOPLPUSH 在调用线程上阻塞，由 web 层放到独立线程池执行。
 * 一次请求内的所有等待复用同一个连接，并按 {@code sliceSeconds} 切片发送：
 * <ul>
 *   <li>单条命令不会超过客户端的命令超时</li>
 *   <li>timeout = 0 时循环切片实现无限等待</li>
 *   <li>每个切片之间检查线程中断，请求被取消后不再发起新的等待</li>
 * </ul>
 *
 * @since 1.0
 */
public class ListCommandService {

    private static final Logger log = LoggerFactory.getLogger(ListCommandService.class);

    private final StringRedisTemplate redisTemplate;
    private final ValueCodec codec;
    private final RedisCommandRunner runner;
    private final int sliceSeconds;

    public ListCommandService(StringRedisTemplate redisTemplate, ValueCodec codec,
                              RedisCommandRunner runner, int sliceSeconds) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.runner = Objects.requireNonNull(runner, "runner cannot be null");
        if (sliceSeconds < 1) {
            throw new IllegalArgumentException("sliceSeconds must be >= 1");
        }
        this.sliceSeconds = sliceSeconds;
    }

    /**
     * LPUSH / RPUSH
     *
     * @return 插入后的列表长度
     */
    public long push(ListEnd end, String name, List<Object> values) {
        List<String> encoded = codec.encodeAll(values);
        Long length = runner.execute(end.command("PUSH"), name, () -> end == ListEnd.LEFT
                ? listOps().leftPushAll(name, encoded)
                : listOps().rightPushAll(name, encoded));
        return length != null ? length : 0L;
    }

    /**
     * LPUSHX / RPUSHX：列表不存在时不写入，返回 0
     */
    public long pushIfExists(ListEnd end, String name, List<Object> values) {
        Object[] encoded = codec.encodeAll(values).toArray();
        Long length = runner.execute(end.command("PUSHX"), name, () -> redisTemplate.execute(
                end == ListEnd.LEFT ? GatewayScripts.LPUSHX_VALUES : GatewayScripts.RPUSHX_VALUES,
                List.of(name), encoded));
        return length != null ? length : 0L;
    }

    public long llen(String name) {
        Long size = runner.execute("LLEN", name, () -> listOps().size(name));
        return size != null ? size : 0L;
    }

    /**
     * LINDEX：Redis 对越界返回 nil，这里通过 LLEN 区分越界并抛出 RANGE_ERROR
     */
    public Object lindex(String name, long index) {
        String raw = runner.execute("LINDEX", name, () -> listOps().index(name, index));
        if (raw != null) {
            return codec.decode(raw);
        }
        long length = llen(name);
        long normalized = index < 0 ? length + index : index;
        if (normalized < 0 || normalized >= length) {
            throw new GatewayException("INDEX_OUT_OF_RANGE",
                    String.format("索引越界: index=%d, length=%d", index, length), ErrorType.RANGE_ERROR)
                    .addContext("command", "LINDEX")
                    .addContext("key", name)
                    .addContext("field", "index");
        }
        // 元素在 LINDEX 与 LLEN 之间被并发删除
        return null;
    }

    public void lset(String name, long index, Object value) {
        String encoded = codec.encode(value);
        runner.run("LSET", name, () -> listOps().set(name, index, encoded));
    }

    public List<Object> lrange(String name, long start, long end) {
        return codec.decodeAll(runner.execute("LRANGE", name, () -> listOps().range(name, start, end)));
    }

    public void ltrim(String name, long start, long end) {
        runner.run("LTRIM", name, () -> listOps().trim(name, start, end));
    }

    /**
     * LINSERT
     *
     * @return 插入后的长度；-1 表示 pivot 不存在；0 表示列表不存在
     */
    public long linsert(String name, InsertPosition position, Object pivot, Object value) {
        String encodedPivot = codec.encode(pivot);
        String encodedValue = codec.encode(value);
        Long length = runner.execute("LINSERT", name, () -> position == InsertPosition.BEFORE
                ? listOps().leftPush(name, encodedPivot, encodedValue)
                : listOps().rightPush(name, encodedPivot, encodedValue));
        return length != null ? length : 0L;
    }

    /**
     * LPOP / RPOP 单个元素，列表为空返回 null
     */
    public Object pop(ListEnd end, String name) {
        String raw = runner.execute(end.command("POP"), name, () -> end == ListEnd.LEFT
                ? listOps().leftPop(name)
                : listOps().rightPop(name));
        return codec.decode(raw);
    }

    /**
     * LPOP / RPOP key count，最多返回 count 个元素，列表为空返回空列表
     */
    public List<Object> pop(ListEnd end, String name, long count) {
        List<String> raws = runner.execute(end.command("POP"), name, () -> end == ListEnd.LEFT
                ? listOps().leftPop(name, count)
                : listOps().rightPop(name, count));
        return codec.decodeAll(raws);
    }

    public long lrem(String name, long count, Object value) {
        String encoded = codec.encode(value);
        Long removed = runner.execute("LREM", name, () -> listOps().remove(name, count, encoded));
        return removed != null ? removed : 0L;
    }

    /**
     * BLPOP / BRPOP
     *
     * @param keys           候选列表，按顺序检查
     * @param timeoutSeconds 超时秒数，0 表示无限等待
     * @throws CancellationException 等待期间线程被中断
     */
    public BlockingPopResult blockingPop(ListEnd end, List<String> keys, long timeoutSeconds) {
        String command = "B" + end.command("POP");
        byte[][] rawKeys = keys.stream().map(ListCommandService::raw).toArray(byte[][]::new);
        Deadline deadline = new Deadline(timeoutSeconds);

        return runner.execute(command, keys, () -> redisTemplate.execute((RedisCallback<BlockingPopResult>) connection -> {
            while (true) {
                int slice = deadline.nextSlice(sliceSeconds);
                if (slice <= 0) {
                    log.debug("[ListCommand] {} 超时: keys={}, timeout={}s", command, keys, timeoutSeconds);
                    return BlockingPopResult.timedOut();
                }
                checkNotCancelled(command);
                List<byte[]> reply = end == ListEnd.LEFT
                        ? connection.listCommands().bLPop(slice, rawKeys)
                        : connection.listCommands().bRPop(slice, rawKeys);
                if (reply != null && reply.size() >= 2) {
                    return BlockingPopResult.of(text(reply.get(0)), codec.decode(text(reply.get(1))));
                }
            }
        }));
    }

    /**
     * BRPOPLPUSH：原子地从 source 尾部弹出并推入 destination 头部
     */
    public BlockingPopResult brpoplpush(String source, String destination, long timeoutSeconds) {
        byte[] rawSource = raw(source);
        byte[] rawDestination = raw(destination);
        Deadline deadline = new Deadline(timeoutSeconds);

        return runner.execute("BRPOPLPUSH", source, () -> redisTemplate.execute((RedisCallback<BlockingPopResult>) connection -> {
            while (true) {
                int slice = deadline.nextSlice(sliceSeconds);
                if (slice <= 0) {
                    log.debug("[ListCommand] BRPOPLPUSH 超时: source={}, destination={}", source, destination);
                    return BlockingPopResult.timedOut();
                }
                checkNotCancelled("BRPOPLPUSH");
                byte[] moved = connection.listCommands().bRPopLPush(slice, rawSource, rawDestination);
                if (moved != null) {
                    return BlockingPopResult.of(source, codec.decode(text(moved)));
                }
            }
        }));
    }

    private static void checkNotCancelled(String command) {
        if (Thread.currentThread().isInterrupted()) {
            log.debug("[ListCommand] {} 已取消", command);
            throw new CancellationException(command + " cancelled");
        }
    }

    private ListOperations<String, String> listOps() {
        return redisTemplate.opsForList();
    }

    private static byte[] raw(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return value != null ? new String(value, StandardCharsets.UTF_8) : null;
    }

    /**
     * 阻塞命令截止时间，timeoutSeconds = 0 表示永不截止
     */
    static final class Deadline {

        private final long deadlineNanos;
        private final boolean infinite;

        Deadline(long timeoutSeconds) {
            this.infinite = timeoutSeconds == 0;
            this.deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        }

        /**
         * 下一次阻塞的秒数，不超过 maxSlice；返回 0 表示已到期
         */
        int nextSlice(int maxSlice) {
            if (infinite) {
                return maxSlice;
            }
            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                return 0;
            }
            long remainingSeconds = (remainingNanos + TimeUnit.SECONDS.toNanos(1) - 1) / TimeUnit.SECONDS.toNanos(1);
            return (int) Math.min(maxSlice, remainingSeconds);
        }
    }
}
