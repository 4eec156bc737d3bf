package xyz.firestige.redis.gateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.RedisCommandExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisListCommands;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import xyz.firestige.redis.gateway.codec.ValueCodec;
import xyz.firestige.redis.gateway.exception.ErrorType;
import xyz.firestige.redis.gateway.exception.GatewayException;
import xyz.firestige.redis.gateway.metrics.CommandMetricsRecorder;
import xyz.firestige.redis.gateway.util.TimingExtension;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * ListCommandService 测试
 */
@Tag("unit")
@ExtendWith(TimingExtension.class)
@DisplayName("List 命令服务测试")
class ListCommandServiceTest {

    private StringRedisTemplate redisTemplate;
    private ListOperations<String, String> listOps;
    private RedisConnection connection;
    private ListCommandService service;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        listOps = mock(ListOperations.class);
        connection = mock(RedisConnection.class);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenAnswer(inv -> ((RedisCallback<?>) inv.getArgument(0)).doInRedis(connection));

        service = newService(10);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private ListCommandService newService(int sliceSeconds) {
        return new ListCommandService(redisTemplate, new ValueCodec(new ObjectMapper()),
                new RedisCommandRunner(CommandMetricsRecorder.noop()), sliceSeconds);
    }

    @Test
    @DisplayName("场景: LPUSH 按顺序逐个推入头部，LRANGE 返回逆序")
    void lpushThenLrange() {
        when(listOps.leftPushAll("L", List.of("a", "b", "c"))).thenReturn(3L);
        when(listOps.range("L", 0, -1)).thenReturn(List.of("c", "b", "a"));

        assertThat(service.push(ListEnd.LEFT, "L", List.of("a", "b", "c"))).isEqualTo(3L);
        assertThat(service.lrange("L", 0, -1)).containsExactly("c", "b", "a");
    }

    @Test
    @DisplayName("场景: RPUSH 编码结构化值")
    void rpushEncodesValues() {
        when(listOps.rightPushAll("L", List.of("{\"id\":1}", "2"))).thenReturn(2L);

        assertThat(service.push(ListEnd.RIGHT, "L", List.of(Map.of("id", 1), 2))).isEqualTo(2L);
    }

    @Test
    @DisplayName("场景: LPUSHX 对不存在的列表返回 0")
    void lpushxOnMissingList() {
        when(redisTemplate.execute(GatewayScripts.LPUSHX_VALUES, List.of("missing"), "a", "b")).thenReturn(0L);

        assertThat(service.pushIfExists(ListEnd.LEFT, "missing", List.of("a", "b"))).isZero();
    }

    @Test
    @DisplayName("场景: RPUSHX 上万个值按原顺序完整传给脚本")
    void rpushxWithManyValues() {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            values.add("v" + i);
        }
        when(redisTemplate.execute(GatewayScripts.RPUSHX_VALUES, List.of("L"), values.toArray()))
                .thenReturn(10_001L);

        assertThat(service.pushIfExists(ListEnd.RIGHT, "L", values)).isEqualTo(10_001L);
    }

    @Test
    @DisplayName("场景: LPOP count=2 作用于单元素列表只返回 1 个元素")
    void lpopCountOnSingleElementList() {
        when(listOps.leftPop("L", 2L)).thenReturn(List.of("only"));

        assertThat(service.pop(ListEnd.LEFT, "L", 2L)).containsExactly("only");
    }

    @Test
    @DisplayName("场景: 空列表弹出返回 null / 空列表")
    void popOnEmptyList() {
        when(listOps.rightPop("L")).thenReturn(null);
        when(listOps.rightPop("L", 3L)).thenReturn(null);

        assertThat(service.pop(ListEnd.RIGHT, "L")).isNull();
        assertThat(service.pop(ListEnd.RIGHT, "L", 3L)).isEmpty();
    }

    @Test
    @DisplayName("场景: LINDEX 越界抛出 RANGE_ERROR")
    void lindexOutOfRange() {
        when(listOps.index("L", 5)).thenReturn(null);
        when(listOps.size("L")).thenReturn(2L);

        assertThatThrownBy(() -> service.lindex("L", 5))
                .isInstanceOf(GatewayException.class)
                .satisfies(ex -> {
                    GatewayException ge = (GatewayException) ex;
                    assertThat(ge.getErrorType()).isEqualTo(ErrorType.RANGE_ERROR);
                    assertThat(ge.getContext()).containsEntry("field", "index");
                });
    }

    @Test
    @DisplayName("场景: LINDEX 支持负数索引")
    void lindexNegative() {
        when(listOps.index("L", -1)).thenReturn("tail");

        assertThat(service.lindex("L", -1)).isEqualTo("tail");
    }

    @Test
    @DisplayName("场景: LSET 作用于不存在的 Key 抛出 KEY_NOT_FOUND")
    void lsetOnMissingKey() {
        doThrow(new RedisSystemException("Error in execution", new RedisCommandExecutionException("ERR no such key")))
                .when(listOps).set("missing", 0, "v");

        assertThatThrownBy(() -> service.lset("missing", 0, "v"))
                .isInstanceOf(GatewayException.class)
                .satisfies(ex -> assertThat(((GatewayException) ex).getErrorType()).isEqualTo(ErrorType.KEY_NOT_FOUND));
    }

    @Test
    @DisplayName("场景: LINSERT pivot 不存在返回 -1")
    void linsertMissingPivot() {
        when(listOps.rightPush("L", "nope", "x")).thenReturn(-1L);
        when(listOps.leftPush("L", "b", "x")).thenReturn(3L);

        assertThat(service.linsert("L", InsertPosition.AFTER, "nope", "x")).isEqualTo(-1L);
        assertThat(service.linsert("L", InsertPosition.BEFORE, "b", "x")).isEqualTo(3L);
    }

    @Test
    @DisplayName("场景: LREM 返回删除数量")
    void lrem() {
        when(listOps.remove("L", 0, "a")).thenReturn(2L);

        assertThat(service.lrem("L", 0, "a")).isEqualTo(2L);
    }

    @Nested
    @DisplayName("阻塞命令")
    class Blocking {

        private final List<Integer> slices = new ArrayList<>();

        @Test
        @DisplayName("场景: BLPOP 两个空列表 timeout=1，约 1 秒后返回超时标记")
        void blpopTimesOut() {
            when(connection.listCommands()).thenReturn(listCommands(slice -> {
                sleepSeconds(slice);
                return null;
            }));

            long start = System.nanoTime();
            BlockingPopResult result = service.blockingPop(ListEnd.LEFT, List.of("L1", "L2"), 1);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertThat(result.timeout()).isTrue();
            assertThat(result.value()).isNull();
            assertThat(slices).containsExactly(1);
            assertThat(elapsedMs).isBetween(900L, 5_000L);
        }

        @Test
        @DisplayName("场景: BLPOP 返回第一个非空列表的名称与值")
        void blpopReturnsValue() {
            when(connection.listCommands()).thenReturn(listCommands(slice ->
                    List.of(bytes("L2"), bytes("{\"job\":7}"))));

            BlockingPopResult result = service.blockingPop(ListEnd.LEFT, List.of("L1", "L2"), 5);

            assertThat(result.timeout()).isFalse();
            assertThat(result.list()).isEqualTo("L2");
            assertThat(result.value()).isEqualTo(Map.of("job", 7));
        }

        @Test
        @DisplayName("场景: timeout=0 按切片循环等待直到有数据")
        void indefiniteWaitLoopsOverSlices() {
            AtomicInteger calls = new AtomicInteger();
            when(connection.listCommands()).thenReturn(listCommands(slice ->
                    calls.incrementAndGet() < 3 ? null : List.of(bytes("L"), bytes("v"))));

            BlockingPopResult result = newService(4).blockingPop(ListEnd.RIGHT, List.of("L"), 0);

            assertThat(result.value()).isEqualTo("v");
            assertThat(slices).containsExactly(4, 4, 4);
        }

        @Test
        @DisplayName("场景: 线程被中断后不再发起新的等待")
        void interruptedBeforeSlice() {
            when(connection.listCommands()).thenReturn(listCommands(slice -> null));
            Thread.currentThread().interrupt();

            assertThatThrownBy(() -> service.blockingPop(ListEnd.LEFT, List.of("L"), 0))
                    .isInstanceOf(CancellationException.class);
            assertThat(slices).isEmpty();
        }

        @Test
        @DisplayName("场景: 单个切片不超过配置的 slice-seconds")
        void slicesAreCapped() {
            when(connection.listCommands()).thenReturn(listCommands(slice -> List.of(bytes("L"), bytes("1"))));

            service.blockingPop(ListEnd.LEFT, List.of("L"), 60);

            assertThat(slices).containsExactly(10);
        }

        @Test
        @DisplayName("场景: BRPOPLPUSH 返回被移动的元素")
        void brpoplpushMovesElement() {
            RedisListCommands commands = mock(RedisListCommands.class, inv -> {
                if ("bRPopLPush".equals(inv.getMethod().getName())) {
                    slices.add(inv.getArgument(0));
                    return bytes("moved");
                }
                return null;
            });
            when(connection.listCommands()).thenReturn(commands);

            BlockingPopResult result = service.brpoplpush("src", "dst", 3);

            assertThat(result.value()).isEqualTo("moved");
            assertThat(result.list()).isEqualTo("src");
            assertThat(slices).containsExactly(3);
        }

        private RedisListCommands listCommands(SliceAnswer answer) {
            return mock(RedisListCommands.class, inv -> {
                String method = inv.getMethod().getName();
                if ("bLPop".equals(method) || "bRPop".equals(method)) {
                    int slice = inv.getArgument(0);
                    slices.add(slice);
                    return answer.reply(slice);
                }
                return null;
            });
        }
    }

    @Nested
    @DisplayName("截止时间")
    class DeadlineCalculation {

        @Test
        @DisplayName("场景: timeout=0 永不到期")
        void infinite() {
            assertThat(new ListCommandService.Deadline(0).nextSlice(10)).isEqualTo(10);
        }

        @Test
        @DisplayName("场景: 剩余时间向上取整且不超过切片上限")
        void remainingIsRoundedUpAndCapped() {
            assertThat(new ListCommandService.Deadline(3).nextSlice(10)).isEqualTo(3);
            assertThat(new ListCommandService.Deadline(25).nextSlice(10)).isEqualTo(10);
        }
    }

    @FunctionalInterface
    private interface SliceAnswer {
        List<byte[]> reply(int slice);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static void sleepSeconds(int seconds) {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
