package xyz.firestige.redis.gateway.service;

/**
 * 阻塞弹出结果
 * 超时不是错误：{@code timeout == true} 时 list 与 value 均为 null
 */
public record BlockingPopResult(String list, Object value, boolean timeout) {

    public static BlockingPopResult of(String list, Object value) {
        return new BlockingPopResult(list, value, false);
    }

    public static BlockingPopResult timedOut() {
        return new BlockingPopResult(null, null, true);
    }
}
