package xyz.firestige.redis.gateway.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Objects;

/**
 * 连接级命令（PING）
 */
public class ServerCommandService {

    private static final Logger log = LoggerFactory.getLogger(ServerCommandService.class);

    private final StringRedisTemplate redisTemplate;
    private final RedisCommandRunner runner;

    public ServerCommandService(StringRedisTemplate redisTemplate, RedisCommandRunner runner) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
        this.runner = Objects.requireNonNull(runner, "runner cannot be null");
    }

    public String ping() {
        return runner.execute("PING", null,
                () -> redisTemplate.execute((RedisCallback<String>) connection -> connection.ping()));
    }

    /**
     * PING 成功返回 true，任何失败返回 false
     */
    public boolean isConnected() {
        try {
            return "PONG".equalsIgnoreCase(ping());
        } catch (RuntimeException e) {
            log.debug("[ServerCommand] Redis 不可用: {}", e.getMessage());
            return false;
        }
    }
}
