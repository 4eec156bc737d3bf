package xyz.firestige.redis.gateway.metrics;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import xyz.firestige.redis.gateway.service.ServerCommandService;

/**
 * 网关健康检查指示器
 * 通过 PING 判断共享 Redis 连接是否可用
 *
 * @since 1.0
 */
public class RedisGatewayHealthIndicator implements HealthIndicator {

    private final ServerCommandService serverCommandService;

    public RedisGatewayHealthIndicator(ServerCommandService serverCommandService) {
        this.serverCommandService = serverCommandService;
    }

    @Override
    public Health health() {
        try {
            String pong = serverCommandService.ping();
            return Health.up()
                    .withDetail("service", "RedisGateway")
                    .withDetail("ping", pong)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("service", "RedisGateway")
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
