package xyz.firestige.redis.gateway.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import xyz.firestige.redis.gateway.config.RedisGatewayProperties;
import xyz.firestige.redis.gateway.service.ServerCommandService;

/**
 * 服务信息
 * curl localhost:8080/
 */
@RestController
public class RootController {

    private final RedisGatewayProperties properties;
    private final ServerCommandService serverCommandService;

    public RootController(RedisGatewayProperties properties, ServerCommandService serverCommandService) {
        this.properties = properties;
        this.serverCommandService = serverCommandService;
    }

    @GetMapping("/")
    public CommandReply info() {
        return CommandReply.of("name", properties.getName())
                .with("version", properties.getVersion())
                .with("description", properties.getDescription())
                .with("redisConnected", serverCommandService.isConnected());
    }
}
