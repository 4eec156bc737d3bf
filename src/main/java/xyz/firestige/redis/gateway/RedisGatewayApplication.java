package xyz.firestige.redis.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Redis 命令网关启动类
 */
@SpringBootApplication
public class RedisGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedisGatewayApplication.class, args);
    }
}
