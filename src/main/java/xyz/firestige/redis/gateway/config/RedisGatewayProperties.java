package xyz.firestige.redis.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.redis.gateway.service.CounterExpireMode;

import java.time.Duration;

/**
 * Redis 网关配置属性
 * prefix: redis.gateway
 * 连接参数沿用 Spring Boot 的 spring.data.redis.*
 *
 * <pre>
 * redis:
 *   gateway:
 *     counter-expire-mode: on-create
 *     blocking:
 *       core-pool-size: 8
 *       max-pool-size: 64
 *       slice-seconds: 10
 * </pre>
 *
 * @since 1.0
 */
@ConfigurationProperties(prefix = "redis.gateway")
@Validated
public class RedisGatewayProperties {

    /** 服务名称（根路由返回） */
    @NotBlank
    private String name = "Redis Command Gateway";

    /** 服务版本（根路由返回） */
    @NotBlank
    private String version = "1.0.0";

    /** 服务描述（根路由返回） */
    private String description = "HTTP gateway for Redis hash, list and string commands";

    /** INCR/DECR 携带 expire 时的过期策略 */
    @NotNull
    private CounterExpireMode counterExpireMode = CounterExpireMode.ON_CREATE;

    /** 阻塞命令配置 */
    @NotNull
    @Valid
    private Blocking blocking = new Blocking();

    // ========== Blocking ==========
    public static class Blocking {
        /** 核心线程数 */
        @Min(1)
        private int corePoolSize = 8;
        /** 最大线程数，即同时等待中的阻塞命令上限 */
        @Min(1)
        private int maxPoolSize = 64;
        /** 等待队列容量，满后拒绝并返回 503 */
        @Min(0)
        private int queueCapacity = 0;
        /** 线程名前缀 */
        private String threadNamePrefix = "redis-blocking-";
        /** 空闲线程存活时间（秒） */
        @Min(0)
        private int keepAliveSeconds = 60;
        /** 单次阻塞命令的最长秒数，必须小于 spring.data.redis.timeout */
        @Min(1)
        private int sliceSeconds = 10;
        /** 异步请求超时 = 命令 timeout + grace；timeout = 0 时请求不超时 */
        @NotNull
        private Duration gracePeriod = Duration.ofSeconds(5);

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public String getThreadNamePrefix() { return threadNamePrefix; }
        public void setThreadNamePrefix(String threadNamePrefix) { this.threadNamePrefix = threadNamePrefix; }
        public int getKeepAliveSeconds() { return keepAliveSeconds; }
        public void setKeepAliveSeconds(int keepAliveSeconds) { this.keepAliveSeconds = keepAliveSeconds; }
        public int getSliceSeconds() { return sliceSeconds; }
        public void setSliceSeconds(int sliceSeconds) { this.sliceSeconds = sliceSeconds; }
        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public CounterExpireMode getCounterExpireMode() { return counterExpireMode; }
    public void setCounterExpireMode(CounterExpireMode counterExpireMode) { this.counterExpireMode = counterExpireMode; }
    public Blocking getBlocking() { return blocking; }
    public void setBlocking(Blocking blocking) { this.blocking = blocking; }
}
