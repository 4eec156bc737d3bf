package xyz.firestige.redis.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import xyz.firestige.redis.gateway.codec.ValueCodec;
import xyz.firestige.redis.gateway.metrics.CommandMetricsRecorder;
import xyz.firestige.redis.gateway.metrics.MicrometerCommandMetricsRecorder;
import xyz.firestige.redis.gateway.metrics.RedisGatewayHealthIndicator;
import xyz.firestige.redis.gateway.service.HashCommandService;
import xyz.firestige.redis.gateway.service.ListCommandService;
import xyz.firestige.redis.gateway.service.RedisCommandRunner;
import xyz.firestige.redis.gateway.service.ServerCommandService;
import xyz.firestige.redis.gateway.service.StringCommandService;
import xyz.firestige.redis.gateway.web.BlockingCommandDispatcher;
import xyz.firestige.redis.gateway.web.ProcessTimeFilter;

/**
 * 网关装配
 * <p>
 * 所有命令服务共享 Spring Boot 创建的同一个 {@link StringRedisTemplate}（底层为 Lettuce 共享连接），
 * 启动时创建，关闭时由容器释放。
 *
 * @since 1.0
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(RedisGatewayProperties.class)
@Import(BlockingExecutorConfig.class)
public class RedisGatewayConfiguration {

    @Bean
    public ValueCodec valueCodec(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new ValueCodec(objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    /**
     * 有 MeterRegistry 时使用 Micrometer，否则空操作
     */
    @Bean
    public CommandMetricsRecorder commandMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        MeterRegistry registry = meterRegistryProvider.getIfAvailable();
        return registry != null
                ? new MicrometerCommandMetricsRecorder(registry)
                : CommandMetricsRecorder.noop();
    }

    @Bean
    public RedisCommandRunner redisCommandRunner(CommandMetricsRecorder commandMetricsRecorder) {
        return new RedisCommandRunner(commandMetricsRecorder);
    }

    @Bean
    public HashCommandService hashCommandService(StringRedisTemplate redisTemplate, ValueCodec valueCodec,
                                                 RedisCommandRunner runner) {
        return new HashCommandService(redisTemplate, valueCodec, runner);
    }

    @Bean
    public ListCommandService listCommandService(StringRedisTemplate redisTemplate, ValueCodec valueCodec,
                                                 RedisCommandRunner runner, RedisGatewayProperties properties) {
        return new ListCommandService(redisTemplate, valueCodec, runner, properties.getBlocking().getSliceSeconds());
    }

    @Bean
    public StringCommandService stringCommandService(StringRedisTemplate redisTemplate, ValueCodec valueCodec,
                                                     RedisCommandRunner runner, RedisGatewayProperties properties) {
        return new StringCommandService(redisTemplate, valueCodec, runner, properties.getCounterExpireMode());
    }

    @Bean
    public ServerCommandService serverCommandService(StringRedisTemplate redisTemplate, RedisCommandRunner runner) {
        return new ServerCommandService(redisTemplate, runner);
    }

    @Bean
    public BlockingCommandDispatcher blockingCommandDispatcher(
            @Qualifier(BlockingExecutorConfig.BLOCKING_EXECUTOR) ThreadPoolTaskExecutor executor,
            RedisGatewayProperties properties) {
        return new BlockingCommandDispatcher(executor, properties.getBlocking().getGracePeriod());
    }

    @Bean
    public ProcessTimeFilter processTimeFilter() {
        return new ProcessTimeFilter();
    }

    /**
     * 健康检查指示器，注册名为 redisGateway
     */
    @Bean
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    public RedisGatewayHealthIndicator redisGatewayHealthIndicator(ServerCommandService serverCommandService) {
        return new RedisGatewayHealthIndicator(serverCommandService);
    }
}
