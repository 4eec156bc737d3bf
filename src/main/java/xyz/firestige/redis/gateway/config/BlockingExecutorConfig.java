package xyz.firestige.redis.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 阻塞命令线程池配置
 *
 * <p>BLPOP / BRPOP / BRPOPLPUSH 在此线程池上等待，Servlet 线程立即释放。
 * 池满时直接拒绝（AbortPolicy），由 web 层转换为 503，不回退到调用线程执行。
 *
 * @since 1.0
 */
@Configuration(proxyBeanMethods = false)
public class BlockingExecutorConfig {

    public static final String BLOCKING_EXECUTOR = "blockingCommandExecutor";

    @Bean(BLOCKING_EXECUTOR)
    public ThreadPoolTaskExecutor blockingCommandExecutor(RedisGatewayProperties properties) {
        RedisGatewayProperties.Blocking blocking = properties.getBlocking();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(blocking.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(blocking.getCorePoolSize(), blocking.getMaxPoolSize()));
        executor.setQueueCapacity(blocking.getQueueCapacity());
        executor.setThreadNamePrefix(blocking.getThreadNamePrefix());
        executor.setKeepAliveSeconds(blocking.getKeepAliveSeconds());
        // 关闭时中断等待中的命令，连接随之释放
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
