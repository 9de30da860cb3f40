package com.calmtable.restaurant.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchConfig {

    private static final Logger logger = LoggerFactory.getLogger(DispatchConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor notificationExecutor(
            @Value("${calmtable.dispatch.pool-size:4}") int poolSize,
            @Value("${calmtable.dispatch.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("notify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public TaskDispatcher taskDispatcher(@Value("${calmtable.dispatch.mode:queued}") String mode,
                                         ThreadPoolTaskExecutor notificationExecutor) {
        if ("inline".equalsIgnoreCase(mode)) {
            logger.info("[DispatchConfig] Side-effect tasks run inline");
            return new InlineTaskDispatcher();
        }
        logger.info("[DispatchConfig] Side-effect tasks run on the notification executor");
        return new QueuedTaskDispatcher(notificationExecutor);
    }
}
