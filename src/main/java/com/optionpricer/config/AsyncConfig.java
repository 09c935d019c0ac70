package com.optionpricer.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for batch implied volatility solving. Each query is an independent task, so
 * the pool only needs to be sized for CPU; saturation falls back to running on the caller.
 */
@Configuration
public class AsyncConfig {

    @Value("${optionpricer.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${optionpricer.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${optionpricer.async.queue-capacity:1000}")
    private int queueCapacity;

    @Bean("pricingExecutor")
    public ThreadPoolTaskExecutor pricingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("pricing-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
