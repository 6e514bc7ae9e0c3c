package com.thedigest.continuity.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${app.continuity.executor.core-pool-size:8}")
    private int corePoolSize;

    @Value("${app.continuity.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Bean("continuityExecutor")
    public ThreadPoolTaskExecutor continuityExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(200);
        // saturation degrades to running on the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("Continuity-");
        executor.initialize();
        return executor;
    }
}
