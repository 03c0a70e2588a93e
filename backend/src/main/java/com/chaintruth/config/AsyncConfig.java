package com.chaintruth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. verification-executor runs confirmation re-polls in parallel, one intent per task.
 */
@Configuration
public class AsyncConfig {

    public static final String VERIFICATION_EXECUTOR = "verification-executor";

    @Bean(name = VERIFICATION_EXECUTOR)
    public Executor verificationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("verify-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
