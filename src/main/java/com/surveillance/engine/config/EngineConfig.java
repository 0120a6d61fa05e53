package com.surveillance.engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Shared infrastructure beans for the detection engine.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool that runs detection processing under its deadline.
     *
     * Kept apart from the {@code @Async} pool that delivers detection events: the
     * delivering thread blocks on the deadline, so sharing one pool could starve it.
     */
    @Bean
    public ThreadPoolTaskExecutor detectionProcessingExecutor(SurveillanceProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = properties.getProcessing().getWorkerThreads();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("detection-");
        executor.initialize();
        return executor;
    }

    /**
     * Pool that delivers committed detection events to the handler.
     */
    @Bean
    public ThreadPoolTaskExecutor detectionEventExecutor(SurveillanceProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = properties.getProcessing().getWorkerThreads();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("detection-event-");
        executor.initialize();
        return executor;
    }
}
