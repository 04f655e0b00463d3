package com.example.roster.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class PerformanceConfig {

    @Value("${roster.executor.core-size:1}")
    private int coreSize;

    @Value("${roster.executor.max-size:2}")
    private int maxSize;

    @Value("${roster.executor.queue-capacity:10}")
    private int queueCapacity;

    /**
     * シミュレーション実行用の専用スレッドプール
     */
    @Bean(name = "scheduleExecutor")
    public Executor scheduleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("Schedule-");
        executor.initialize();
        return executor;
    }
}
