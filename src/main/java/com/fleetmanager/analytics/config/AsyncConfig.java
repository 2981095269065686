package com.fleetmanager.analytics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for fleet-wide reports.
 *
 * Per-driver metric computations are fanned out here by FleetReportService.
 * CallerRunsPolicy: once the queue is full the requesting thread computes the
 * entry itself, so a large fleet slows down instead of failing.
 */
@Configuration
public class AsyncConfig {

    @Value("${analytics.report.pool-size:4}")
    private int poolSize;

    @Value("${analytics.report.queue-capacity:200}")
    private int queueCapacity;

    @Bean("reportTaskExecutor")
    public Executor reportTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("report-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
