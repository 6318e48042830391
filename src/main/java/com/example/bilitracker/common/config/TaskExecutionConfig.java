package com.example.bilitracker.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class TaskExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionConfig.class);

    private ExecutorService monitorCheckExecutor;

    @Bean
    public ThreadPoolTaskScheduler monitorTaskScheduler(AppTrackerProperties appTrackerProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(2, appTrackerProperties.getSchedulerPoolSize()));
        scheduler.setThreadNamePrefix("monitor-job-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Scheduled monitor job failed", t));
        return scheduler;
    }

    @Bean
    public ExecutorService monitorCheckExecutor(AppTrackerProperties appTrackerProperties) {
        int core = Math.max(1, appTrackerProperties.getCheckThreadCount());
        this.monitorCheckExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(1, appTrackerProperties.getCheckQueueSize())),
                new NamedThreadFactory("monitor-check-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.monitorCheckExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (monitorCheckExecutor != null) {
            monitorCheckExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
